package dev.backprop.net.training;

import java.util.concurrent.ExecutorService;
import java.util.random.RandomGenerator;

/**
 * Hyperparameters for {@link SgdTrainer}.
 *
 * <p>{@code epochs} selects the mode: a positive value trains for exactly that many epochs;
 * a negative value trains "best of N", where {@code |epochs|} is the number of epochs without
 * a validation cost improvement tolerated before the learning rate is halved or training stops.
 */
public class TrainingConfig {

    public final int epochs;
    public final int batchSize;
    public final double eta;
    public final double etaDecayFraction;
    public final double lambda;
    public final boolean printCost;
    public final ExecutorService executor; // null = sequential gradient computation
    public final RandomGenerator random;   // null = the network's own generator

    private TrainingConfig(Builder builder) {
        this.epochs = builder.epochs;
        this.batchSize = builder.batchSize;
        this.eta = builder.eta;
        this.etaDecayFraction = builder.etaDecayFraction;
        this.lambda = builder.lambda;
        this.printCost = builder.printCost;
        this.executor = builder.executor;
        this.random = builder.random;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isBestOfN() {
        return epochs < 0;
    }

    /**
     * Epoch budget in fixed mode, patience window in best-of-N mode.
     */
    public int epochLimit() {
        return Math.abs(epochs);
    }

    @Override
    public String toString() {
        return String.format("TrainingConfig[epochs=%d, batchSize=%d, eta=%s, etaDecayFraction=%s, lambda=%s, printCost=%s]",
                epochs, batchSize, eta, etaDecayFraction, lambda, printCost);
    }

    public static class Builder {
        private int epochs = 30;
        private int batchSize = 10;
        private double eta = 0.5;
        private double etaDecayFraction = 0.0;
        private double lambda = 0.0;
        private boolean printCost = false;
        private ExecutorService executor = null;
        private RandomGenerator random = null;

        /**
         * Positive: fixed epoch count. Negative: best-of-N with a patience of {@code -epochs}.
         */
        public Builder epochs(int epochs) {
            if (epochs == 0)
                throw new IllegalArgumentException("Epochs must be non-zero");
            this.epochs = epochs;
            return this;
        }

        /**
         * Best-of-N training with the given patience window.
         */
        public Builder bestOfN(int patience) {
            if (patience <= 0)
                throw new IllegalArgumentException("Patience must be positive");
            this.epochs = -patience;
            return this;
        }

        public Builder batchSize(int batchSize) {
            if (batchSize <= 0)
                throw new IllegalArgumentException("Batch size must be positive");
            this.batchSize = batchSize;
            return this;
        }

        public Builder eta(double eta) {
            if (eta < 0 || Double.isNaN(eta))
                throw new IllegalArgumentException("Learning rate must be non-negative: " + eta);
            this.eta = eta;
            return this;
        }

        /**
         * In best-of-N mode, the learning rate is halved on a plateau while
         * {@code eta * fraction > initialEta}; 0 disables decay.
         */
        public Builder etaDecayFraction(double fraction) {
            if (fraction < 0 || Double.isNaN(fraction))
                throw new IllegalArgumentException("Eta decay fraction must be non-negative: " + fraction);
            this.etaDecayFraction = fraction;
            return this;
        }

        public Builder lambda(double lambda) {
            if (lambda < 0 || Double.isNaN(lambda))
                throw new IllegalArgumentException("Regularization strength must be non-negative: " + lambda);
            this.lambda = lambda;
            return this;
        }

        public Builder printCost(boolean printCost) {
            this.printCost = printCost;
            return this;
        }

        /**
         * Compute per-item gradients of a mini-batch on this executor.
         */
        public Builder executor(ExecutorService executor) {
            this.executor = executor;
            return this;
        }

        /**
         * Source of randomness for shuffling; defaults to the network's generator.
         */
        public Builder random(RandomGenerator random) {
            this.random = random;
            return this;
        }

        public TrainingConfig build() {
            return new TrainingConfig(this);
        }
    }
}
