package dev.backprop.net.training;

/**
 * Best-of-N policy: early stopping on validation cost with learning rate annealing.
 *
 * <p>Each epoch's cost is compared with the best seen so far. After {@code patience}
 * consecutive epochs without a strict improvement, the learning rate is halved if
 * {@code eta * decayFraction > initialEta}, and the counter restarts; otherwise training
 * stops. The comparison is against the initial learning rate, not the current one, so a
 * fraction of {@code f} allows roughly {@code log2(f)} halvings before stopping.
 */
public class AnnealingEarlyStopping {

    public enum Decision {
        /** New best cost: snapshot the parameters. */
        IMPROVED,
        /** No improvement, patience not yet exhausted. */
        NO_IMPROVEMENT,
        /** Patience exhausted, learning rate halved, counter reset. */
        DECAYED,
        /** Patience exhausted with no decay left: restore the best snapshot. */
        STOPPED
    }

    private final int patience;
    private final double initialEta;
    private final double decayFraction;

    private double eta;
    private double bestCost;
    private int epochsWithoutImprovement;
    private boolean stopped;

    /**
     * @param patience epochs without improvement tolerated before acting
     * @param initialEta starting learning rate
     * @param decayFraction decay threshold factor, 0 disables decay
     * @param initialCost validation cost before training
     */
    public AnnealingEarlyStopping(int patience, double initialEta, double decayFraction, double initialCost) {
        if (patience <= 0)
            throw new IllegalArgumentException("Patience must be positive");
        this.patience = patience;
        this.initialEta = initialEta;
        this.decayFraction = decayFraction;
        this.eta = initialEta;
        this.bestCost = initialCost;
    }

    /**
     * Record the validation cost of the epoch that just finished.
     */
    public Decision record(double cost) {
        if (stopped)
            throw new IllegalStateException("Training already stopped");

        if (cost < bestCost) {
            bestCost = cost;
            epochsWithoutImprovement = 0;
            return Decision.IMPROVED;
        }

        epochsWithoutImprovement++;
        if (epochsWithoutImprovement < patience)
            return Decision.NO_IMPROVEMENT;

        if (decayFraction > 0 && eta * decayFraction > initialEta) {
            eta /= 2.0;
            epochsWithoutImprovement = 0;
            return Decision.DECAYED;
        }

        stopped = true;
        return Decision.STOPPED;
    }

    public double getEta() {
        return eta;
    }

    public double getBestCost() {
        return bestCost;
    }

    public int getEpochsWithoutImprovement() {
        return epochsWithoutImprovement;
    }

    public boolean isStopped() {
        return stopped;
    }
}
