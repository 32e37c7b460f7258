package dev.backprop.net.training;

import dev.backprop.net.Network;
import dev.backprop.net.TrainItem;

import java.util.ArrayList;
import java.util.List;
import java.util.random.RandomGenerator;

/**
 * Mini-batch gradient descent training loop.
 *
 * <p>Every epoch shuffles the training items, splits them into mini-batches, applies one
 * update per batch and evaluates on the held-out items. Fixed-epoch mode stops after the
 * configured number of epochs. Best-of-N mode snapshots the network whenever the held-out
 * cost improves, anneals the learning rate on plateaus (see {@link AnnealingEarlyStopping})
 * and finally restores the best snapshot into the trained network.
 */
public class SgdTrainer {

    private final Network network;
    private final TrainingConfig config;
    private final List<TrainingCallback> callbacks = new ArrayList<>();

    public SgdTrainer(Network network, TrainingConfig config) {
        this.network = network;
        this.config = config;
    }

    public SgdTrainer withCallback(TrainingCallback callback) {
        callbacks.add(callback);
        return this;
    }

    /**
     * Train the network in place.
     *
     * @param items training items
     * @param testItems held-out items; required in best-of-N mode, may be empty otherwise
     * @return summary of the run
     */
    public TrainingResult fit(List<TrainItem> items, List<TrainItem> testItems) {
        checkItems("training", items);
        checkItems("test", testItems);
        boolean bestOfN = config.isBestOfN();
        boolean hasTestData = !testItems.isEmpty();
        if (bestOfN && !hasTestData)
            throw new IllegalArgumentException("Best-of-N training needs held-out test items");

        RandomGenerator random = config.random != null ? config.random : network.getRandom();
        int limit = config.epochLimit();
        double eta = config.eta;

        AnnealingEarlyStopping policy = null;
        Network best = null;
        if (bestOfN) {
            policy = new AnnealingEarlyStopping(limit, config.eta, config.etaDecayFraction, network.cost(testItems));
            best = network.copy();
        }

        for (TrainingCallback callback : callbacks)
            callback.onTrainingStart(network, config);

        double cost = Double.NaN;
        int epoch = 0;
        StopReason reason;
        while (true) {
            if (!bestOfN && epoch >= limit) {
                reason = StopReason.EPOCHS_EXHAUSTED;
                break;
            }

            runEpoch(items, eta, random);

            cost = hasTestData && (bestOfN || config.printCost) ? network.cost(testItems) : Double.NaN;
            double accuracy = hasTestData ? network.evaluate(testItems) : Double.NaN;
            EpochReport report = new EpochReport(epoch, accuracy, cost, eta);
            for (TrainingCallback callback : callbacks)
                callback.onEpochEnd(report);
            epoch++;

            if (!bestOfN)
                continue;

            AnnealingEarlyStopping.Decision decision = policy.record(cost);
            if (decision == AnnealingEarlyStopping.Decision.IMPROVED) {
                best = network.copy();
            } else if (decision == AnnealingEarlyStopping.Decision.DECAYED) {
                eta = policy.getEta();
                for (TrainingCallback callback : callbacks)
                    callback.onEtaDecay(report.epoch(), eta);
            } else if (decision == AnnealingEarlyStopping.Decision.STOPPED) {
                network.restoreFrom(best);
                cost = policy.getBestCost();
                reason = StopReason.PATIENCE_EXHAUSTED;
                break;
            }
        }

        TrainingResult result = new TrainingResult(epoch, eta, cost, reason);
        for (TrainingCallback callback : callbacks)
            callback.onTrainingEnd(network, result);
        return result;
    }

    private void runEpoch(List<TrainItem> items, double eta, RandomGenerator random) {
        List<TrainItem> shuffled = MiniBatches.shuffle(items, random);
        for (List<TrainItem> batch : MiniBatches.split(shuffled, config.batchSize))
            network.updateMiniBatch(batch, eta, config.lambda, items.size(), config.executor);
    }

    private void checkItems(String kind, List<TrainItem> items) {
        for (TrainItem item : items) {
            if (item.featureCount() != network.inputSize())
                throw new IllegalArgumentException(String.format("%s item has %d features, input layer has %d",
                        kind, item.featureCount(), network.inputSize()));
            if (item.distinctClasses() != network.outputSize())
                throw new IllegalArgumentException(String.format("%s item has %d classes, output layer has %d",
                        kind, item.distinctClasses(), network.outputSize()));
        }
    }
}
