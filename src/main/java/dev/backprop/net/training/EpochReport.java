package dev.backprop.net.training;

/**
 * Outcome of one training epoch.
 *
 * @param epoch 0-based epoch index
 * @param accuracy fraction of held-out items classified correctly, NaN without held-out items
 * @param cost held-out cost, NaN when it was not computed
 * @param eta learning rate used for this epoch
 */
public record EpochReport(int epoch, double accuracy, double cost, double eta) {

    public boolean hasAccuracy() {
        return !Double.isNaN(accuracy);
    }

    public boolean hasCost() {
        return !Double.isNaN(cost);
    }
}
