package dev.backprop.net.training;

import dev.backprop.net.Network;

/**
 * Hooks into the training loop, for progress reporting and monitoring.
 *
 * Callbacks observe; they never change parameters or control flow.
 */
public interface TrainingCallback {

    /**
     * Called before the first epoch.
     */
    default void onTrainingStart(Network network, TrainingConfig config) {}

    /**
     * Called after each epoch's updates and evaluation.
     */
    default void onEpochEnd(EpochReport report) {}

    /**
     * Called when best-of-N training halves the learning rate.
     *
     * @param epoch epoch after which the decay happened
     * @param newEta learning rate for the following epochs
     */
    default void onEtaDecay(int epoch, double newEta) {}

    /**
     * Called once training reached a terminal state.
     */
    default void onTrainingEnd(Network network, TrainingResult result) {}
}
