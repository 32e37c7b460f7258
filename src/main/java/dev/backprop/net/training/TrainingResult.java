package dev.backprop.net.training;

/**
 * Summary of a finished training run.
 *
 * @param epochsRun number of epochs performed
 * @param finalEta learning rate at the end of training
 * @param cost held-out cost of the returned parameters (the best snapshot in best-of-N mode), NaN if not computed
 * @param stopReason terminal state reached
 */
public record TrainingResult(int epochsRun, double finalEta, double cost, StopReason stopReason) {
}
