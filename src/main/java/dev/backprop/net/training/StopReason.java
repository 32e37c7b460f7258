package dev.backprop.net.training;

/**
 * Terminal state of a training run.
 */
public enum StopReason {
    /** Fixed-epoch mode ran its full epoch budget. */
    EPOCHS_EXHAUSTED,
    /** Best-of-N mode ran out of patience with no learning rate decay left. */
    PATIENCE_EXHAUSTED
}
