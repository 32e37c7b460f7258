package dev.backprop.net.training;

import dev.backprop.net.Network;

import java.io.PrintStream;

/**
 * Progress reporting callback that prints training progress to console.
 */
public class ProgressCallback implements TrainingCallback {

    private final boolean printCost;
    private final PrintStream out;
    private long trainingStartTime;

    public ProgressCallback(boolean printCost) {
        this(printCost, System.out);
    }

    public ProgressCallback(boolean printCost, PrintStream out) {
        this.printCost = printCost;
        this.out = out;
    }

    @Override
    public void onTrainingStart(Network network, TrainingConfig config) {
        trainingStartTime = System.currentTimeMillis();
        if (config.isBestOfN())
            out.printf("Training best of %d with eta=%f%n", config.epochLimit(), config.eta);
        else
            out.printf("Training %d epochs with eta=%f%n", config.epochLimit(), config.eta);
    }

    @Override
    public void onEpochEnd(EpochReport report) {
        if (report.hasAccuracy()) {
            out.printf("Epoch %d: %f%n", report.epoch(), report.accuracy());
            if (printCost && report.hasCost())
                out.printf("Cost: %f%n", report.cost());
        } else {
            out.printf("Epoch %d finished.%n", report.epoch());
        }
    }

    @Override
    public void onEtaDecay(int epoch, double newEta) {
        out.printf("No improvement, learning rate decayed to %f%n", newEta);
    }

    @Override
    public void onTrainingEnd(Network network, TrainingResult result) {
        long totalTime = System.currentTimeMillis() - trainingStartTime;
        out.printf("Training completed after %d epochs in %dms (%s)%n",
                result.epochsRun(), totalTime, result.stopReason());
    }
}
