package dev.backprop.net.training;

import dev.backprop.net.Network;
import dev.backprop.net.TrainItem;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProgressCallbackTest {

    private static final List<TrainItem> ITEMS = List.of(
            TrainItem.of(new double[]{0, 1}, 1, 2),
            TrainItem.of(new double[]{1, 1}, 0, 2));

    private static String run(boolean printCost, List<TrainItem> testItems) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(bytes, true, StandardCharsets.UTF_8);
        Network net = Network.newBuilder().layers(2, 2, 2).withSeed(1).build();
        TrainingConfig config = TrainingConfig.builder().epochs(2).batchSize(1).printCost(printCost).build();

        new SgdTrainer(net, config).withCallback(new ProgressCallback(printCost, out)).fit(ITEMS, testItems);
        return bytes.toString(StandardCharsets.UTF_8);
    }

    @Test
    void testPrintsAccuracyPerEpoch() {
        String output = run(false, ITEMS);

        assertTrue(output.contains("Epoch 0: "));
        assertTrue(output.contains("Epoch 1: "));
        assertFalse(output.contains("Cost: "));
        assertTrue(output.contains("Training completed after 2 epochs"));
    }

    @Test
    void testPrintsCostWhenAsked() {
        String output = run(true, ITEMS);

        assertTrue(output.contains("Cost: "));
    }

    @Test
    void testWithoutTestDataOnlyMarksEpochs() {
        String output = run(true, List.of());

        assertTrue(output.contains("Epoch 0 finished."));
        assertTrue(output.contains("Epoch 1 finished."));
        assertFalse(output.contains("Cost: "));
    }
}
