package dev.backprop.net.examples;

import dev.backprop.net.Network;
import dev.backprop.net.TrainItem;
import dev.backprop.net.training.TrainingConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

public class XorDemo {

    public static void main(String[] args) throws IOException {
        Network net = Network.newBuilder()
                .layers(2, 8, 2)
                .withSeed(7)
                .build();

        List<TrainItem> data = List.of(
                TrainItem.of(new double[]{0, 0}, 0, 2),
                TrainItem.of(new double[]{0, 1}, 1, 2),
                TrainItem.of(new double[]{1, 0}, 1, 2),
                TrainItem.of(new double[]{1, 1}, 0, 2));

        TrainingConfig config = TrainingConfig.builder()
                .epochs(1000)
                .batchSize(1)
                .eta(2.0)
                .build();

        net.train(data, config, List.of());

        Path file = args.length > 0 ? Path.of(args[0]) : Files.createTempFile("xor", ".bpnn");
        net.save(file);
        Network restored = Network.load(file);

        System.out.println("0 xor 0 = " + restored.predict(new double[]{0, 0}));
        System.out.println("0 xor 1 = " + restored.predict(new double[]{0, 1}));
        System.out.println("1 xor 0 = " + restored.predict(new double[]{1, 0}));
        System.out.println("1 xor 1 = " + restored.predict(new double[]{1, 1}));
        System.out.printf("accuracy %.2f, saved to %s%n", restored.evaluate(data), file);
    }
}
