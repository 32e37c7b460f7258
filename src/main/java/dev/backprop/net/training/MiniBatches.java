package dev.backprop.net.training;

import java.util.ArrayList;
import java.util.List;
import java.util.random.RandomGenerator;

/**
 * Shuffling and batching of training items.
 */
public final class MiniBatches {

    /**
     * Contiguous batches of {@code batchSize} items.
     *
     * <p>The batch count is {@code n / batchSize} rounded half up. Every batch holds exactly
     * {@code batchSize} items except the last, which runs to the end of the list: it absorbs a
     * remainder below half a batch, or is short when the remainder rounded up to its own batch.
     * A list shorter than half a batch yields no batches.
     */
    public static <T> List<List<T>> split(List<T> items, int batchSize) {
        if (batchSize <= 0)
            throw new IllegalArgumentException("Batch size must be positive: " + batchSize);

        int n = items.size();
        int count = (int) ((double) n / batchSize + 0.5);
        List<List<T>> batches = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            int start = i * batchSize;
            int end = i == count - 1 ? n : start + batchSize;
            batches.add(items.subList(start, end));
        }
        return batches;
    }

    /**
     * Uniformly random permutation of {@code items} (Fisher-Yates). The input is not modified.
     */
    public static <T> List<T> shuffle(List<T> items, RandomGenerator random) {
        List<T> shuffled = new ArrayList<>(items);
        for (int i = shuffled.size() - 1; i > 0; i--) {
            int j = random.nextInt(i + 1);
            T tmp = shuffled.get(i);
            shuffled.set(i, shuffled.get(j));
            shuffled.set(j, tmp);
        }
        return shuffled;
    }

    private MiniBatches() {}
}
