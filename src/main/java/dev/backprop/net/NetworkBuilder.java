package dev.backprop.net;

import java.util.Arrays;
import java.util.random.RandomGenerator;
import java.util.random.RandomGeneratorFactory;

/**
 * Builder for randomly initialized networks.
 *
 * Example usage:
 * <pre>{@code
 * // Reproducible: same seed, same initial weights and same shuffling
 * Network net = Network.newBuilder()
 *     .layers(784, 30, 10)
 *     .withSeed(42)
 *     .build();
 *
 * // Caller-owned source of randomness
 * Network shared = Network.newBuilder()
 *     .layers(2, 4, 2)
 *     .random(myGenerator)
 *     .build();
 * }</pre>
 */
public class NetworkBuilder {

    static final String RANDOM_ALGORITHM = "Xoroshiro128PlusPlus";

    private int[] layers;
    private Long seed;
    private RandomGenerator random;

    /**
     * Sizes of every layer, input first and output last.
     */
    public NetworkBuilder layers(int... sizes) {
        if (sizes.length < 2)
            throw new IllegalArgumentException("Network needs at least an input and an output layer");
        for (int size : sizes) {
            if (size <= 0)
                throw new IllegalArgumentException("Layer sizes must be positive: " + Arrays.toString(sizes));
        }
        this.layers = Arrays.copyOf(sizes, sizes.length);
        return this;
    }

    /**
     * Seed the network's random generator. Ignored when {@link #random(RandomGenerator)} is set.
     */
    public NetworkBuilder withSeed(long seed) {
        this.seed = seed;
        return this;
    }

    /**
     * Use the given generator for weight initialization and shuffling.
     */
    public NetworkBuilder random(RandomGenerator random) {
        if (random == null)
            throw new IllegalArgumentException("Random generator cannot be null");
        this.random = random;
        return this;
    }

    public Network build() {
        if (layers == null)
            throw new IllegalStateException("Layer sizes must be set before build()");
        return Network.initialize(layers, resolveRandom());
    }

    private RandomGenerator resolveRandom() {
        if (random != null)
            return random;
        RandomGeneratorFactory<RandomGenerator> factory = RandomGeneratorFactory.of(RANDOM_ALGORITHM);
        return seed != null ? factory.create(seed) : factory.create();
    }
}
