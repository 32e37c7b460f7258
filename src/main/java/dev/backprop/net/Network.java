package dev.backprop.net;

import dev.backprop.net.losses.CrossEntropyLoss;
import dev.backprop.net.math.Matrix;
import dev.backprop.net.math.MatrixException;
import dev.backprop.net.math.Parallelization;
import dev.backprop.net.math.ops.Scale;
import dev.backprop.net.serialization.ModelFormatException;
import dev.backprop.net.serialization.ModelSerializer;
import dev.backprop.net.serialization.Serializable;
import dev.backprop.net.serialization.SerializationConstants;
import dev.backprop.net.training.ProgressCallback;
import dev.backprop.net.training.SgdTrainer;
import dev.backprop.net.training.TrainingCallback;
import dev.backprop.net.training.TrainingConfig;
import dev.backprop.net.training.TrainingResult;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.random.RandomGenerator;
import java.util.random.RandomGeneratorFactory;

/**
 * Fully-connected feedforward network with sigmoid activations, trained by mini-batch
 * gradient descent on cross-entropy loss with L2 regularization.
 * <p>
 * Transition {@code i} maps layer {@code i} to layer {@code i + 1} through a weight matrix
 * shaped {@code layers[i] x layers[i + 1]} and a bias row shaped {@code 1 x layers[i + 1]}.
 * Activations are row vectors: {@code a' = sigmoid(a . W + b)}.
 * <p>
 * Usage:
 * <pre>{@code
 * Network net = Network.newBuilder()
 *     .layers(784, 30, 10)
 *     .withSeed(42)
 *     .build();
 * net.train(trainItems, TrainingConfig.builder().epochs(30).batchSize(10).eta(0.5).build(), testItems);
 * }</pre>
 * <p>
 * Instances are not thread-safe. Only training mutates the parameters, and it does so
 * between evaluations, never concurrently with them.
 */
public class Network implements Serializable {

    static final int MAX_SERIALIZED_LAYERS = 4096;

    public static NetworkBuilder newBuilder() {
        return new NetworkBuilder();
    }

    private final int[] layers;
    private final Matrix[] weights;
    private final Matrix[] biases;
    private final RandomGenerator random;

    Network(int[] layers, Matrix[] weights, Matrix[] biases, RandomGenerator random) {
        checkShapes(layers, weights, biases);
        this.layers = Arrays.copyOf(layers, layers.length);
        this.weights = Arrays.copyOf(weights, weights.length);
        this.biases = Arrays.copyOf(biases, biases.length);
        this.random = random;
    }

    /**
     * Randomly initialized network: weights are normal and scaled by the square root of their
     * fan-in, biases are standard normal.
     */
    static Network initialize(int[] layers, RandomGenerator random) {
        Matrix[] biases = new Matrix[layers.length - 1];
        Matrix[] weights = new Matrix[layers.length - 1];

        for (int i = 0; i < layers.length - 1; i++)
            biases[i] = Matrix.random(1, layers[i + 1], random);

        for (int i = 0; i < layers.length - 1; i++)
            weights[i] = Matrix.randomNormalized(layers[i], layers[i + 1], random);

        return new Network(layers, weights, biases, random);
    }

    private static void checkShapes(int[] layers, Matrix[] weights, Matrix[] biases) {
        if (layers.length < 2)
            throw new IllegalArgumentException("Network needs at least an input and an output layer");
        if (weights.length != layers.length - 1 || biases.length != layers.length - 1)
            throw new IllegalArgumentException(String.format("Expected %d weight and bias matrices, got %d and %d",
                    layers.length - 1, weights.length, biases.length));

        for (int size : layers) {
            if (size <= 0)
                throw new IllegalArgumentException("Layer sizes must be positive: " + Arrays.toString(layers));
        }

        for (int i = 0; i < weights.length; i++) {
            if (weights[i].rows() != layers[i] || weights[i].cols() != layers[i + 1])
                throw new IllegalArgumentException(String.format("Weights %d must be %dx%d but are %dx%d",
                        i, layers[i], layers[i + 1], weights[i].rows(), weights[i].cols()));
            if (biases[i].rows() != 1 || biases[i].cols() != layers[i + 1])
                throw new IllegalArgumentException(String.format("Biases %d must be 1x%d but are %dx%d",
                        i, layers[i + 1], biases[i].rows(), biases[i].cols()));
        }
    }

    // ===============================
    // INFERENCE
    // ===============================

    /**
     * Output activations for a {@code 1 x layers[0]} input row.
     */
    public Matrix feedForward(Matrix input) {
        checkInput(input);
        try {
            Matrix activation = input;
            for (int i = 0; i < weights.length; i++)
                activation = activation.dot(weights[i]).add(biases[i]).sigmoid();
            return activation;
        } catch (MatrixException e) {
            throw invariantBroken(e);
        }
    }

    /**
     * Index of the most active output neuron for the given features.
     */
    public int predict(double[] input) {
        return feedForward(Matrix.of(input.length, input)).maxIndex();
    }

    /**
     * Mean cross-entropy over the items, NaN for an empty list.
     */
    public double cost(List<TrainItem> items) {
        if (items.isEmpty())
            return Double.NaN;

        double cost = 0.0;
        for (TrainItem item : items) {
            Matrix output = feedForward(item.input());
            try {
                cost += CrossEntropyLoss.INSTANCE.cost(output, item.target());
            } catch (MatrixException e) {
                throw new IllegalArgumentException("Item with " + item.distinctClasses() +
                        " classes does not match output layer of " + outputSize(), e);
            }
        }
        return cost / items.size();
    }

    /**
     * Fraction of items whose most active output neuron is the item's label, NaN for an empty list.
     */
    public double evaluate(List<TrainItem> items) {
        if (items.isEmpty())
            return Double.NaN;

        int correct = 0;
        for (TrainItem item : items) {
            int max = feedForward(item.input()).maxIndex();
            if ((double) max == item.label())
                correct++;
        }
        return (double) correct / items.size();
    }

    // ===============================
    // GRADIENTS
    // ===============================

    /**
     * Weight and bias gradients of the cross-entropy cost for a single item.
     */
    public Gradients backprop(TrainItem item) {
        checkInput(item.input());
        if (item.distinctClasses() != outputSize())
            throw new IllegalArgumentException("Item with " + item.distinctClasses() +
                    " classes does not match output layer of " + outputSize());

        try {
            int transitions = weights.length;
            Matrix[] nablaW = new Matrix[transitions];
            Matrix[] nablaB = new Matrix[transitions];

            // forward pass keeping every pre-activation and activation
            Matrix[] activations = new Matrix[transitions + 1];
            Matrix[] zs = new Matrix[transitions];
            activations[0] = item.input();
            for (int i = 0; i < transitions; i++) {
                zs[i] = activations[i].dot(weights[i]).add(biases[i]);
                activations[i + 1] = zs[i].sigmoid();
            }

            Matrix delta = CrossEntropyLoss.INSTANCE.outputDelta(activations[transitions], item.target());
            nablaB[transitions - 1] = delta;
            nablaW[transitions - 1] = activations[transitions - 1].transpose().dot(delta);

            for (int l = transitions - 1; l >= 1; l--) {
                delta = delta.dot(weights[l].transpose()).elementwiseMultiply(zs[l - 1].sigmoidPrime());
                nablaB[l - 1] = delta;
                nablaW[l - 1] = activations[l - 1].transpose().dot(delta);
            }

            return new Gradients(nablaW, nablaB);
        } catch (MatrixException e) {
            throw invariantBroken(e);
        }
    }

    /**
     * One gradient descent step over a mini-batch.
     * <p>
     * {@code W = W * (1 - eta * lambda / n) - sum(dW) * eta / batchSize} and
     * {@code b = b - sum(db) * eta / batchSize}. Biases are not regularized.
     *
     * @param batch items of this step
     * @param eta learning rate
     * @param lambda L2 regularization strength
     * @param trainingSetSize size of the whole training set, used to scale the weight decay
     */
    public void updateMiniBatch(List<TrainItem> batch, double eta, double lambda, int trainingSetSize) {
        updateMiniBatch(batch, eta, lambda, trainingSetSize, null);
    }

    /**
     * As {@link #updateMiniBatch(List, double, double, int)}, computing the per-item gradients on
     * {@code executor}. Gradients are summed in batch order so the result does not depend on
     * scheduling.
     */
    public void updateMiniBatch(List<TrainItem> batch, double eta, double lambda, int trainingSetSize,
                                ExecutorService executor) {
        if (batch.isEmpty())
            return;
        if (trainingSetSize <= 0)
            throw new IllegalArgumentException("Training set size must be positive: " + trainingSetSize);

        Gradients[] perItem = computeGradients(batch, executor);

        Gradients sum = Gradients.zerosLike(this);
        try {
            for (Gradients gradients : perItem)
                sum = sum.plus(gradients);

            Scale step = new Scale(eta / batch.size());
            Scale decay = new Scale(1 - eta * lambda / trainingSetSize);
            for (int i = 0; i < weights.length; i++) {
                weights[i] = weights[i].apply(decay).subtract(sum.weightsView(i).apply(step));
                biases[i] = biases[i].subtract(sum.biasesView(i).apply(step));
            }
        } catch (MatrixException e) {
            throw invariantBroken(e);
        }
    }

    private Gradients[] computeGradients(List<TrainItem> batch, ExecutorService executor) {
        Gradients[] perItem = new Gradients[batch.size()];
        int threads = Parallelization.calculateOptimalThreads(batch.size(), executor);
        if (threads <= 1) {
            for (int i = 0; i < perItem.length; i++)
                perItem[i] = backprop(batch.get(i));
            return perItem;
        }

        Parallelization.WorkRange[] ranges = Parallelization.splitWork(batch.size(), threads);
        Runnable[] tasks = new Runnable[ranges.length];
        for (int t = 0; t < ranges.length; t++) {
            final Parallelization.WorkRange range = ranges[t];
            tasks[t] = () -> {
                for (int i = range.start; i < range.end; i++)
                    perItem[i] = backprop(batch.get(i));
            };
        }
        Parallelization.executeParallel(executor, tasks);
        return perItem;
    }

    // ===============================
    // TRAINING
    // ===============================

    /**
     * Train with console progress reporting.
     *
     * @param items training items
     * @param config hyperparameters
     * @param testItems held-out items for evaluation and best-of-N selection; may be empty
     */
    public TrainingResult train(List<TrainItem> items, TrainingConfig config, List<TrainItem> testItems) {
        return train(items, config, testItems, new ProgressCallback(config.printCost));
    }

    /**
     * Train, reporting every epoch to the given callbacks.
     */
    public TrainingResult train(List<TrainItem> items, TrainingConfig config, List<TrainItem> testItems,
                                TrainingCallback... callbacks) {
        SgdTrainer trainer = new SgdTrainer(this, config);
        for (TrainingCallback callback : callbacks)
            trainer.withCallback(callback);
        return trainer.fit(items, testItems);
    }

    // ===============================
    // SNAPSHOTS
    // ===============================

    /**
     * Deep copy; the copy shares no matrix storage with this network.
     */
    public Network copy() {
        Matrix[] w = new Matrix[weights.length];
        Matrix[] b = new Matrix[biases.length];
        for (int i = 0; i < weights.length; i++) {
            w[i] = weights[i].copy();
            b[i] = biases[i].copy();
        }
        return new Network(layers, w, b, random);
    }

    /**
     * Replace this network's parameters with copies of {@code snapshot}'s.
     *
     * @throws IllegalArgumentException if the layer sizes differ
     */
    public void restoreFrom(Network snapshot) {
        if (!Arrays.equals(layers, snapshot.layers))
            throw new IllegalArgumentException("Cannot restore " + Arrays.toString(layers) +
                    " from " + Arrays.toString(snapshot.layers));
        for (int i = 0; i < weights.length; i++) {
            weights[i] = snapshot.weights[i].copy();
            biases[i] = snapshot.biases[i].copy();
        }
    }

    // ===============================
    // ACCESSORS
    // ===============================

    public int[] layerSizes() {
        return Arrays.copyOf(layers, layers.length);
    }

    public int layerCount() {
        return layers.length;
    }

    public int inputSize() {
        return layers[0];
    }

    public int outputSize() {
        return layers[layers.length - 1];
    }

    public Matrix weights(int transition) {
        return weights[transition].copy();
    }

    public Matrix biases(int transition) {
        return biases[transition].copy();
    }

    /**
     * Source of randomness used for initialization and, unless the training config
     * overrides it, for shuffling.
     */
    public RandomGenerator getRandom() {
        return random;
    }

    private void checkInput(Matrix input) {
        if (input.rows() != 1 || input.cols() != layers[0])
            throw new IllegalArgumentException(String.format("Input must be 1x%d but is %dx%d",
                    layers[0], input.rows(), input.cols()));
    }

    private static IllegalStateException invariantBroken(MatrixException e) {
        return new IllegalStateException("Network layer shapes are inconsistent", e);
    }

    // ===============================
    // SAVE/LOAD METHODS
    // ===============================

    /**
     * Save this network to a file with compression.
     *
     * @param path file path to save to
     * @throws IOException if save fails
     */
    public void save(Path path) throws IOException {
        ModelSerializer.save(this, path);
    }

    /**
     * Load a network from a file.
     *
     * @param path file path to load from
     * @return loaded network
     * @throws IOException if load fails or the file is malformed
     */
    public static Network load(Path path) throws IOException {
        return ModelSerializer.load(path);
    }

    @Override
    public void writeTo(DataOutputStream out, int version) throws IOException {
        out.writeInt(layers.length);
        for (int size : layers)
            out.writeInt(size);

        for (int i = 0; i < weights.length; i++) {
            weights[i].writeTo(out, version);
            biases[i].writeTo(out, version);
        }
    }

    /**
     * Static method to deserialize a Network from stream.
     */
    public static Network deserialize(DataInputStream in, int version) throws IOException {
        int layerCount = in.readInt();
        if (layerCount < 2 || layerCount > MAX_SERIALIZED_LAYERS)
            throw new ModelFormatException("Network needs between 2 and " + MAX_SERIALIZED_LAYERS +
                    " layers, found " + layerCount);

        int[] layers = new int[layerCount];
        for (int i = 0; i < layerCount; i++) {
            layers[i] = in.readInt();
            if (layers[i] <= 0)
                throw new ModelFormatException("Layer sizes must be positive, layer " + i + " has " + layers[i]);
        }

        Matrix[] weights = new Matrix[layerCount - 1];
        Matrix[] biases = new Matrix[layerCount - 1];
        for (int i = 0; i < layerCount - 1; i++) {
            if ((long) layers[i] * layers[i + 1] > Integer.MAX_VALUE)
                throw new ModelFormatException("Weights " + i + " of " + layers[i] + "x" + layers[i + 1] + " are too large");
            weights[i] = Matrix.deserialize(in, version, layers[i], layers[i + 1]);
            biases[i] = Matrix.deserialize(in, version, 1, layers[i + 1]);
        }

        try {
            return new Network(layers, weights, biases, RandomGeneratorFactory.of(NetworkBuilder.RANDOM_ALGORITHM).create());
        } catch (IllegalArgumentException e) {
            throw new ModelFormatException("Inconsistent network data: " + e.getMessage());
        }
    }

    @Override
    public int getSerializedSize(int version) {
        int size = 4 + 4 * layers.length;
        for (int i = 0; i < weights.length; i++)
            size += weights[i].getSerializedSize(version) + biases[i].getSerializedSize(version);
        return size;
    }

    @Override
    public int getTypeId() {
        return SerializationConstants.TYPE_NETWORK;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Neural network:\nlayers:");
        for (int size : layers)
            sb.append(' ').append(size);
        for (int i = 0; i < weights.length; i++)
            sb.append(String.format("%nweights layer %d to %d:%n", i, i + 1)).append(weights[i]);
        for (int i = 0; i < biases.length; i++)
            sb.append(String.format("%nbiases layer %d:%n", i + 1)).append(biases[i]);
        return sb.toString();
    }
}
