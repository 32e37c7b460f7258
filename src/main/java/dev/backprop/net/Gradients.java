package dev.backprop.net;

import dev.backprop.net.math.Matrix;

/**
 * Per-layer weight and bias gradients, shaped like the parameters of the network they
 * were computed for.
 */
public final class Gradients {

    private final Matrix[] weightGradients;
    private final Matrix[] biasGradients;

    Gradients(Matrix[] weightGradients, Matrix[] biasGradients) {
        this.weightGradients = weightGradients;
        this.biasGradients = biasGradients;
    }

    /**
     * Zero gradients with the parameter shapes of {@code network}.
     */
    static Gradients zerosLike(Network network) {
        int transitions = network.layerCount() - 1;
        Matrix[] w = new Matrix[transitions];
        Matrix[] b = new Matrix[transitions];
        int[] sizes = network.layerSizes();
        for (int i = 0; i < transitions; i++) {
            w[i] = Matrix.zeros(sizes[i], sizes[i + 1]);
            b[i] = Matrix.zeros(1, sizes[i + 1]);
        }
        return new Gradients(w, b);
    }

    /**
     * Elementwise sum with {@code other}, layer by layer.
     */
    Gradients plus(Gradients other) {
        Matrix[] w = new Matrix[weightGradients.length];
        Matrix[] b = new Matrix[biasGradients.length];
        for (int i = 0; i < w.length; i++) {
            w[i] = weightGradients[i].add(other.weightGradients[i]);
            b[i] = biasGradients[i].add(other.biasGradients[i]);
        }
        return new Gradients(w, b);
    }

    public int transitions() {
        return weightGradients.length;
    }

    public Matrix weights(int transition) {
        return weightGradients[transition].copy();
    }

    public Matrix biases(int transition) {
        return biasGradients[transition].copy();
    }

    Matrix weightsView(int transition) {
        return weightGradients[transition];
    }

    Matrix biasesView(int transition) {
        return biasGradients[transition];
    }
}
