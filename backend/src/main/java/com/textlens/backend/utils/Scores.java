package com.textlens.backend.utils;

public final class Scores {

    private Scores() {}

    public static double round2(double value) {
        if (!Double.isFinite(value)) return 0.0;
        return Math.round(value * 100.0) / 100.0;
    }

    /** Clamps into [min, max]; NaN maps to {@code min}. */
    public static double clip(double value, double min, double max) {
        if (Double.isNaN(value)) return min;
        return Math.max(min, Math.min(max, value));
    }

    public static double[] softmax(double[] logits) {
        double max = Double.NEGATIVE_INFINITY;
        for (double l : logits) max = Math.max(max, l);
        double[] out = new double[logits.length];
        double sum = 0.0;
        for (int i = 0; i < logits.length; i++) {
            out[i] = Math.exp(logits[i] - max);
            sum += out[i];
        }
        for (int i = 0; i < out.length; i++) out[i] /= sum;
        return out;
    }

    /** Cross-entropy of {@code logits} against the one-hot {@code label}. */
    public static double crossEntropy(double[] logits, int label) {
        double max = Double.NEGATIVE_INFINITY;
        for (double l : logits) max = Math.max(max, l);
        double sum = 0.0;
        for (double l : logits) sum += Math.exp(l - max);
        return max + Math.log(sum) - logits[label];
    }
}
