package fr.lapetina.microbatch.predictor;

/**
 * Numerically stable softmax.
 */
public final class Softmax {

    private Softmax() {
        // Utility class
    }

    public static double[] apply(double[] logits) {
        if (logits == null || logits.length == 0) {
            throw new IllegalArgumentException("Logits must not be empty");
        }
        double max = Double.NEGATIVE_INFINITY;
        for (double logit : logits) {
            max = Math.max(max, logit);
        }

        double[] result = new double[logits.length];
        double sum = 0.0;
        for (int i = 0; i < logits.length; i++) {
            result[i] = Math.exp(logits[i] - max);
            sum += result[i];
        }
        for (int i = 0; i < result.length; i++) {
            result[i] /= sum;
        }
        return result;
    }
}
