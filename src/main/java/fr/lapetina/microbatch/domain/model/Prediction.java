package fr.lapetina.microbatch.domain.model;

import java.util.Arrays;

/**
 * Output of a predictor for one input: the winning label, its probability
 * and the full distribution over {@link ClassLabel}.
 */
public record Prediction(
        ClassLabel label,
        double confidence,
        double[] distribution
) {
    public Prediction {
        if (label == null) {
            throw new IllegalArgumentException("Label is required");
        }
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be in [0,1]: " + confidence);
        }
        distribution = distribution != null ? distribution.clone() : new double[0];
    }

    /**
     * Builds a prediction from a probability distribution, taking the argmax as label.
     * Ties resolve to the lowest index.
     */
    public static Prediction fromDistribution(double[] probabilities) {
        if (probabilities == null || probabilities.length == 0) {
            throw new IllegalArgumentException("Distribution must not be empty");
        }
        int best = 0;
        for (int i = 1; i < probabilities.length; i++) {
            if (probabilities[i] > probabilities[best]) {
                best = i;
            }
        }
        return new Prediction(ClassLabel.fromIndex(best), probabilities[best], probabilities);
    }

    @Override
    public double[] distribution() {
        return distribution.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Prediction that)) return false;
        return label == that.label
                && Double.compare(confidence, that.confidence) == 0
                && Arrays.equals(distribution, that.distribution);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * label.hashCode() + Double.hashCode(confidence)) + Arrays.hashCode(distribution);
    }

    @Override
    public String toString() {
        return "Prediction{label=" + label + ", confidence=" + confidence
                + ", distribution=" + Arrays.toString(distribution) + '}';
    }
}
