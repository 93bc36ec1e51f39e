package fr.lapetina.microbatch.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PredictionTest {

    @Test
    @DisplayName("should take the argmax of the distribution as label")
    void shouldTakeArgmax() {
        Prediction prediction = Prediction.fromDistribution(new double[]{0.1, 0.7, 0.2});

        assertThat(prediction.label()).isEqualTo(ClassLabel.PRODUCT);
        assertThat(prediction.confidence()).isEqualTo(0.7);
    }

    @Test
    @DisplayName("should resolve ties to the lowest index")
    void shouldResolveTiesToLowestIndex() {
        Prediction prediction = Prediction.fromDistribution(new double[]{0.2, 0.4, 0.4});

        assertThat(prediction.label()).isEqualTo(ClassLabel.PRODUCT);
    }

    @Test
    @DisplayName("should not expose its distribution for mutation")
    void shouldCopyDistribution() {
        double[] probabilities = {0.8, 0.1, 0.1};
        Prediction prediction = Prediction.fromDistribution(probabilities);

        probabilities[0] = 0.0;
        prediction.distribution()[1] = 0.9;

        assertThat(prediction.distribution()).containsExactly(0.8, 0.1, 0.1);
    }

    @Test
    @DisplayName("should reject confidence outside [0,1]")
    void shouldRejectInvalidConfidence() {
        assertThatThrownBy(() -> new Prediction(ClassLabel.NONE, 1.5, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Prediction(ClassLabel.NONE, Double.NaN, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should map unknown label indexes to none")
    void shouldMapUnknownIndexToNone() {
        assertThat(ClassLabel.fromIndex(2)).isEqualTo(ClassLabel.SERIES);
        assertThat(ClassLabel.fromIndex(7)).isEqualTo(ClassLabel.NONE);
        assertThat(ClassLabel.fromIndex(-1)).isEqualTo(ClassLabel.NONE);
        assertThat(ClassLabel.SERIES.wireName()).isEqualTo("series");
    }

    @Test
    @DisplayName("should build error responses without a label")
    void shouldBuildErrorResponse() {
        ClassificationRequest request = ClassificationRequest.of(42L, "Hello");

        ClassificationResponse response = ClassificationResponse.error(
                request, ErrorType.INFERENCE_ERROR, "model crashed", 1);

        assertThat(response.isError()).isTrue();
        assertThat(response.requestId()).isEqualTo(42L);
        assertThat(response.label()).isNull();
        assertThat(response.errorMessage()).isEqualTo("model crashed");
        assertThat(response.processingTime()).isGreaterThanOrEqualTo(Duration.ZERO);
    }
}
