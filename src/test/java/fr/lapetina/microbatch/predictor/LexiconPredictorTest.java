package fr.lapetina.microbatch.predictor;

import fr.lapetina.microbatch.domain.model.ClassLabel;
import fr.lapetina.microbatch.domain.model.Prediction;
import fr.lapetina.microbatch.infrastructure.config.ClassifierConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class LexiconPredictorTest {

    private LexiconPredictor predictor;

    @BeforeEach
    void setUp() {
        predictor = new LexiconPredictor(Map.of(
                ClassLabel.PRODUCT, Set.of("phone", "Laptop"),
                ClassLabel.SERIES, Set.of("season", "episode")
        ), 2.0);
    }

    @Test
    @DisplayName("should return one prediction per input in order")
    void shouldPreserveOrder() throws Exception {
        List<Prediction> predictions = predictor.predict(List.of(
                "Hello", "I want a new phone", "When is the next season?"));

        assertThat(predictions).extracting(Prediction::label)
                .containsExactly(ClassLabel.NONE, ClassLabel.PRODUCT, ClassLabel.SERIES);
    }

    @Test
    @DisplayName("should produce distributions that sum to one")
    void shouldProduceNormalizedDistributions() throws Exception {
        for (Prediction prediction : predictor.predict(List.of("Hello", "laptop phone", "episode"))) {
            assertThat(Arrays.stream(prediction.distribution()).sum()).isCloseTo(1.0, within(1e-9));
            assertThat(prediction.confidence()).isBetween(0.0, 1.0);
        }
    }

    @Test
    @DisplayName("should match keywords case-insensitively on word boundaries")
    void shouldTokenize() {
        assertThat(predictor.logits("LAPTOP, laptop!")[ClassLabel.PRODUCT.index()]).isEqualTo(4.0);
        assertThat(predictor.logits("laptops")[ClassLabel.PRODUCT.index()]).isEqualTo(0.0);
        assertThat(predictor.logits("anything")[ClassLabel.NONE.index()]).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should be deterministic for the same input")
    void shouldBeDeterministic() throws Exception {
        List<String> batch = List.of("phone season", "Hello");
        assertThat(predictor.predict(batch)).isEqualTo(predictor.predict(batch));
    }

    @Test
    @DisplayName("should fail the batch on a null input")
    void shouldRejectNullInput() {
        assertThatThrownBy(() -> predictor.predict(Arrays.asList("ok", null)))
                .isInstanceOf(InferenceException.class);
    }

    @Nested
    @DisplayName("load")
    class Load {

        @TempDir
        Path tempDir;

        @Test
        @DisplayName("should load the lexicon from configuration")
        void shouldLoadFromConfig() throws Exception {
            ClassifierConfig.ModelConfig config = new ClassifierConfig.ModelConfig();
            config.setLexicon(Map.of("product", List.of("phone")));

            LexiconPredictor loaded = LexiconPredictor.load(config);

            assertThat(loaded.predict(List.of("phone")).get(0).label()).isEqualTo(ClassLabel.PRODUCT);
        }

        @Test
        @DisplayName("should fall back to a lexicon file at the model path")
        void shouldLoadFromFile() throws Exception {
            Path file = tempDir.resolve("lexicon.yaml");
            Files.writeString(file, "series:\n  - episode\n");
            ClassifierConfig.ModelConfig config = new ClassifierConfig.ModelConfig();
            config.setPath(file.toString());

            LexiconPredictor loaded = LexiconPredictor.load(config);

            assertThat(loaded.predict(List.of("new episode")).get(0).label()).isEqualTo(ClassLabel.SERIES);
        }

        @Test
        @DisplayName("should fail when no lexicon is available")
        void shouldFailWithoutLexicon() {
            ClassifierConfig.ModelConfig config = new ClassifierConfig.ModelConfig();
            config.setPath(tempDir.resolve("missing").toString());

            assertThatThrownBy(() -> LexiconPredictor.load(config))
                    .isInstanceOf(InferenceException.class)
                    .hasMessageContaining("missing");
        }

        @Test
        @DisplayName("should reject unknown labels")
        void shouldRejectUnknownLabel() {
            ClassifierConfig.ModelConfig config = new ClassifierConfig.ModelConfig();
            config.setLexicon(Map.of("movie", List.of("film")));

            assertThatThrownBy(() -> LexiconPredictor.load(config))
                    .isInstanceOf(InferenceException.class)
                    .hasMessageContaining("movie");
        }
    }
}
