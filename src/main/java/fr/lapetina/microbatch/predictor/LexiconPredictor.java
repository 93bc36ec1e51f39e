package fr.lapetina.microbatch.predictor;

import fr.lapetina.microbatch.domain.model.ClassLabel;
import fr.lapetina.microbatch.domain.model.Prediction;
import fr.lapetina.microbatch.infrastructure.config.ClassifierConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * In-process keyword scorer.
 *
 * Each label owns a keyword set; the logit of a label is the keyword weight
 * times the number of matching tokens. {@link ClassLabel#NONE} starts with a
 * baseline logit of 1 so that text without any keyword classifies as none.
 * Logits go through softmax and the argmax becomes the label.
 */
public final class LexiconPredictor implements Predictor {

    private static final Logger log = LoggerFactory.getLogger(LexiconPredictor.class);

    private static final Pattern TOKEN_SEPARATOR = Pattern.compile("[^\\p{L}\\p{Nd}]+");
    private static final double NONE_BASELINE = 1.0;

    private final Map<ClassLabel, Set<String>> keywords;
    private final double keywordWeight;

    public LexiconPredictor(Map<ClassLabel, Set<String>> keywords, double keywordWeight) {
        this.keywords = new EnumMap<>(ClassLabel.class);
        for (ClassLabel label : ClassLabel.values()) {
            Set<String> normalized = new HashSet<>();
            for (String word : keywords.getOrDefault(label, Set.of())) {
                normalized.add(word.toLowerCase(Locale.ROOT));
            }
            this.keywords.put(label, normalized);
        }
        this.keywordWeight = keywordWeight;
    }

    /**
     * Loads a lexicon from configuration, falling back to a YAML file at the model path.
     *
     * @throws InferenceException if no lexicon is available or a label is unknown
     */
    public static LexiconPredictor load(ClassifierConfig.ModelConfig config) throws InferenceException {
        Map<String, List<String>> raw = config.getLexicon();
        String source = "configuration";
        if (raw == null || raw.isEmpty()) {
            raw = readLexiconFile(Path.of(config.getPath()));
            source = config.getPath();
        }

        Map<ClassLabel, Set<String>> keywords = new EnumMap<>(ClassLabel.class);
        for (Map.Entry<String, List<String>> entry : raw.entrySet()) {
            ClassLabel label = parseLabel(entry.getKey());
            Collection<String> words = entry.getValue() != null ? entry.getValue() : List.of();
            keywords.computeIfAbsent(label, l -> new HashSet<>()).addAll(words);
        }

        log.debug("Lexicon loaded: source={}, labels={}", source, keywords.keySet());
        return new LexiconPredictor(keywords, config.getKeywordWeight());
    }

    @SuppressWarnings("unchecked")
    private static Map<String, List<String>> readLexiconFile(Path path) throws InferenceException {
        if (!Files.isRegularFile(path)) {
            throw new InferenceException("No lexicon configured and no lexicon file at: " + path);
        }
        try (InputStream is = Files.newInputStream(path)) {
            Object loaded = new Yaml(new LoaderOptions()).load(is);
            if (!(loaded instanceof Map)) {
                throw new InferenceException("Lexicon file must be a mapping of label to keywords: " + path);
            }
            return (Map<String, List<String>>) loaded;
        } catch (IOException | YAMLException | ClassCastException e) {
            throw new InferenceException("Failed to read lexicon file: " + path, e);
        }
    }

    private static ClassLabel parseLabel(String name) throws InferenceException {
        for (ClassLabel label : ClassLabel.values()) {
            if (label.wireName().equalsIgnoreCase(name)) {
                return label;
            }
        }
        throw new InferenceException("Unknown label in lexicon: " + name);
    }

    @Override
    public String getName() {
        return "lexicon";
    }

    @Override
    public List<Prediction> predict(List<String> texts) throws InferenceException {
        List<Prediction> predictions = new ArrayList<>(texts.size());
        for (String text : texts) {
            if (text == null) {
                throw new InferenceException("Null input in batch");
            }
            predictions.add(Prediction.fromDistribution(Softmax.apply(logits(text))));
        }
        return predictions;
    }

    double[] logits(String text) {
        double[] logits = new double[ClassLabel.count()];
        logits[ClassLabel.NONE.index()] = NONE_BASELINE;

        for (String token : TOKEN_SEPARATOR.split(text.toLowerCase(Locale.ROOT))) {
            if (token.isEmpty()) {
                continue;
            }
            for (Map.Entry<ClassLabel, Set<String>> entry : keywords.entrySet()) {
                if (entry.getValue().contains(token)) {
                    logits[entry.getKey().index()] += keywordWeight;
                }
            }
        }
        return logits;
    }
}
