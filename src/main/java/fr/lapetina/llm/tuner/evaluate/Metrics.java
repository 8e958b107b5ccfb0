package fr.lapetina.llm.tuner.evaluate;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Built-in metrics.
 *
 * Predictions and ground truths are either strings or maps; map values are read from
 * the {@code answer} key (and {@code text} for {@link #semanticSimilarity()}).
 */
public final class Metrics {

    public static final String EXACT_MATCH = "exact-match";
    public static final String PASSAGE_MATCH = "passage-match";
    public static final String SEMANTIC_F1 = "semantic-f1";
    public static final String SEMANTIC_SIMILARITY = "semantic-similarity";
    public static final String STRICT_EQUALS = "strict-equals";

    private static final Metric EXACT = validated(EXACT_MATCH, Metrics::answerExactMatch);
    private static final Metric PASSAGE = validated(PASSAGE_MATCH, Metrics::answerPassageMatch);
    private static final Metric F1 = validated(SEMANTIC_F1, Metrics::tokenF1);
    private static final Metric SIMILARITY = validated(SEMANTIC_SIMILARITY, Metrics::wordJaccard);
    private static final Metric STRICT = validated(STRICT_EQUALS, (p, g) -> Objects.equals(p, g) ? 1.0 : 0.0);

    private Metrics() {
        // Utility class
    }

    /**
     * Wraps a metric function so that out-of-range scores raise {@link MetricRangeException}.
     */
    public static Metric validated(String name, Metric fn) {
        return new Metric() {
            @Override
            public double score(Object prediction, Object groundTruth) {
                double score = fn.score(prediction, groundTruth);
                if (Double.isNaN(score) || score < 0.0 || score > 1.0) {
                    throw new MetricRangeException(name, score);
                }
                return score;
            }

            @Override
            public String name() {
                return name;
            }

            @Override
            public String toString() {
                return "Metric{" + name + "}";
            }
        };
    }

    /** Trimmed, case-insensitive equality of the answers. */
    public static Metric exactMatch() {
        return EXACT;
    }

    /** 1.0 when the predicted answer occurs in the ground truth context, passage or answer. */
    public static Metric passageMatch() {
        return PASSAGE;
    }

    /** Token-level F1 between the answers. */
    public static Metric semanticF1() {
        return F1;
    }

    /** Word-set Jaccard index between the texts. */
    public static Metric semanticSimilarity() {
        return SIMILARITY;
    }

    /** Plain equality of the whole values. */
    public static Metric strictEquals() {
        return STRICT;
    }

    /**
     * Resolves a built-in metric by name.
     *
     * @throws IllegalArgumentException for an unknown name
     */
    public static Metric byName(String name) {
        Metric metric = name != null ? builtIns().get(name.trim().toLowerCase(Locale.ROOT)) : null;
        if (metric == null) {
            throw new IllegalArgumentException("Unknown metric: " + name + ". Available: " + names());
        }
        return metric;
    }

    public static List<String> names() {
        return builtIns().keySet().stream().sorted().toList();
    }

    private static Map<String, Metric> builtIns() {
        Map<String, Metric> metrics = new HashMap<>();
        metrics.put(EXACT_MATCH, EXACT);
        metrics.put(PASSAGE_MATCH, PASSAGE);
        metrics.put(SEMANTIC_F1, F1);
        metrics.put(SEMANTIC_SIMILARITY, SIMILARITY);
        metrics.put(STRICT_EQUALS, STRICT);
        return metrics;
    }

    static double answerExactMatch(Object prediction, Object groundTruth) {
        String predicted = answerOf(prediction);
        String expected = answerOf(groundTruth);
        if (predicted == null || expected == null) {
            return 0.0;
        }
        return normalize(predicted).equals(normalize(expected)) ? 1.0 : 0.0;
    }

    static double answerPassageMatch(Object prediction, Object groundTruth) {
        String predicted = answerOf(prediction);
        String passage = passageOf(groundTruth);
        if (predicted == null || passage == null || predicted.isBlank()) {
            return 0.0;
        }
        return passage.toLowerCase(Locale.ROOT).contains(normalize(predicted)) ? 1.0 : 0.0;
    }

    static double tokenF1(Object prediction, Object groundTruth) {
        String predicted = answerOf(prediction);
        String expected = answerOf(groundTruth);
        if (predicted == null || expected == null) {
            return 0.0;
        }
        List<String> predictedTokens = tokens(predicted);
        List<String> expectedTokens = tokens(expected);
        if (predictedTokens.isEmpty() || expectedTokens.isEmpty()) {
            return predictedTokens.equals(expectedTokens) ? 1.0 : 0.0;
        }

        Map<String, Integer> remaining = new HashMap<>();
        for (String token : expectedTokens) {
            remaining.merge(token, 1, Integer::sum);
        }
        int common = 0;
        for (String token : predictedTokens) {
            Integer count = remaining.get(token);
            if (count != null && count > 0) {
                remaining.put(token, count - 1);
                common++;
            }
        }
        if (common == 0) {
            return 0.0;
        }
        double precision = (double) common / predictedTokens.size();
        double recall = (double) common / expectedTokens.size();
        return 2 * precision * recall / (precision + recall);
    }

    static double wordJaccard(Object prediction, Object groundTruth) {
        Set<String> actual = new HashSet<>(tokens(textOf(prediction)));
        Set<String> expected = new HashSet<>(tokens(textOf(groundTruth)));
        Set<String> union = new HashSet<>(actual);
        union.addAll(expected);
        if (union.isEmpty()) {
            return 0.0;
        }
        Set<String> intersection = new HashSet<>(actual);
        intersection.retainAll(expected);
        return (double) intersection.size() / union.size();
    }

    private static String answerOf(Object value) {
        if (value instanceof String text) {
            return text;
        }
        if (value instanceof Map<?, ?> map) {
            Object answer = map.get("answer");
            return answer != null ? answer.toString() : null;
        }
        return null;
    }

    private static String passageOf(Object value) {
        if (value instanceof String text) {
            return text;
        }
        if (value instanceof Map<?, ?> map) {
            for (String key : List.of("context", "passage", "answer")) {
                Object passage = map.get(key);
                if (passage != null) {
                    return passage.toString();
                }
            }
        }
        return null;
    }

    private static String textOf(Object value) {
        if (value instanceof Map<?, ?> map) {
            Object text = map.get("text");
            if (text == null) {
                text = map.get("answer");
            }
            return text != null ? text.toString() : String.valueOf(map);
        }
        return String.valueOf(value);
    }

    private static String normalize(String text) {
        return text.trim().toLowerCase(Locale.ROOT);
    }

    private static List<String> tokens(String text) {
        if (text == null) {
            return List.of();
        }
        List<String> tokens = new ArrayList<>();
        for (String token : Arrays.asList(text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+"))) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }
}
