package fr.lapetina.llm.tuner.evaluate;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Normalizes datasets into {@code {question, answer}} examples.
 *
 * Accepted shapes, decided on the first element:
 * - maps with {@code question} and {@code answer}: returned unchanged
 * - two-element lists {@code [input, output]}
 * - maps keyed {@code input} / {@code query} and {@code output} / {@code expected};
 *   the original fields are kept
 */
public final class Datasets {

    private Datasets() {
        // Utility class
    }

    /**
     * @throws UnsupportedDatasetException when the first element is neither a map nor a pair
     */
    @SuppressWarnings("unchecked")
    public static List<Map<String, Object>> format(List<?> dataset) {
        if (dataset == null) {
            throw new UnsupportedDatasetException("Dataset is null");
        }
        if (dataset.isEmpty()) {
            return List.of();
        }

        Object first = dataset.get(0);
        if (first instanceof Map<?, ?> firstMap) {
            if (firstMap.get("question") != null && firstMap.get("answer") != null) {
                return (List<Map<String, Object>>) dataset;
            }
            List<Map<String, Object>> formatted = new ArrayList<>(dataset.size());
            for (Object element : dataset) {
                if (!(element instanceof Map<?, ?>)) {
                    throw new UnsupportedDatasetException("Mixed dataset, expected a map: " + element);
                }
                formatted.add(standardize((Map<String, Object>) element));
            }
            return formatted;
        }

        if (first instanceof List<?> pair && pair.size() == 2) {
            List<Map<String, Object>> formatted = new ArrayList<>(dataset.size());
            for (Object element : dataset) {
                if (!(element instanceof List<?> p) || p.size() != 2) {
                    throw new UnsupportedDatasetException("Expected an [input, output] pair: " + element);
                }
                Map<String, Object> example = new HashMap<>();
                example.put("question", p.get(0));
                example.put("answer", p.get(1));
                formatted.add(example);
            }
            return formatted;
        }

        throw new UnsupportedDatasetException("Unsupported dataset format, first element: " + first);
    }

    private static Map<String, Object> standardize(Map<String, Object> example) {
        Map<String, Object> standardized = new HashMap<>(example);
        standardized.put("question", firstPresent(example, "question", "input", "query"));
        standardized.put("answer", firstPresent(example, "answer", "output", "expected"));
        return standardized;
    }

    private static Object firstPresent(Map<String, Object> example, String... keys) {
        for (String key : keys) {
            Object value = example.get(key);
            if (value != null) {
                return value;
            }
        }
        return null;
    }
}
