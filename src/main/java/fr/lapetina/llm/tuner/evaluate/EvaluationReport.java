package fr.lapetina.llm.tuner.evaluate;

import java.util.Locale;

/**
 * Human readable evaluation summary.
 */
public final class EvaluationReport {

    // Per-example lines are printed for small runs only
    private static final int DETAIL_LIMIT = 10;

    private EvaluationReport() {
    }

    public static String format(EvaluationResult result) {
        StringBuilder out = new StringBuilder();
        out.append("=== Evaluation Results ===\n");
        out.append(String.format(Locale.US, "Score: %.3f (%d/%d examples)%n",
                result.score(), result.count(), result.total()));

        if (!result.errors().isEmpty()) {
            out.append("\nErrors:\n");
            for (ExampleResult error : result.errors()) {
                out.append("  - ").append(error.errorMessage()).append('\n');
            }
        }

        if (result.count() < DETAIL_LIMIT && !result.results().isEmpty()) {
            out.append("\nDetailed Results:\n");
            for (ExampleResult r : result.results()) {
                if (r.success()) {
                    out.append(String.format(Locale.US, "  [ok] Score: %.3f - %s -> %s%n",
                            r.score(), r.example().get("question"), r.prediction()));
                } else {
                    out.append("  [error] ").append(r.errorMessage()).append('\n');
                }
            }
        }
        return out.toString();
    }
}
