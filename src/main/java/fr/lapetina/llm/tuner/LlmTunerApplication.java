package fr.lapetina.llm.tuner;

import fr.lapetina.llm.tuner.evaluate.EvaluationReport;
import fr.lapetina.llm.tuner.evaluate.EvaluationResult;
import fr.lapetina.llm.tuner.evaluate.Metric;
import fr.lapetina.llm.tuner.evaluate.Metrics;
import fr.lapetina.llm.tuner.infrastructure.io.dto.RunSummary;
import fr.lapetina.llm.tuner.optimize.OptimizationResult;
import fr.lapetina.llm.tuner.optimize.OptimizerOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Command line entry point.
 *
 * <pre>
 * evaluate &lt;config.yaml&gt; &lt;dataset.json&gt; &lt;metric&gt;
 * optimize &lt;config.yaml&gt; &lt;dataset.json&gt; &lt;metric&gt; [output.json]
 * </pre>
 */
public class LlmTunerApplication {

    private static final Logger log = LoggerFactory.getLogger(LlmTunerApplication.class);

    private final PrintStream out;

    public LlmTunerApplication(PrintStream out) {
        this.out = out;
    }

    /**
     * Runs one command.
     *
     * @return Process exit code
     */
    public int run(String[] args) {
        if (args.length < 4) {
            printUsage();
            return 2;
        }
        String command = args[0];
        String configPath = args[1];
        Path datasetPath = Path.of(args[2]);
        String metricName = args[3];

        Metric metric;
        try {
            metric = Metrics.byName(metricName);
        } catch (IllegalArgumentException e) {
            out.println(e.getMessage());
            return 2;
        }

        try (TunerFactory factory = TunerFactory.create(configPath)) {
            List<Map<String, Object>> dataset = factory.getDatasetReader().read(datasetPath);
            switch (command) {
                case "evaluate":
                    return evaluate(factory, dataset, metric);
                case "optimize":
                    Path output = args.length > 4 ? Path.of(args[4]) : null;
                    return optimize(factory, dataset, metric, output);
                default:
                    out.println("Unknown command: " + command);
                    printUsage();
                    return 2;
            }
        }
    }

    private int evaluate(TunerFactory factory, List<Map<String, Object>> dataset, Metric metric) {
        EvaluationResult result = factory.getEvaluator()
                .evaluate(factory.getPipeline(), dataset, metric, factory.evaluationOptions())
                .join();
        out.print(EvaluationReport.format(result));
        return 0;
    }

    private int optimize(TunerFactory factory, List<Map<String, Object>> dataset, Metric metric, Path output) {
        OptimizerOptions options = factory.optimizerOptions();
        OptimizationResult result = factory.getOptimizer()
                .optimize(factory.getPipeline(), dataset, metric, options)
                .join();

        out.println(String.format(Locale.US, "Best score: %.3f after %d iterations (%d ms), converged=%s",
                result.bestScore(), result.totalIterations(), result.totalTimeMs(), result.converged()));
        if (result.bestPipeline().mutationDescription() != null) {
            out.println("Best mutation: " + result.bestPipeline().mutationDescription());
        }
        if (output != null) {
            factory.getDatasetReader().write(output, RunSummary.from(null, result));
        }
        return 0;
    }

    private void printUsage() {
        out.println("Usage:");
        out.println("  evaluate <config.yaml> <dataset.json> <metric>");
        out.println("  optimize <config.yaml> <dataset.json> <metric> [output.json]");
        out.println("Metrics: " + Metrics.names());
    }

    public static void main(String[] args) {
        try {
            int code = new LlmTunerApplication(System.out).run(args);
            if (code != 0) {
                System.exit(code);
            }
        } catch (Exception e) {
            log.error("LLM tuner failed", e);
            System.exit(1);
        }
    }
}
