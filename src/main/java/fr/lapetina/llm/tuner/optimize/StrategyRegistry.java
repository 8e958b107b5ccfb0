package fr.lapetina.llm.tuner.optimize;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry mapping strategy names to optimization strategies.
 */
public final class StrategyRegistry {

    private static final Logger log = LoggerFactory.getLogger(StrategyRegistry.class);

    public static final String BEAM = "beam";
    public static final String IDENTITY = "identity";

    private final Map<String, OptimizationStrategy> strategies = new ConcurrentHashMap<>();

    /**
     * Creates a registry holding {@code beam} and {@code identity}.
     */
    public static StrategyRegistry withDefaults(BeamSearchOptimizer beamSearch) {
        StrategyRegistry registry = new StrategyRegistry();
        registry.register(BEAM, beamSearch);
        registry.register(IDENTITY, new IdentityStrategy());
        return registry;
    }

    public void register(String name, OptimizationStrategy strategy) {
        strategies.put(normalize(name), strategy);
        log.debug("Optimization strategy registered: name={}", name);
    }

    /**
     * @throws UnknownStrategyException if no strategy has that name
     */
    public OptimizationStrategy get(String name) {
        OptimizationStrategy strategy = name != null ? strategies.get(normalize(name)) : null;
        if (strategy == null) {
            throw new UnknownStrategyException(name, getAvailableStrategies());
        }
        return strategy;
    }

    public List<String> getAvailableStrategies() {
        return strategies.keySet().stream().sorted().toList();
    }

    private static String normalize(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
