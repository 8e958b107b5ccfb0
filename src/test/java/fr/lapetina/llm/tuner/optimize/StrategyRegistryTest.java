package fr.lapetina.llm.tuner.optimize;

import fr.lapetina.llm.tuner.evaluate.Evaluator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StrategyRegistryTest {

    private final StrategyRegistry registry =
            StrategyRegistry.withDefaults(new BeamSearchOptimizer(new Evaluator(), null));

    @Test
    @DisplayName("should resolve names case-insensitively")
    void shouldResolveNames() {
        assertThat(registry.get("BEAM")).isInstanceOf(BeamSearchOptimizer.class);
        assertThat(registry.get(" identity ")).isInstanceOf(IdentityStrategy.class);
    }

    @Test
    @DisplayName("should register custom strategies")
    void shouldRegisterCustom() {
        IdentityStrategy custom = new IdentityStrategy();
        registry.register("custom", custom);

        assertThat(registry.get("custom")).isSameAs(custom);
        assertThat(registry.getAvailableStrategies()).containsExactly("beam", "custom", "identity");
    }

    @Test
    @DisplayName("should report unknown strategies with the available ones")
    void shouldRejectUnknown() {
        assertThatThrownBy(() -> registry.get("random"))
                .isInstanceOfSatisfying(UnknownStrategyException.class, e -> {
                    assertThat(e.getStrategy()).isEqualTo("random");
                    assertThat(e.getAvailableStrategies()).containsExactly("beam", "identity");
                });
        assertThatThrownBy(() -> registry.get(null)).isInstanceOf(UnknownStrategyException.class);
    }
}
