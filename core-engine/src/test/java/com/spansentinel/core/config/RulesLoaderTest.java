package com.spansentinel.core.config;

import com.spansentinel.core.model.DetectionMethod;
import com.spansentinel.core.model.DetectionRule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link RulesLoader}.
 */
class RulesLoaderTest {

    @Test
    @DisplayName("Should load test rules from classpath")
    void shouldLoadFromClasspath() {
        RulesConfig config = RulesLoader.fromClasspath("test-rules.yml");

        assertThat(config.getRules()).hasSize(3);

        DetectionRule latency = config.getRules().get(0);
        assertThat(latency.getName()).isEqualTo("checkout-latency");
        assertThat(latency.detectionMethod()).isEqualTo(DetectionMethod.Z_SCORE);
        assertThat(latency.getConfig().getZscoreThreshold()).isEqualTo(2.5);
        assertThat(latency.getTraceNameFilter()).isEqualTo("checkout");
        assertThat(latency.getCooldownMinutes()).isEqualTo(15);

        DetectionRule cost = config.getRules().get(1);
        assertThat(cost.getType()).isEqualTo("cost");
        assertThat(cost.ruleId()).isEqualTo(UUID.fromString("0b6f3c2a-8d1e-4f5a-9b7c-2d3e4f5a6b7c"));
        assertThat(cost.getConfig().getMinThreshold()).isEqualTo(0.0);
        assertThat(cost.getConfig().getMaxThreshold()).isEqualTo(5.0);
        assertThat(cost.getMetadataFilters()).containsEntry("model", "gpt-4");
        assertThat(cost.getMinSamples()).isZero();
    }

    @Test
    @DisplayName("Unset fields keep their defaults")
    void shouldApplyDefaults() {
        DetectionRule drift = RulesLoader.fromClasspath("test-rules.yml").findByName("token-drift").orElseThrow();

        assertThat(drift.isEnabled()).isFalse();
        assertThat(drift.getMinSamples()).isEqualTo(30);
        assertThat(drift.getLookbackHours()).isEqualTo(24);
        assertThat(drift.getConfig().getAlpha()).isEqualTo(0.5);
        assertThat(drift.getConfig().getWindowSize()).isEqualTo(10);
    }

    @Test
    @DisplayName("Should expose only enabled rules")
    void shouldFilterEnabledRules() {
        List<DetectionRule> enabled = RulesLoader.fromClasspath("test-rules.yml").enabledRules();

        assertThat(enabled).extracting(DetectionRule::getName)
                .containsExactly("checkout-latency", "llm-cost-ceiling");
    }

    @Test
    @DisplayName("Should report every invalid rule at once")
    void shouldCollectAllValidationErrors() {
        assertThatThrownBy(() -> RulesLoader.fromClasspath("invalid-rules.yml"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("zscoreThreshold")
                .hasMessageContaining("prophet")
                .hasMessageContaining("greater than maxThreshold");
    }

    @Test
    @DisplayName("Should load from a file path")
    void shouldLoadFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("rules.yml");
        Files.writeString(file, "rules:\n  - name: err\n    type: error_rate\n    method: mad\n");

        RulesConfig config = RulesLoader.fromFile(file.toString());

        assertThat(config.getRules()).singleElement()
                .satisfies(rule -> assertThat(rule.detectionMethod()).isEqualTo(DetectionMethod.MAD));
    }

    @Test
    @DisplayName("An empty file yields no rules")
    void shouldAcceptEmptyFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("empty.yml");
        Files.writeString(file, "");

        assertThat(RulesLoader.fromFile(file.toString()).getRules()).isEmpty();
    }

    @Test
    @DisplayName("Malformed YAML is reported as a configuration error")
    void shouldRejectMalformedYaml(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("broken.yml");
        Files.writeString(file, "rules:\n  - name: x\n    unknownField: 1\n");

        assertThatThrownBy(() -> RulesLoader.fromFile(file.toString()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Malformed rules YAML");
    }

    @Test
    @DisplayName("Should throw when classpath resource does not exist")
    void shouldThrowForMissingResource() {
        assertThatThrownBy(() -> RulesLoader.fromClasspath("does-not-exist.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should throw when file does not exist")
    void shouldThrowForMissingFile(@TempDir Path dir) {
        assertThatThrownBy(() -> RulesLoader.fromFile(dir.resolve("missing.yml").toString()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("A missing override path falls back to the classpath")
    void shouldFallBackToClasspath(@TempDir Path dir) {
        assertThatThrownBy(() -> RulesLoader.load(dir.resolve("missing.yml").toString()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("rules.yml");
    }
}
