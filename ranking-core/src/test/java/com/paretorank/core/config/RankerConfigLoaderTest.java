package com.paretorank.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Unit tests for {@link RankerConfigLoader}.
 */
class RankerConfigLoaderTest {

    @Test
    @DisplayName("Should load test config from classpath")
    void shouldLoadFromClasspath() {
        RankerConfig config = RankerConfigLoader.fromClasspath("test-ranker.yml");

        assertThat(config.getStrategy()).isEqualTo("parallel");
        assertThat(config.getParallelism()).isEqualTo(3);
        assertThat(config.getParallelThreshold()).isEqualTo(16);
        assertThat(config.getDominance()).isEqualTo("constrained");
    }

    @Test
    @DisplayName("Should throw when classpath resource does not exist")
    void shouldThrowForMissingResource() {
        assertThatThrownBy(() -> RankerConfigLoader.fromClasspath("does-not-exist.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should report every invalid setting at once")
    void shouldAggregateValidationErrors() {
        assertThatThrownBy(() -> RankerConfigLoader.fromClasspath("invalid-ranker.yml"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Unknown strategy: 'quantum'")
                .hasMessageContaining("'parallelism' must be >= 1");
    }

    @Test
    @DisplayName("Should reject duplicate keys")
    void shouldRejectDuplicateKeys() {
        assertThatThrownBy(() -> RankerConfigLoader.fromClasspath("duplicate-key-ranker.yml"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Malformed");
    }

    @Test
    @DisplayName("Should fall back to defaults for an empty document")
    void shouldUseDefaultsForEmptyDocument() {
        RankerConfig config = RankerConfigLoader.fromClasspath("empty-ranker.yml");

        assertThat(config.getStrategy()).isEqualTo(RankerConfig.DEFAULT_STRATEGY);
        assertThat(config.getDominance()).isEqualTo(RankerConfig.DEFAULT_DOMINANCE);
        assertThat(config.getParallelThreshold()).isEqualTo(RankerConfig.DEFAULT_PARALLEL_THRESHOLD);
    }

    @Test
    @DisplayName("Should load from a file system path")
    void shouldLoadFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("ranker.yml");
        Files.writeString(file, "strategy: sequential\ndominance: pareto\n");

        RankerConfig config = RankerConfigLoader.fromFile(file.toString());

        assertThat(config.getStrategy()).isEqualTo("sequential");
    }

    @Test
    @DisplayName("Should throw when file does not exist")
    void shouldThrowForMissingFile(@TempDir Path dir) {
        String missing = dir.resolve("nope.yml").toString();

        assertThatThrownBy(() -> RankerConfigLoader.fromFile(missing))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should resolve defaults when no ranker.yml is on the classpath")
    void shouldResolveDefaultsWithoutConfig() {
        // the core module ships no ranker.yml
        assumeTrue(System.getenv(RankerConfigLoader.ENV_CONFIG_PATH) == null);

        RankerConfig config = RankerConfigLoader.load();

        assertThat(config.getStrategy()).isEqualTo("sequential");
    }
}
