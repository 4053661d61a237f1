package com.paretorank.job;

import java.util.Map;
import java.util.Objects;

/**
 * Typed, immutable configuration object for the ranking job.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults;
 * positional command-line arguments {@code <input> [output]} take precedence
 * over the environment.
 * </p>
 *
 * <h3>Environment</h3>
 * <ul>
 * <li>{@code POPULATION_INPUT_PATH}: JSON population to rank (required)</li>
 * <li>{@code RANKING_OUTPUT_PATH}: where to write the ranking; stdout when
 * blank</li>
 * <li>{@code RANKER_CONFIG_PATH}: ranker YAML; classpath {@code ranker.yml}
 * when blank</li>
 * <li>{@code PRETTY_PRINT}: indent the JSON output (default
 * {@code true})</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class JobConfig {

    public static final String ENV_INPUT_PATH = "POPULATION_INPUT_PATH";
    public static final String ENV_OUTPUT_PATH = "RANKING_OUTPUT_PATH";
    public static final String ENV_RANKER_CONFIG_PATH = "RANKER_CONFIG_PATH";
    public static final String ENV_PRETTY_PRINT = "PRETTY_PRINT";

    private final String inputPath;
    private final String outputPath;
    private final String rankerConfigPath;
    private final boolean prettyPrint;

    private JobConfig(Builder b) {
        this.inputPath = b.inputPath;
        this.outputPath = b.outputPath;
        this.rankerConfigPath = b.rankerConfigPath;
        this.prettyPrint = b.prettyPrint;
    }

    // ---------------------------------------------------------------
    // Factory: resolve from environment and arguments
    // ---------------------------------------------------------------

    /**
     * Build a {@link JobConfig} from the process environment and arguments.
     *
     * @param args command-line arguments
     * @return validated configuration
     * @throws IllegalArgumentException if no input path is given
     */
    public static JobConfig fromEnvironment(String[] args) {
        return resolve(args, System.getenv());
    }

    /**
     * Build a {@link JobConfig} from explicit arguments and environment.
     *
     * @param args command-line arguments; may be empty
     * @param env  environment variables
     * @return validated configuration
     * @throws IllegalArgumentException if more than two arguments are given,
     *                                  or no input path is set
     * @throws IllegalStateException    if {@code PRETTY_PRINT} is not a
     *                                  boolean
     */
    public static JobConfig resolve(String[] args, Map<String, String> env) {
        Objects.requireNonNull(args, "args must not be null");
        Objects.requireNonNull(env, "env must not be null");
        if (args.length > 2) {
            throw new IllegalArgumentException("Usage: ranking-job <population.json> [ranking.json]");
        }

        return new Builder()
                .inputPath(args.length > 0 ? args[0] : env(env, ENV_INPUT_PATH, ""))
                .outputPath(args.length > 1 ? args[1] : env(env, ENV_OUTPUT_PATH, ""))
                .rankerConfigPath(env(env, ENV_RANKER_CONFIG_PATH, ""))
                .prettyPrint(parseBooleanEnv(env, ENV_PRETTY_PRINT, "true"))
                .build();
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getInputPath() {
        return inputPath;
    }

    /**
     * @return output path, or an empty string for stdout
     */
    public String getOutputPath() {
        return outputPath;
    }

    public boolean writesToStdout() {
        return outputPath.isBlank();
    }

    /**
     * @return ranker config path, or an empty string to use the default
     *         resolution
     */
    public String getRankerConfigPath() {
        return rankerConfigPath;
    }

    public boolean isPrettyPrint() {
        return prettyPrint;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link JobConfig}. {@link #build()} requires a
     * non-blank input path.
     */
    public static class Builder {
        private String inputPath = "";
        private String outputPath = "";
        private String rankerConfigPath = "";
        private boolean prettyPrint = true;

        public Builder inputPath(String v) {
            this.inputPath = v;
            return this;
        }

        public Builder outputPath(String v) {
            this.outputPath = v;
            return this;
        }

        public Builder rankerConfigPath(String v) {
            this.rankerConfigPath = v;
            return this;
        }

        public Builder prettyPrint(boolean v) {
            this.prettyPrint = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link JobConfig}
         * @throws IllegalArgumentException if the input path is blank
         */
        public JobConfig build() {
            if (inputPath == null || inputPath.isBlank()) {
                throw new IllegalArgumentException(
                        "Population input path required: pass it as the first argument or set "
                                + ENV_INPUT_PATH);
            }
            outputPath = outputPath != null ? outputPath : "";
            rankerConfigPath = rankerConfigPath != null ? rankerConfigPath : "";
            return new JobConfig(this);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(Map<String, String> env, String name, String defaultValue) {
        String value = env.get(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    private static boolean parseBooleanEnv(Map<String, String> env, String name, String defaultValue) {
        String value = env(env, name, defaultValue).trim();
        if (value.equalsIgnoreCase("true")) {
            return true;
        }
        if (value.equalsIgnoreCase("false")) {
            return false;
        }
        throw new IllegalStateException("Failed to parse boolean environment variable " + name + ": " + value);
    }

    @Override
    public String toString() {
        return "JobConfig{" +
                "inputPath='" + inputPath + '\'' +
                ", outputPath='" + (writesToStdout() ? "<stdout>" : outputPath) + '\'' +
                ", rankerConfigPath='" + rankerConfigPath + '\'' +
                ", prettyPrint=" + prettyPrint +
                '}';
    }
}
