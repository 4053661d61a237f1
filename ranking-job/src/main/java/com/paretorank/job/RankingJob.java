package com.paretorank.job;

import com.paretorank.core.config.RankerConfig;
import com.paretorank.core.config.RankerConfigLoader;
import com.paretorank.core.model.Front;
import com.paretorank.core.model.Population;
import com.paretorank.core.model.RankingResult;
import com.paretorank.core.ranking.DominanceRanker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;

/**
 * Main entry point of the ranking job.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   population.json
 *     → PopulationReader → Population
 *     → DominanceRanker (strategy from ranker.yml)
 *     → RankingWriter → ranking.json / stdout
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * Paths come from {@link JobConfig}; the sorter strategy from
 * {@link RankerConfigLoader}.
 * </p>
 *
 * @since 1.0.0
 */
public final class RankingJob {

    private static final Logger LOG = LoggerFactory.getLogger(RankingJob.class);

    private RankingJob() {
        // entry-point class
    }

    public static void main(String[] args) {
        try {
            JobConfig config = JobConfig.fromEnvironment(args);
            LOG.info("Starting ranking job with config: {}", config);
            run(config, System.out);
        } catch (RuntimeException e) {
            LOG.error("Ranking job failed: {}", e.getMessage(), e);
            System.exit(1);
        }
    }

    /**
     * Run the job once.
     *
     * @param config job configuration
     * @param stdout stream used when the configuration has no output path
     * @return the ranking that was written
     */
    public static RankingResult run(JobConfig config, OutputStream stdout) {
        RankerConfig rankerConfig = loadRankerConfig(config);
        Population population = new PopulationReader().read(Path.of(config.getInputPath()));

        RankingResult result;
        try (DominanceRanker ranker = DominanceRanker.fromConfig(rankerConfig)) {
            result = ranker.rank(population);
        }

        RankingWriter writer = new RankingWriter(config.isPrettyPrint());
        if (config.writesToStdout()) {
            try {
                writer.write(population, result, stdout);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to write ranking to stdout", e);
            }
        } else {
            writer.write(population, result, Path.of(config.getOutputPath()));
            LOG.info("Ranking written to {}", config.getOutputPath());
        }

        logSummary(result);
        return result;
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static RankerConfig loadRankerConfig(JobConfig config) {
        String path = config.getRankerConfigPath();
        if (path != null && !path.isBlank()) {
            return RankerConfigLoader.fromFile(path);
        }
        return RankerConfigLoader.load();
    }

    private static void logSummary(RankingResult result) {
        if (result.frontCount() == 0) {
            LOG.info("Ranked empty population");
            return;
        }
        StringBuilder sizes = new StringBuilder();
        for (Front front : result.fronts()) {
            if (sizes.length() > 0) {
                sizes.append(", ");
            }
            sizes.append(front.size());
        }
        LOG.info("Ranked {} solution(s) into {} front(s); front sizes [{}]",
                result.size(), result.frontCount(), sizes);
    }
}
