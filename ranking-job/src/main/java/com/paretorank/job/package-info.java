/**
 * Batch job that ranks a population stored as JSON.
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.paretorank.job.RankingJob}: main entry point</li>
 * <li>{@link com.paretorank.job.JobConfig}: environment-driven
 * configuration</li>
 * <li>{@link com.paretorank.job.PopulationReader} /
 * {@link com.paretorank.job.RankingWriter}: JSON in and out</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.paretorank.job;
