/**
 * Data model for non-dominated sorting.
 *
 * <ul>
 * <li>{@link com.paretorank.core.model.Solution}: identifier plus objective
 * vector</li>
 * <li>{@link com.paretorank.core.model.Population}: ordered solutions and
 * objective directions</li>
 * <li>{@link com.paretorank.core.model.RankingResult}: rank per solution and
 * the resulting {@link com.paretorank.core.model.Front}s</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.paretorank.core.model;
