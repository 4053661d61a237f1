package com.paretorank.job;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.paretorank.core.model.InvalidInputException;
import com.paretorank.core.model.Solution;

import java.util.List;

/**
 * JSON form of one solution, used for both input and output.
 *
 * <p>
 * On input, {@code null} objective entries and the token {@code "NaN"} mark
 * an undefined objective and become {@link Double#NaN}. A missing
 * {@code id} defaults to the solution's position.
 * </p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SolutionDocument {

    private String id;
    private List<Double> objectives;
    private Double constraintViolation;

    /** Assigned rank; only present on output. */
    private Integer rank;

    /** No-arg constructor required by Jackson. */
    public SolutionDocument() {
    }

    /**
     * Convert to a core {@link Solution}.
     *
     * @param index position of this document in the input
     * @return the solution
     * @throws InvalidInputException if the objectives are missing
     */
    public Solution toSolution(int index) {
        if (objectives == null) {
            throw new InvalidInputException("Solution at index " + index + " has no 'objectives'", index);
        }
        double[] values = new double[objectives.size()];
        for (int k = 0; k < values.length; k++) {
            Double v = objectives.get(k);
            values[k] = v == null ? Double.NaN : v;
        }
        String solutionId = id != null ? id : String.valueOf(index);
        double violation = constraintViolation != null ? constraintViolation : 0.0;
        return new Solution(solutionId, values, violation);
    }

    /**
     * Build the output form of a ranked solution.
     *
     * @param solution the ranked solution
     * @param rank     its rank
     * @return a new document
     */
    public static SolutionDocument ranked(Solution solution, int rank) {
        SolutionDocument doc = new SolutionDocument();
        doc.id = solution.getId();
        double[] values = solution.getObjectives();
        Double[] boxed = new Double[values.length];
        for (int k = 0; k < values.length; k++) {
            boxed[k] = values[k];
        }
        doc.objectives = List.of(boxed);
        doc.constraintViolation = solution.isFeasible() ? null : solution.getConstraintViolation();
        doc.rank = rank;
        return doc;
    }

    // ---------------------------------------------------------------
    // Getters / Setters (required for Jackson)
    // ---------------------------------------------------------------

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public List<Double> getObjectives() {
        return objectives;
    }

    public void setObjectives(List<Double> objectives) {
        this.objectives = objectives;
    }

    public Double getConstraintViolation() {
        return constraintViolation;
    }

    public void setConstraintViolation(Double constraintViolation) {
        this.constraintViolation = constraintViolation;
    }

    public Integer getRank() {
        return rank;
    }

    public void setRank(Integer rank) {
        this.rank = rank;
    }
}
