package com.paretorank.job;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.paretorank.core.model.InvalidInputException;
import com.paretorank.core.model.ObjectiveDirection;
import com.paretorank.core.model.Population;
import com.paretorank.core.model.Solution;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON input document.
 *
 * <pre>
 * {
 *   "directions": ["minimize", "maximize"],
 *   "solutions": [
 *     { "id": "a", "objectives": [1.0, 4.0] },
 *     { "objectives": [null, 2.0], "constraintViolation": 0.5 }
 *   ]
 * }
 * </pre>
 *
 * <p>
 * {@code directions} is optional; without it every objective is minimised.
 * </p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class PopulationDocument {

    private List<ObjectiveDirection> directions;
    private List<SolutionDocument> solutions;

    /**
     * Convert to a core {@link Population}. Dimensions are not checked here;
     * the ranker does that.
     *
     * @return the population, empty if no solutions are listed
     * @throws InvalidInputException if an entry is {@code null} or has no
     *                               objectives
     */
    public Population toPopulation() {
        if (solutions == null || solutions.isEmpty()) {
            return Population.empty();
        }
        List<Solution> converted = new ArrayList<>(solutions.size());
        for (int i = 0; i < solutions.size(); i++) {
            SolutionDocument doc = solutions.get(i);
            if (doc == null) {
                throw new InvalidInputException("Solution at index " + i + " is null", i);
            }
            converted.add(doc.toSolution(i));
        }
        Population population = Population.of(converted);
        if (directions != null && !directions.isEmpty()) {
            if (directions.contains(null)) {
                throw new InvalidInputException("'directions' must not contain null");
            }
            population = population.withDirections(directions.toArray(new ObjectiveDirection[0]));
        }
        return population;
    }

    public List<ObjectiveDirection> getDirections() {
        return directions;
    }

    public void setDirections(List<ObjectiveDirection> directions) {
        this.directions = directions;
    }

    public List<SolutionDocument> getSolutions() {
        return solutions;
    }

    public void setSolutions(List<SolutionDocument> solutions) {
        this.solutions = solutions;
    }
}
