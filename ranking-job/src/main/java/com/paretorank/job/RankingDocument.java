package com.paretorank.job;

import com.paretorank.core.model.Front;
import com.paretorank.core.model.Population;
import com.paretorank.core.model.RankedSolution;
import com.paretorank.core.model.RankingResult;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON output document: front membership by solution id plus every solution
 * with its rank, in input order.
 */
public class RankingDocument {

    private int size;
    private int frontCount;
    private List<FrontDocument> fronts = new ArrayList<>();
    private List<SolutionDocument> solutions = new ArrayList<>();

    /** No-arg constructor required by Jackson. */
    public RankingDocument() {
    }

    /**
     * @param population the ranked population
     * @param result     its ranking
     * @return the output document
     */
    public static RankingDocument of(Population population, RankingResult result) {
        RankingDocument doc = new RankingDocument();
        doc.size = result.size();
        doc.frontCount = result.frontCount();
        for (Front front : result.fronts()) {
            List<String> ids = new ArrayList<>(front.size());
            for (int index : front.getMembers()) {
                ids.add(population.get(index).getId());
            }
            doc.fronts.add(new FrontDocument(front.getRank(), ids));
        }
        for (RankedSolution ranked : result.rankedSolutions(population)) {
            doc.solutions.add(SolutionDocument.ranked(ranked.getSolution(), ranked.getRank()));
        }
        return doc;
    }

    public int getSize() {
        return size;
    }

    public void setSize(int size) {
        this.size = size;
    }

    public int getFrontCount() {
        return frontCount;
    }

    public void setFrontCount(int frontCount) {
        this.frontCount = frontCount;
    }

    public List<FrontDocument> getFronts() {
        return fronts;
    }

    public void setFronts(List<FrontDocument> fronts) {
        this.fronts = fronts;
    }

    public List<SolutionDocument> getSolutions() {
        return solutions;
    }

    public void setSolutions(List<SolutionDocument> solutions) {
        this.solutions = solutions;
    }

    /**
     * One front: its rank and member ids.
     */
    public static class FrontDocument {

        private int rank;
        private List<String> members;

        /** No-arg constructor required by Jackson. */
        public FrontDocument() {
        }

        public FrontDocument(int rank, List<String> members) {
            this.rank = rank;
            this.members = members;
        }

        public int getRank() {
            return rank;
        }

        public void setRank(int rank) {
            this.rank = rank;
        }

        public List<String> getMembers() {
            return members;
        }

        public void setMembers(List<String> members) {
            this.members = members;
        }
    }
}
