package com.paretorank.core.model;

import java.io.Serializable;
import java.util.Arrays;

/**
 * One layer of the dominance partial order: the indices of every solution
 * that received the same rank.
 *
 * <p>
 * Members are held in ascending input order. No other ordering is implied.
 * </p>
 *
 * @since 1.0.0
 */
public final class Front implements Serializable {

    private static final long serialVersionUID = 1L;

    private final int rank;
    private final int[] members;

    /**
     * @param rank    front index, {@code >= 0}
     * @param members population indices of the members; copied
     * @throws IllegalArgumentException if {@code rank} is negative or the
     *                                  front has no members
     */
    public Front(int rank, int[] members) {
        if (rank < 0) {
            throw new IllegalArgumentException("Front rank must be >= 0, got: " + rank);
        }
        if (members == null || members.length == 0) {
            throw new IllegalArgumentException("Front " + rank + " must have at least one member");
        }
        this.rank = rank;
        this.members = members.clone();
    }

    public int getRank() {
        return rank;
    }

    /**
     * @return copy of the member indices, in input order
     */
    public int[] getMembers() {
        return members.clone();
    }

    public int size() {
        return members.length;
    }

    /**
     * @param index population index
     * @return {@code true} if the solution at {@code index} is in this front
     */
    public boolean contains(int index) {
        for (int m : members) {
            if (m == index) {
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Front that))
            return false;
        return rank == that.rank && Arrays.equals(members, that.members);
    }

    @Override
    public int hashCode() {
        return 31 * rank + Arrays.hashCode(members);
    }

    @Override
    public String toString() {
        return "Front{rank=" + rank + ", members=" + Arrays.toString(members) + '}';
    }
}
