package org.puneet.abtest.model;

import java.util.Arrays;

/**
 * 2x2 table {@code [[winsA, lossesA], [winsB, lossesB]]}.
 * Rows are groups, columns are outcomes.
 * 
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-02
 */
public final class ContingencyTable {
    
    /** Largest combined sample the exact tests accept */
    public static final long MAX_HYPERGEOMETRIC_POPULATION = Integer.MAX_VALUE;
    
    private final int[][] cells;
    
    public ContingencyTable(int winsA, int lossesA, int winsB, int lossesB) {
        if (winsA < 0 || lossesA < 0 || winsB < 0 || lossesB < 0) {
            throw new IllegalArgumentException("Cell counts must be non-negative");
        }
        this.cells = new int[][] {{winsA, lossesA}, {winsB, lossesB}};
    }
    
    public int get(int row, int column) {
        return cells[row][column];
    }
    
    public long rowTotal(int row) {
        return (long) cells[row][0] + cells[row][1];
    }
    
    public long columnTotal(int column) {
        return (long) cells[0][column] + cells[1][column];
    }
    
    public long total() {
        return rowTotal(0) + rowTotal(1);
    }
    
    /**
     * True when the table is small enough for the hypergeometric model, whose
     * population size is an {@code int}.
     */
    public boolean fitsHypergeometric() {
        return total() <= MAX_HYPERGEOMETRIC_POPULATION;
    }
    
    /**
     * Expected count of a cell under independence of group and outcome.
     */
    public double expected(int row, int column) {
        return (double) rowTotal(row) * columnTotal(column) / total();
    }
    
    public int minCellCount() {
        return Math.min(Math.min(cells[0][0], cells[0][1]), Math.min(cells[1][0], cells[1][1]));
    }
    
    /**
     * @return combined win rate of both groups
     */
    public double pooledProportion() {
        return (double) columnTotal(0) / total();
    }
    
    /**
     * True when every trial was a win or every trial was a loss, so the pooled
     * variance p(1 - p) is zero.
     */
    public boolean isPooledDegenerate() {
        return columnTotal(0) == 0 || columnTotal(1) == 0;
    }
    
    @Override
    public String toString() {
        return "ContingencyTable" + Arrays.deepToString(cells);
    }
}
