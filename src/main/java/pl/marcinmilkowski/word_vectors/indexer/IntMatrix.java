package pl.marcinmilkowski.word_vectors.indexer;

import java.util.Arrays;

/**
 * Immutable dense matrix of non-negative counts (term-document, term-context).
 */
public final class IntMatrix implements Matrix {

    private final int rows;
    private final int columns;
    private final int[][] cells;

    /**
     * Takes ownership of {@code cells}; callers must not modify the array afterwards.
     */
    IntMatrix(int rows, int columns, int[][] cells) {
        this.rows = rows;
        this.columns = columns;
        this.cells = cells;
    }

    /**
     * Copies a rectangular array of counts.
     *
     * @throws IllegalArgumentException if the rows differ in length or a count is negative
     */
    public static IntMatrix of(int[][] values) {
        int columns = values.length == 0 ? 0 : values[0].length;
        int[][] copy = new int[values.length][];
        for (int r = 0; r < values.length; r++) {
            if (values[r].length != columns) {
                throw new IllegalArgumentException("Row " + r + " has " + values[r].length
                    + " columns, expected " + columns);
            }
            for (int c = 0; c < columns; c++) {
                if (values[r][c] < 0) {
                    throw new IllegalArgumentException("Negative count at (" + r + ", " + c + ")");
                }
            }
            copy[r] = values[r].clone();
        }
        return new IntMatrix(values.length, columns, copy);
    }

    @Override
    public int rows() { return rows; }

    @Override
    public int columns() { return columns; }

    public int count(int row, int column) {
        return cells[row][column];
    }

    @Override
    public double get(int row, int column) {
        return cells[row][column];
    }

    @Override
    public double[] row(int row) {
        int[] source = cells[row];
        double[] vector = new double[columns];
        for (int c = 0; c < columns; c++) {
            vector[c] = source[c];
        }
        return vector;
    }

    @Override
    public double[] column(int column) {
        if (column < 0 || column >= columns) {
            throw new IndexOutOfBoundsException("Column " + column + " out of range [0, " + columns + ")");
        }
        double[] vector = new double[rows];
        for (int r = 0; r < rows; r++) {
            vector[r] = cells[r][column];
        }
        return vector;
    }

    public long sum() {
        long total = 0;
        for (int[] row : cells) {
            for (int value : row) {
                total += value;
            }
        }
        return total;
    }

    public long[] rowSums() {
        long[] sums = new long[rows];
        for (int r = 0; r < rows; r++) {
            long s = 0;
            for (int value : cells[r]) {
                s += value;
            }
            sums[r] = s;
        }
        return sums;
    }

    public long[] columnSums() {
        long[] sums = new long[columns];
        for (int[] row : cells) {
            for (int c = 0; c < columns; c++) {
                sums[c] += row[c];
            }
        }
        return sums;
    }

    /**
     * Number of rows whose total count is exactly one. On a term-document matrix these are
     * the hapax legomena of the corpus.
     */
    public int hapaxLegomena() {
        int singletons = 0;
        for (long s : rowSums()) {
            if (s == 1) {
                singletons++;
            }
        }
        return singletons;
    }

    /**
     * Copy of the counts.
     */
    public int[][] toArray() {
        int[][] copy = new int[rows][];
        for (int r = 0; r < rows; r++) {
            copy[r] = cells[r].clone();
        }
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IntMatrix)) return false;
        IntMatrix other = (IntMatrix) o;
        return rows == other.rows && columns == other.columns && Arrays.deepEquals(cells, other.cells);
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(cells);
    }

    @Override
    public String toString() {
        return String.format("IntMatrix[%dx%d]", rows, columns);
    }
}
