package pl.marcinmilkowski.word_vectors.indexer;

/**
 * Immutable dense matrix of weights (PPMI, TF-IDF).
 */
public final class DoubleMatrix implements Matrix {

    private final int rows;
    private final int columns;
    private final double[][] cells;

    /**
     * Takes ownership of {@code cells}; callers must not modify the array afterwards.
     */
    private DoubleMatrix(int rows, int columns, double[][] cells) {
        this.rows = rows;
        this.columns = columns;
        this.cells = cells;
    }

    /**
     * Wraps freshly computed cells without copying. Used by the weighting transforms,
     * which never touch the array again.
     */
    public static DoubleMatrix wrap(int rows, int columns, double[][] cells) {
        if (cells.length != rows) {
            throw new IllegalArgumentException("Expected " + rows + " rows, got " + cells.length);
        }
        for (double[] row : cells) {
            if (row.length != columns) {
                throw new IllegalArgumentException("Expected " + columns + " columns, got " + row.length);
            }
        }
        return new DoubleMatrix(rows, columns, cells);
    }

    public static DoubleMatrix of(double[][] values) {
        int columns = values.length == 0 ? 0 : values[0].length;
        double[][] copy = new double[values.length][];
        for (int r = 0; r < values.length; r++) {
            copy[r] = values[r].clone();
        }
        return wrap(values.length, columns, copy);
    }

    @Override
    public int rows() { return rows; }

    @Override
    public int columns() { return columns; }

    @Override
    public double get(int row, int column) {
        return cells[row][column];
    }

    @Override
    public double[] row(int row) {
        return cells[row].clone();
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

    @Override
    public String toString() {
        return String.format("DoubleMatrix[%dx%d]", rows, columns);
    }
}
