package pl.marcinmilkowski.word_vectors.indexer;

/**
 * Read-only dense matrix whose rows and columns are entity positions of an {@link EntityIndex}.
 */
public interface Matrix {

    int rows();

    int columns();

    double get(int row, int column);

    /**
     * Copy of row {@code row}.
     */
    double[] row(int row);

    /**
     * Copy of column {@code column}.
     */
    double[] column(int column);

    default int size(Axis axis) {
        return axis == Axis.ROW ? rows() : columns();
    }

    default double[] vector(Axis axis, int index) {
        return axis == Axis.ROW ? row(index) : column(index);
    }
}
