package pl.marcinmilkowski.word_vectors.weighting;

import pl.marcinmilkowski.word_vectors.indexer.DoubleMatrix;
import pl.marcinmilkowski.word_vectors.indexer.IntMatrix;

/**
 * Positive pointwise mutual information weighting of a term-context matrix.
 *
 * For a term-context matrix T:
 * - total = sum of all cells
 * - expected(i,j) = rowSum(i) * colSum(j) / total
 * - PPMI(i,j) = max(0, log2((T(i,j) * total) / expected(i,j)))
 *
 * Cells whose ratio is 0, 0/0 or otherwise non-finite are 0, so the result never holds
 * NaN or infinities. An empty matrix (total == 0) gives all zeros.
 */
public final class PpmiWeighting {

    private static final double LN_2 = Math.log(2);

    private PpmiWeighting() {
    }

    public static DoubleMatrix apply(IntMatrix termContext) {
        int rows = termContext.rows();
        int columns = termContext.columns();
        double[][] ppmi = new double[rows][columns];

        long total = termContext.sum();
        if (total == 0) {
            return DoubleMatrix.wrap(rows, columns, ppmi);
        }

        long[] rowSums = termContext.rowSums();
        long[] columnSums = termContext.columnSums();
        double totalSum = total;

        for (int i = 0; i < rows; i++) {
            if (rowSums[i] == 0) {
                continue;
            }
            for (int j = 0; j < columns; j++) {
                ppmi[i][j] = cell(termContext.count(i, j), rowSums[i], columnSums[j], totalSum);
            }
        }
        return DoubleMatrix.wrap(rows, columns, ppmi);
    }

    /**
     * PPMI of a single cell given its count and the marginal sums.
     */
    public static double cell(long count, long rowSum, long columnSum, double total) {
        if (count <= 0 || total <= 0) {
            return 0.0;
        }
        double expected = ((double) rowSum * (double) columnSum) / total;
        if (!(expected > 0)) {
            return 0.0;
        }
        double pmi = Math.log((count * total) / expected) / LN_2;
        if (Double.isNaN(pmi) || Double.isInfinite(pmi) || pmi < 0) {
            return 0.0;
        }
        return pmi;
    }
}
