package pl.marcinmilkowski.word_vectors.query;

import pl.marcinmilkowski.word_vectors.indexer.Axis;
import pl.marcinmilkowski.word_vectors.indexer.Matrix;
import pl.marcinmilkowski.word_vectors.similarity.SimilarityMeasure;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Orders the entities along one axis of a matrix by similarity to a pivot entity.
 *
 * The pivot itself is left out, so an axis of size n yields n - 1 entries. Scores are
 * sorted in descending order with a stable sort: equal scores keep ascending index order,
 * which matters because many scores tie at 0.
 */
public class SimilarityRanker {

    private static final Comparator<RankedIndex> BY_SCORE_DESCENDING =
        (a, b) -> Double.compare(b.score(), a.score());

    public List<RankedIndex> rank(Matrix matrix, Axis axis, int pivot, SimilarityMeasure measure) {
        int size = matrix.size(axis);
        if (pivot < 0 || pivot >= size) {
            throw new IndexOutOfBoundsException("Pivot " + pivot + " out of range [0, " + size + ") along " + axis);
        }

        double[] pivotVector = matrix.vector(axis, pivot);
        List<RankedIndex> ranking = new ArrayList<>(Math.max(0, size - 1));
        for (int i = 0; i < size; i++) {
            if (i == pivot) {
                continue;
            }
            ranking.add(new RankedIndex(i, measure.score(pivotVector, matrix.vector(axis, i))));
        }

        // List.sort is a stable merge sort
        ranking.sort(BY_SCORE_DESCENDING);
        return ranking;
    }

    /**
     * Indices only, most similar first.
     */
    public List<Integer> rankIndices(Matrix matrix, Axis axis, int pivot, SimilarityMeasure measure) {
        List<RankedIndex> ranking = rank(matrix, axis, pivot, measure);
        List<Integer> indices = new ArrayList<>(ranking.size());
        for (RankedIndex entry : ranking) {
            indices.add(entry.index());
        }
        return indices;
    }

    /**
     * Columns of a term-document style matrix (documents).
     */
    public List<Integer> rankDocuments(int pivot, Matrix termDocument, SimilarityMeasure measure) {
        return rankIndices(termDocument, Axis.COLUMN, pivot, measure);
    }

    /**
     * Rows of any matrix (vocabulary tokens).
     */
    public List<Integer> rankWords(int pivot, Matrix matrix, SimilarityMeasure measure) {
        return rankIndices(matrix, Axis.ROW, pivot, measure);
    }
}
