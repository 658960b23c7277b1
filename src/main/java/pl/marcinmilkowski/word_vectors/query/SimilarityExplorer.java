package pl.marcinmilkowski.word_vectors.query;

import pl.marcinmilkowski.word_vectors.indexer.Axis;
import pl.marcinmilkowski.word_vectors.indexer.EntityIndex;
import pl.marcinmilkowski.word_vectors.indexer.Matrix;
import pl.marcinmilkowski.word_vectors.indexer.UnknownEntityException;
import pl.marcinmilkowski.word_vectors.similarity.SimilarityMeasure;

import java.util.ArrayList;
import java.util.List;

/**
 * Answers "which documents resemble this one" and "which words resemble this one" by name.
 *
 * Names are resolved before any ranking work, so an unknown document or word fails fast
 * with {@link UnknownEntityException}.
 */
public class SimilarityExplorer {

    private final VectorSpace space;
    private final SimilarityRanker ranker;

    public SimilarityExplorer(VectorSpace space) {
        this(space, new SimilarityRanker());
    }

    public SimilarityExplorer(VectorSpace space, SimilarityRanker ranker) {
        this.space = space;
        this.ranker = ranker;
    }

    public VectorSpace getSpace() {
        return space;
    }

    /**
     * Documents most similar to {@code document}, compared as columns of {@code kind}.
     *
     * @param limit maximum number of entries; 0 or less returns the full ranking
     * @throws UnknownEntityException if the document is not indexed
     * @throws IllegalArgumentException if {@code kind} has no document columns
     */
    public List<RankedEntity> similarDocuments(String document, MatrixKind kind,
                                               SimilarityMeasure measure, int limit) {
        requireDocumentColumns(kind);
        int pivot = space.getDocuments().positionOf(document);
        return resolve(space.getDocuments(),
            ranker.rank(space.matrix(kind), Axis.COLUMN, pivot, measure), limit);
    }

    /**
     * Words most similar to {@code word}, compared as rows of {@code kind}.
     *
     * @param limit maximum number of entries; 0 or less returns the full ranking
     * @throws UnknownEntityException if the word is not in the vocabulary
     */
    public List<RankedEntity> similarWords(String word, MatrixKind kind,
                                           SimilarityMeasure measure, int limit) {
        int pivot = space.getVocabulary().positionOf(word);
        return resolve(space.getVocabulary(),
            ranker.rank(space.matrix(kind), Axis.ROW, pivot, measure), limit);
    }

    public double documentSimilarity(String first, String second, MatrixKind kind, SimilarityMeasure measure) {
        requireDocumentColumns(kind);
        Matrix matrix = space.matrix(kind);
        return measure.score(
            matrix.column(space.getDocuments().positionOf(first)),
            matrix.column(space.getDocuments().positionOf(second)));
    }

    public double wordSimilarity(String first, String second, MatrixKind kind, SimilarityMeasure measure) {
        Matrix matrix = space.matrix(kind);
        return measure.score(
            matrix.row(space.getVocabulary().positionOf(first)),
            matrix.row(space.getVocabulary().positionOf(second)));
    }

    private static void requireDocumentColumns(MatrixKind kind) {
        if (!kind.hasDocumentColumns()) {
            throw new IllegalArgumentException("The " + kind.id() + " matrix has no document columns");
        }
    }

    private static List<RankedEntity> resolve(EntityIndex index, List<RankedIndex> ranking, int limit) {
        int n = limit > 0 ? Math.min(limit, ranking.size()) : ranking.size();
        List<RankedEntity> result = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            RankedIndex entry = ranking.get(i);
            result.add(new RankedEntity(i + 1, index.nameAt(entry.index()), entry.score()));
        }
        return result;
    }
}
