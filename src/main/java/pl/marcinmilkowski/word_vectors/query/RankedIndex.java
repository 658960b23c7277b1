package pl.marcinmilkowski.word_vectors.query;

/**
 * One entry of a similarity ranking: an entity position and its score against the pivot.
 */
public record RankedIndex(int index, double score) {
}
