package pl.marcinmilkowski.word_vectors.indexer;

/**
 * Direction along which entity vectors are read from a matrix.
 * ROW vectors are vocabulary tokens, COLUMN vectors are documents (term-document family).
 */
public enum Axis {
    ROW,
    COLUMN
}
