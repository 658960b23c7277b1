package pl.marcinmilkowski.word_vectors.weighting;

import pl.marcinmilkowski.word_vectors.indexer.DoubleMatrix;
import pl.marcinmilkowski.word_vectors.indexer.IntMatrix;

/**
 * TF-IDF weighting of a term-document matrix F (rows = words, columns = documents).
 *
 * - df(w) = number of documents d with F(w,d) > 0
 * - idf(w) = ln(|D| / (df(w) + epsilon))
 * - tfidf(w,d) = F(w,d) * idf(w)
 *
 * Epsilon only keeps the quotient finite for words that never occur.
 */
public class TfIdfWeighting {

    public static final double DEFAULT_EPSILON = 1e-10;

    private final double epsilon;

    public TfIdfWeighting() {
        this(DEFAULT_EPSILON);
    }

    public TfIdfWeighting(double epsilon) {
        if (!(epsilon > 0) || Double.isInfinite(epsilon)) {
            throw new IllegalArgumentException("epsilon must be a positive finite number, got " + epsilon);
        }
        this.epsilon = epsilon;
    }

    public double getEpsilon() {
        return epsilon;
    }

    public DoubleMatrix apply(IntMatrix termDocument) {
        int rows = termDocument.rows();
        int columns = termDocument.columns();
        double[][] weights = new double[rows][columns];

        for (int w = 0; w < rows; w++) {
            double idf = inverseDocumentFrequency(documentFrequency(termDocument, w), columns);
            for (int d = 0; d < columns; d++) {
                weights[w][d] = termDocument.count(w, d) * idf;
            }
        }
        return DoubleMatrix.wrap(rows, columns, weights);
    }

    public double inverseDocumentFrequency(int documentFrequency, int documentCount) {
        return Math.log(documentCount / (documentFrequency + epsilon));
    }

    static int documentFrequency(IntMatrix termDocument, int row) {
        int df = 0;
        for (int d = 0; d < termDocument.columns(); d++) {
            if (termDocument.count(row, d) > 0) {
                df++;
            }
        }
        return df;
    }
}
