package pl.marcinmilkowski.word_vectors.indexer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.word_vectors.corpus.CorpusLine;

import java.util.List;

/**
 * Builds the count matrices of a corpus.
 *
 * Term-document: cell (w, d) is the number of occurrences of token w in lines of document d.
 * Term-context: cell (i, j) is the number of times token j occurs within {@code windowSize}
 * positions to the left or right of an occurrence of token i in the same line.
 *
 * Lines of unknown documents and tokens outside the vocabulary are skipped.
 *
 * Usage:
 *   MatrixBuilder builder = new MatrixBuilder(vocabulary, documents, 4);
 *   IntMatrix termDocument = builder.buildTermDocument(corpus.lines());
 *   IntMatrix termContext = builder.buildTermContext(corpus.lines());
 */
public class MatrixBuilder {

    private static final Logger logger = LoggerFactory.getLogger(MatrixBuilder.class);

    private final EntityIndex vocabulary;
    private final EntityIndex documents;
    private final int windowSize;

    public MatrixBuilder(EntityIndex vocabulary, EntityIndex documents, int windowSize) {
        if (windowSize < 1) {
            throw new IllegalArgumentException("Context window size must be positive, got " + windowSize);
        }
        this.vocabulary = vocabulary;
        this.documents = documents;
        this.windowSize = windowSize;
    }

    public int getWindowSize() {
        return windowSize;
    }

    /**
     * |V| x |D| matrix of raw occurrence counts.
     */
    public IntMatrix buildTermDocument(List<CorpusLine> lines) {
        int rows = vocabulary.size();
        int columns = documents.size();
        int[][] counts = new int[rows][columns];
        long counted = 0;
        long skippedLines = 0;

        for (CorpusLine line : lines) {
            int documentId = documents.find(line.document());
            if (documentId < 0) {
                skippedLines++;
                continue;
            }
            for (String token : line.tokens()) {
                int wordId = vocabulary.find(token);
                if (wordId >= 0) {
                    counts[wordId][documentId]++;
                    counted++;
                }
            }
        }

        IntMatrix matrix = new IntMatrix(rows, columns, counts);
        logger.info("Term-document matrix {}x{}: {} occurrences counted, {} lines of unknown documents skipped",
            rows, columns, counted, skippedLines);
        logger.info("Number of hapax legomena (singletons): {}", matrix.hapaxLegomena());
        return matrix;
    }

    /**
     * |V| x |V| matrix of co-occurrence counts within the context window. Symmetric.
     */
    public IntMatrix buildTermContext(List<CorpusLine> lines) {
        int n = vocabulary.size();
        int[][] counts = new int[n][n];

        for (CorpusLine line : lines) {
            List<String> tokens = line.tokens();
            int length = tokens.size();
            // resolve each position once
            int[] ids = new int[length];
            for (int i = 0; i < length; i++) {
                ids[i] = vocabulary.find(tokens.get(i));
            }

            for (int i = 0; i < length; i++) {
                int target = ids[i];
                if (target < 0) {
                    continue;
                }
                int left = Math.max(0, i - windowSize);
                int right = Math.min(length, i + windowSize + 1);
                for (int j = left; j < right; j++) {
                    if (j == i) {
                        continue;
                    }
                    int context = ids[j];
                    if (context >= 0) {
                        counts[target][context]++;
                    }
                }
            }
        }

        IntMatrix matrix = new IntMatrix(n, n, counts);
        logger.info("Term-context matrix {}x{} (window={}): {} co-occurrences", n, n, windowSize, matrix.sum());
        return matrix;
    }
}
