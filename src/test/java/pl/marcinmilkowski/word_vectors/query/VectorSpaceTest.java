package pl.marcinmilkowski.word_vectors.query;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import pl.marcinmilkowski.word_vectors.config.VectorConfig;
import pl.marcinmilkowski.word_vectors.corpus.Corpus;
import pl.marcinmilkowski.word_vectors.corpus.CorpusLine;
import pl.marcinmilkowski.word_vectors.indexer.DoubleMatrix;
import pl.marcinmilkowski.word_vectors.indexer.EntityIndex;
import pl.marcinmilkowski.word_vectors.indexer.IntMatrix;
import pl.marcinmilkowski.word_vectors.indexer.Matrix;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Builds the whole pipeline over the test play corpus.
 */
class VectorSpaceTest {

    private static VectorSpace space;

    @BeforeAll
    static void buildSpace() {
        space = VectorSpace.build(CorpusFixtures.plays(), VectorConfig.defaults());
    }

    @Test
    @DisplayName("Indexes follow the vocabulary file and first appearance of plays")
    void testIndexes() {
        assertEquals(21, space.getVocabulary().size());
        assertEquals(List.of("Hamlet", "Macbeth", "King Lear", "Othello"), space.getDocuments().names());
        assertEquals(0, space.getVocabulary().positionOf("the"));
    }

    @Test
    @DisplayName("All four matrices share the index dimensions")
    void testShapes() {
        for (MatrixKind kind : MatrixKind.values()) {
            Matrix matrix = space.matrix(kind);
            assertEquals(21, matrix.rows(), kind.id());
            assertEquals(kind.hasDocumentColumns() ? 4 : 21, matrix.columns(), kind.id());
        }
    }

    @Test
    @DisplayName("Term-document counts of the test corpus")
    void testTermDocumentCounts() {
        IntMatrix termDocument = space.getTermDocument();
        EntityIndex words = space.getVocabulary();
        EntityIndex documents = space.getDocuments();

        assertEquals(2, termDocument.count(words.positionOf("the"), documents.positionOf("Hamlet")));
        assertEquals(4, termDocument.count(words.positionOf("the"), documents.positionOf("King Lear")));
        assertEquals(2, termDocument.count(words.positionOf("in"), documents.positionOf("Macbeth")));
        assertEquals(1, termDocument.count(words.positionOf("me"), documents.positionOf("Othello")));
        assertEquals(0, termDocument.count(words.positionOf("gain"), documents.positionOf("Hamlet")));
        assertEquals(37, termDocument.sum());
    }

    @Test
    void testHapaxLegomena() {
        // answer, stand, thunder, rain, fair, foul, day, question, duke, kingdom
        assertEquals(10, space.hapaxLegomena());
    }

    @Test
    @DisplayName("Term-context is symmetric and PPMI non-negative and zero-preserving")
    void testDerivedMatrixProperties() {
        IntMatrix termContext = space.getTermContext();
        DoubleMatrix ppmi = space.getPpmi();
        for (int i = 0; i < termContext.rows(); i++) {
            for (int j = 0; j < termContext.columns(); j++) {
                assertEquals(termContext.count(i, j), termContext.count(j, i));
                assertTrue(ppmi.get(i, j) >= 0.0);
                if (termContext.count(i, j) == 0) {
                    assertEquals(0.0, ppmi.get(i, j));
                }
            }
        }
    }

    @Test
    @DisplayName("Window size comes from the configuration")
    void testWindowSizeFromConfig() {
        Corpus corpus = new Corpus(
            List.of(CorpusLine.of("A", "a", "x", "x", "b")),
            List.of("A"),
            List.of("a", "b"));

        VectorSpace narrow = VectorSpace.build(corpus, VectorConfig.defaults().withWindowSize(2));
        VectorSpace wide = VectorSpace.build(corpus, VectorConfig.defaults().withWindowSize(3));

        assertEquals(0, narrow.getTermContext().count(0, 1));
        assertEquals(1, wide.getTermContext().count(0, 1));
        assertEquals(3, wide.getWindowSize());
    }

    @Test
    void testMismatchedShapesRejected() {
        EntityIndex words = EntityIndex.ofWords(List.of("a", "b"));
        EntityIndex documents = EntityIndex.ofDocuments(List.of("A"));
        IntMatrix termDocument = IntMatrix.of(new int[][] {{1}, {0}});
        IntMatrix termContext = IntMatrix.of(new int[2][2]);

        assertThrows(IllegalArgumentException.class, () -> new VectorSpace(words, documents, 1,
            termDocument, termContext, DoubleMatrix.of(new double[][] {{1, 0}, {0, 0}}), DoubleMatrix.of(new double[2][2])));
    }
}
