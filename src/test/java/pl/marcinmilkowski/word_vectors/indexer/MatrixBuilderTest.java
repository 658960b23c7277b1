package pl.marcinmilkowski.word_vectors.indexer;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import pl.marcinmilkowski.word_vectors.corpus.CorpusLine;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for MatrixBuilder.
 */
class MatrixBuilderTest {

    private static final EntityIndex ABC = EntityIndex.ofWords(List.of("a", "b", "c"));
    private static final EntityIndex DOCS = EntityIndex.ofDocuments(List.of("A", "B"));

    @Test
    @DisplayName("Term-document counts for a two-document corpus")
    void testTermDocumentScenario() {
        List<CorpusLine> lines = List.of(
            CorpusLine.of("A", "a", "b"),
            CorpusLine.of("B", "b", "c"));

        IntMatrix matrix = new MatrixBuilder(ABC, DOCS, 1).buildTermDocument(lines);

        assertArrayEquals(new int[][] {{1, 0}, {1, 1}, {0, 1}}, matrix.toArray());
    }

    @Test
    @DisplayName("Repeated tokens and lines of the same document accumulate")
    void testTermDocumentAccumulates() {
        List<CorpusLine> lines = List.of(
            CorpusLine.of("A", "a", "a", "b"),
            CorpusLine.of("A", "a"),
            CorpusLine.of("B", "c"));

        IntMatrix matrix = new MatrixBuilder(ABC, DOCS, 1).buildTermDocument(lines);

        assertEquals(3, matrix.count(0, 0));
        assertEquals(1, matrix.count(1, 0));
        assertEquals(1, matrix.count(2, 1));
        assertEquals(5, matrix.sum());
    }

    @Test
    @DisplayName("Unknown documents and out-of-vocabulary tokens are skipped")
    void testTermDocumentSkipsUnknown() {
        List<CorpusLine> lines = List.of(
            CorpusLine.of("A", "a", "zzz", "b"),
            CorpusLine.of("Unknown", "a", "b", "c"));

        IntMatrix matrix = new MatrixBuilder(ABC, DOCS, 1).buildTermDocument(lines);

        assertArrayEquals(new int[][] {{1, 0}, {1, 0}, {0, 0}}, matrix.toArray());
    }

    @Test
    @DisplayName("Term-document sum equals the number of resolved occurrences")
    void testCountConservation() {
        List<CorpusLine> lines = randomCorpus(new Random(7), 200);
        EntityIndex vocabulary = EntityIndex.ofWords(List.of("a", "b", "c", "d"));
        EntityIndex documents = EntityIndex.ofDocuments(List.of("A", "B", "C"));

        long expected = 0;
        for (CorpusLine line : lines) {
            if (!documents.contains(line.document())) {
                continue;
            }
            for (String token : line.tokens()) {
                if (vocabulary.contains(token)) {
                    expected++;
                }
            }
        }

        IntMatrix matrix = new MatrixBuilder(vocabulary, documents, 2).buildTermDocument(lines);
        assertEquals(expected, matrix.sum());
    }

    @Test
    @DisplayName("Window 1 over [a, b, c]: neighbours only, truncated at the line ends")
    void testTermContextScenario() {
        IntMatrix matrix = new MatrixBuilder(ABC, DOCS, 1)
            .buildTermContext(List.of(CorpusLine.of("A", "a", "b", "c")));

        assertEquals(1, matrix.count(0, 1));
        assertEquals(1, matrix.count(1, 0));
        assertEquals(1, matrix.count(1, 2));
        assertEquals(1, matrix.count(2, 1));
        assertEquals(0, matrix.count(0, 2));
        assertEquals(0, matrix.count(2, 0));
        assertArrayEquals(new int[][] {{0, 1, 0}, {1, 0, 1}, {0, 1, 0}}, matrix.toArray());
    }

    @Test
    @DisplayName("Window 2 reaches two positions on each side")
    void testTermContextWiderWindow() {
        IntMatrix matrix = new MatrixBuilder(ABC, DOCS, 2)
            .buildTermContext(List.of(CorpusLine.of("A", "a", "b", "c")));

        assertArrayEquals(new int[][] {{0, 1, 1}, {1, 0, 1}, {1, 1, 0}}, matrix.toArray());
    }

    @Test
    @DisplayName("Out-of-vocabulary tokens still occupy window positions")
    void testTermContextUnknownTokensKeepDistance() {
        IntMatrix matrix = new MatrixBuilder(ABC, DOCS, 1)
            .buildTermContext(List.of(CorpusLine.of("A", "a", "zzz", "b")));

        assertEquals(0, matrix.sum());
    }

    @Test
    @DisplayName("Co-occurrence does not cross line boundaries")
    void testTermContextPerLine() {
        IntMatrix matrix = new MatrixBuilder(ABC, DOCS, 3).buildTermContext(List.of(
            CorpusLine.of("A", "a"),
            CorpusLine.of("A", "b")));

        assertEquals(0, matrix.sum());
    }

    @Test
    @DisplayName("A token next to itself counts as its own context")
    void testTermContextSelfCooccurrence() {
        IntMatrix matrix = new MatrixBuilder(ABC, DOCS, 1)
            .buildTermContext(List.of(CorpusLine.of("A", "a", "a")));

        assertEquals(2, matrix.count(0, 0));
    }

    @Test
    @DisplayName("Term-context matrix is symmetric for random corpora and windows")
    void testTermContextSymmetry() {
        Random random = new Random(42);
        EntityIndex vocabulary = EntityIndex.ofWords(List.of("a", "b", "c", "d"));
        EntityIndex documents = EntityIndex.ofDocuments(List.of("A", "B", "C"));

        for (int window = 1; window <= 5; window++) {
            IntMatrix matrix = new MatrixBuilder(vocabulary, documents, window)
                .buildTermContext(randomCorpus(random, 100));
            for (int i = 0; i < matrix.rows(); i++) {
                for (int j = 0; j < matrix.columns(); j++) {
                    assertEquals(matrix.count(i, j), matrix.count(j, i),
                        "T[" + i + "][" + j + "] != T[" + j + "][" + i + "] for window " + window);
                    assertTrue(matrix.count(i, j) >= 0);
                }
            }
        }
    }

    @Test
    void testEmptyCorpus() {
        MatrixBuilder builder = new MatrixBuilder(ABC, DOCS, 1);

        assertEquals(0, builder.buildTermDocument(List.of()).sum());
        IntMatrix termContext = builder.buildTermContext(List.of());
        assertEquals(3, termContext.rows());
        assertEquals(3, termContext.columns());
        assertEquals(0, termContext.sum());
    }

    @Test
    void testWindowSizeMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new MatrixBuilder(ABC, DOCS, 0));
    }

    private static List<CorpusLine> randomCorpus(Random random, int lineCount) {
        String[] tokens = {"a", "b", "c", "d", "x", "y"};
        String[] documents = {"A", "B", "C", "Z"};
        List<CorpusLine> lines = new ArrayList<>();
        for (int i = 0; i < lineCount; i++) {
            int length = random.nextInt(12);
            List<String> line = new ArrayList<>(length);
            for (int t = 0; t < length; t++) {
                line.add(tokens[random.nextInt(tokens.length)]);
            }
            lines.add(new CorpusLine(documents[random.nextInt(documents.length)], line));
        }
        return lines;
    }
}
