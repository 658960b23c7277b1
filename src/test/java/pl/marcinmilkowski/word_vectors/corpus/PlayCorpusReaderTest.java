package pl.marcinmilkowski.word_vectors.corpus;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for PlayCorpusReader.
 */
class PlayCorpusReaderTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Reads play name from column 1 and tokenized text from column 5")
    void testReadLines() throws IOException {
        Path csv = write("plays.csv",
            "1;\"Hamlet\";1;1.1.1;\"BERNARDO\";\"Who's there?\"",
            "2;\" Hamlet \";2;1.1.2;\"FRANCISCO\";\"Nay, answer me; stand!\"");

        try (PlayCorpusReader reader = new PlayCorpusReader()) {
            List<CorpusLine> lines = reader.readLines(csv);

            assertEquals(2, lines.size());
            assertEquals(CorpusLine.of("Hamlet", "who", "s", "there"), lines.get(0));
            // quoted semicolon stays inside the field
            assertEquals(List.of("nay", "answer", "me", "stand"), lines.get(1).tokens());
            assertEquals("Hamlet", lines.get(1).document());
        }
    }

    @Test
    @DisplayName("Records with too few columns are skipped")
    void testShortRecordsSkipped() throws IOException {
        Path csv = write("plays.csv",
            "1;\"Hamlet\";1;1.1.1;\"BERNARDO\";\"Who's there?\"",
            "2;\"Othello\"",
            "3;\"Macbeth\";1;1.1.1;\"First Witch\";\"When shall we three meet again\"");

        try (PlayCorpusReader reader = new PlayCorpusReader()) {
            List<CorpusLine> lines = reader.readLines(csv);

            assertEquals(2, lines.size());
            assertEquals("Macbeth", lines.get(1).document());
        }
    }

    @Test
    @DisplayName("A stray quote inside a quoted line does not stop the read")
    void testStrayQuoteInLine() throws IOException {
        Path csv = write("plays.csv",
            "1;\"Hamlet\";1;1.1.1;\"BERNARDO\";\"Who's there?\"",
            "2;\"Hamlet\";2;1.1.2;\"FRANCISCO\";\"He cried \"Ay\" and fled\"",
            "3;\"Macbeth\";1;1.1.1;\"First Witch\";\"When shall we three meet again\"");

        try (PlayCorpusReader reader = new PlayCorpusReader()) {
            List<CorpusLine> lines = reader.readLines(csv);

            assertEquals(3, lines.size());
            assertEquals("Hamlet", lines.get(1).document());
            assertEquals(List.of("he", "cried", "ay", "and", "fled"), lines.get(1).tokens());
            assertEquals("Macbeth", lines.get(2).document());
        }
    }

    @Test
    @DisplayName("Document names are distinct, in order of first appearance")
    void testDocumentOrder() throws IOException {
        Path csv = write("plays.csv",
            "1;Macbeth;1;1.1.1;A;\"one\"",
            "2;Hamlet;1;1.1.1;B;\"two\"",
            "3;Macbeth;2;1.1.2;A;\"three\"",
            "4;As You Like It;1;1.1.1;C;\"four\"");
        Path vocab = write("vocab.txt", "one", "two");

        try (PlayCorpusReader reader = new PlayCorpusReader()) {
            Corpus corpus = reader.read(csv, vocab);

            assertEquals(List.of("Macbeth", "Hamlet", "As You Like It"), corpus.documentNames());
            assertEquals(4, corpus.lines().size());
            assertEquals(4, corpus.tokenCount());
        }
    }

    @Test
    @DisplayName("Vocabulary is trimmed, blank lines and repeats dropped")
    void testReadVocabulary() throws IOException {
        Path vocab = write("vocab.txt", "king", "  queen  ", "", "king", "   ", "gain");

        try (PlayCorpusReader reader = new PlayCorpusReader()) {
            assertEquals(List.of("king", "queen", "gain"), reader.readVocabulary(vocab));
        }
    }

    @Test
    void testMissingFile() {
        try (PlayCorpusReader reader = new PlayCorpusReader()) {
            assertThrows(NoSuchFileException.class, () -> reader.readLines(tempDir.resolve("missing.csv")));
            assertThrows(NoSuchFileException.class, () -> reader.readVocabulary(tempDir.resolve("missing.txt")));
        }
    }

    private Path write(String name, String... lines) throws IOException {
        Path file = tempDir.resolve(name);
        Files.write(file, List.of(lines), StandardCharsets.UTF_8);
        return file;
    }
}
