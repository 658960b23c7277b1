package pl.marcinmilkowski.word_vectors.corpus;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads a play-text corpus: a semicolon-delimited CSV with one spoken line per record,
 * plus a vocabulary file with one token per line.
 *
 * CSV layout (0-based columns):
 *   1 - play name (the document)
 *   5 - the line text
 * Other columns (line id, act/scene, speaker, ...) are ignored.
 * Text after a closing quote is kept as part of the field, so a stray quote inside a line does not end the read.
 *
 * Usage:
 *   try (PlayCorpusReader reader = new PlayCorpusReader()) {
 *       Corpus corpus = reader.read(Paths.get("will_play_text.csv"), Paths.get("vocab.txt"));
 *   }
 */
public class PlayCorpusReader implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(PlayCorpusReader.class);

    public static final int DOCUMENT_COLUMN = 1;
    public static final int TEXT_COLUMN = 5;

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
        .setDelimiter(';')
        .setTrailingData(true)
        .build();

    private final LineTokenizer tokenizer;

    public PlayCorpusReader() {
        this(new LineTokenizer());
    }

    public PlayCorpusReader(LineTokenizer tokenizer) {
        this.tokenizer = tokenizer;
    }

    /**
     * Read the corpus lines and the vocabulary.
     * Document names are the distinct play names in order of first appearance.
     */
    public Corpus read(Path csvFile, Path vocabularyFile) throws IOException {
        List<CorpusLine> lines = readLines(csvFile);

        Set<String> documents = new LinkedHashSet<>();
        for (CorpusLine line : lines) {
            documents.add(line.document());
        }

        List<String> vocabulary = readVocabulary(vocabularyFile);

        logger.info("Term-Document Matrix will be: {}x{} (|V| x D)", vocabulary.size(), documents.size());
        return new Corpus(lines, new ArrayList<>(documents), vocabulary);
    }

    public List<CorpusLine> readLines(Path csvFile) throws IOException {
        requireFile(csvFile);
        List<CorpusLine> lines = new ArrayList<>();
        int skipped = 0;

        try (Reader in = Files.newBufferedReader(csvFile, StandardCharsets.UTF_8);
             CSVParser parser = FORMAT.parse(in)) {
            for (CSVRecord record : parser) {
                if (record.size() <= TEXT_COLUMN) {
                    skipped++;
                    logger.warn("Skipping record {} of {}: expected at least {} columns, got {}",
                        record.getRecordNumber(), csvFile, TEXT_COLUMN + 1, record.size());
                    continue;
                }
                String document = record.get(DOCUMENT_COLUMN).trim();
                lines.add(new CorpusLine(document, tokenizer.tokenize(record.get(TEXT_COLUMN))));
            }
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }

        logger.info("Read {} lines from {} ({} skipped)", lines.size(), csvFile, skipped);
        return lines;
    }

    /**
     * One token per line; surrounding whitespace trimmed, blank lines and repeats dropped.
     */
    public List<String> readVocabulary(Path vocabularyFile) throws IOException {
        requireFile(vocabularyFile);
        Set<String> vocabulary = new LinkedHashSet<>();

        try (BufferedReader reader = Files.newBufferedReader(vocabularyFile, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                String token = line.trim();
                if (token.isEmpty()) {
                    continue;
                }
                if (!vocabulary.add(token)) {
                    logger.warn("Duplicate vocabulary entry '{}' in {} ignored", token, vocabularyFile);
                }
            }
        }

        return new ArrayList<>(vocabulary);
    }

    private static void requireFile(Path file) throws IOException {
        if (!Files.exists(file)) {
            throw new NoSuchFileException(file.toString(), null, "Corpus file not found");
        }
    }

    @Override
    public void close() {
        tokenizer.close();
    }
}
