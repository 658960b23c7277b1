package pl.marcinmilkowski.word_vectors.corpus;

import java.util.List;

/**
 * One tokenized line of the corpus and the document it belongs to.
 * Tokens are expected lowercased and stripped of non-alphanumeric characters.
 */
public record CorpusLine(String document, List<String> tokens) {

    public CorpusLine {
        tokens = tokens != null ? List.copyOf(tokens) : List.of();
    }

    public static CorpusLine of(String document, String... tokens) {
        return new CorpusLine(document, List.of(tokens));
    }
}
