package pl.marcinmilkowski.word_vectors.corpus;

import java.util.List;

/**
 * A tokenized corpus together with the document names and vocabulary it is indexed by.
 *
 * Lines may name documents or contain tokens outside the two lists; those are ignored
 * when the matrices are built.
 */
public record Corpus(
    List<CorpusLine> lines,
    List<String> documentNames,
    List<String> vocabulary
) {
    public Corpus {
        lines = List.copyOf(lines);
        documentNames = List.copyOf(documentNames);
        vocabulary = List.copyOf(vocabulary);
    }

    public long tokenCount() {
        long count = 0;
        for (CorpusLine line : lines) {
            count += line.tokens().size();
        }
        return count;
    }
}
