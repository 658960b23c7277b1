package pl.marcinmilkowski.word_vectors.query;

import java.util.Locale;

/**
 * A ranking entry resolved to its entity name, with its 1-based rank.
 */
public record RankedEntity(int rank, String name, double score) {

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "%d: %s (%.4f)", rank, name, score);
    }
}
