package pl.marcinmilkowski.word_vectors.similarity;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * The built-in similarity measures.
 */
public final class SimilarityMeasures {

    public static final SimilarityMeasure COSINE = new CosineSimilarity();
    public static final SimilarityMeasure JACCARD = new JaccardSimilarity();
    public static final SimilarityMeasure DICE = new DiceSimilarity();

    private static final List<SimilarityMeasure> ALL = List.of(COSINE, JACCARD, DICE);

    private SimilarityMeasures() {
        // Utility class - prevent instantiation
    }

    /**
     * Cosine, Jaccard and Dice, in that order.
     */
    public static List<SimilarityMeasure> all() {
        return ALL;
    }

    /**
     * Look up a measure by name, ignoring case.
     *
     * @throws IllegalArgumentException for an unknown name
     */
    public static SimilarityMeasure byName(String name) {
        if (name != null) {
            String key = name.trim().toLowerCase(Locale.ROOT);
            for (SimilarityMeasure measure : ALL) {
                if (measure.name().equals(key)) {
                    return measure;
                }
            }
        }
        throw new IllegalArgumentException("Unknown similarity measure: " + name + " (known: "
            + ALL.stream().map(SimilarityMeasure::name).collect(Collectors.joining(", ")) + ")");
    }
}
