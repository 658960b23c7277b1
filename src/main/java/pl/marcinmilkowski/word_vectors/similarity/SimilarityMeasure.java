package pl.marcinmilkowski.word_vectors.similarity;

/**
 * A similarity score between two equal-length vectors.
 *
 * Implementations are total: zero vectors and other degenerate inputs score 0
 * instead of raising or producing NaN.
 */
public interface SimilarityMeasure {

    /**
     * @throws IllegalArgumentException if the vectors differ in length
     */
    double score(double[] a, double[] b);

    /**
     * Short name used on the command line and in reports ("cosine", "jaccard", "dice").
     */
    String name();

    /**
     * Heading used in report tables.
     */
    default String displayName() {
        String name = name();
        return Character.toUpperCase(name.charAt(0)) + name.substring(1);
    }

    static void requireSameLength(double[] a, double[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Vector lengths differ: " + a.length + " vs " + b.length);
        }
    }
}
