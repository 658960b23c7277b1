package pl.marcinmilkowski.word_vectors.similarity;

/**
 * Dice coefficient of the binarized vectors: 2 * |A and B| / (|A| + |B|).
 * Same presence test as {@link JaccardSimilarity}; 0 when both vectors are empty.
 */
public class DiceSimilarity implements SimilarityMeasure {

    @Override
    public double score(double[] a, double[] b) {
        SimilarityMeasure.requireSameLength(a, b);
        int intersection = 0;
        int total = 0;
        for (int i = 0; i < a.length; i++) {
            boolean inA = a[i] > 0;
            boolean inB = b[i] > 0;
            if (inA) total++;
            if (inB) total++;
            if (inA && inB) intersection++;
        }
        if (total == 0) {
            return 0.0;
        }
        return 2.0 * intersection / total;
    }

    @Override
    public String name() {
        return "dice";
    }
}
