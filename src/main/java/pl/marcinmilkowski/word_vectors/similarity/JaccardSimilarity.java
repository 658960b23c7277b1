package pl.marcinmilkowski.word_vectors.similarity;

/**
 * Jaccard coefficient of the binarized vectors: |A and B| / |A or B|, where a dimension
 * is present when its value is greater than zero. 0 when neither vector has any.
 */
public class JaccardSimilarity implements SimilarityMeasure {

    @Override
    public double score(double[] a, double[] b) {
        SimilarityMeasure.requireSameLength(a, b);
        int intersection = 0;
        int union = 0;
        for (int i = 0; i < a.length; i++) {
            boolean inA = a[i] > 0;
            boolean inB = b[i] > 0;
            if (inA && inB) {
                intersection++;
            }
            if (inA || inB) {
                union++;
            }
        }
        if (union == 0) {
            return 0.0;
        }
        return (double) intersection / union;
    }

    @Override
    public String name() {
        return "jaccard";
    }
}
