package pl.marcinmilkowski.word_vectors.similarity;

/**
 * dot(a, b) / (|a| * |b|), or 0 when either vector has zero norm.
 */
public class CosineSimilarity implements SimilarityMeasure {

    @Override
    public double score(double[] a, double[] b) {
        SimilarityMeasure.requireSameLength(a, b);
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    @Override
    public String name() {
        return "cosine";
    }
}
