package pl.marcinmilkowski.word_vectors.config;

import com.alibaba.fastjson2.JSONObject;

/**
 * Settings of a vector space build and of the reports run against it.
 *
 * @param windowSize context radius in tokens for the term-context matrix
 * @param epsilon    zero guard added to document frequencies in the idf denominator
 * @param topK       number of entries shown per ranking
 * @param threads    worker threads for report generation and the API server
 */
public record VectorConfig(int windowSize, double epsilon, int topK, int threads) {

    public static final int DEFAULT_WINDOW_SIZE = 4;
    public static final double DEFAULT_EPSILON = 1e-10;
    public static final int DEFAULT_TOP_K = 10;

    public VectorConfig {
        if (windowSize < 1) {
            throw new IllegalArgumentException("window_size must be at least 1, got " + windowSize);
        }
        if (!(epsilon > 0) || Double.isInfinite(epsilon)) {
            throw new IllegalArgumentException("epsilon must be a positive finite number, got " + epsilon);
        }
        if (topK < 1) {
            throw new IllegalArgumentException("top_k must be at least 1, got " + topK);
        }
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be at least 1, got " + threads);
        }
    }

    public static VectorConfig defaults() {
        return new VectorConfig(DEFAULT_WINDOW_SIZE, DEFAULT_EPSILON, DEFAULT_TOP_K,
            Runtime.getRuntime().availableProcessors());
    }

    public VectorConfig withWindowSize(int windowSize) {
        return new VectorConfig(windowSize, epsilon, topK, threads);
    }

    public VectorConfig withTopK(int topK) {
        return new VectorConfig(windowSize, epsilon, topK, threads);
    }

    /**
     * Export for API responses, using the same keys as the config file.
     */
    public JSONObject toJson() {
        JSONObject obj = new JSONObject();
        obj.put(VectorConfigLoader.KEY_WINDOW_SIZE, windowSize);
        obj.put(VectorConfigLoader.KEY_EPSILON, epsilon);
        obj.put(VectorConfigLoader.KEY_TOP_K, topK);
        obj.put(VectorConfigLoader.KEY_THREADS, threads);
        return obj;
    }
}
