package pl.marcinmilkowski.word_vectors.config;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

/**
 * Loads {@link VectorConfig} from JSON.
 *
 * Expected JSON structure (every key optional, defaults shown):
 * {
 *   "window_size": 4,
 *   "epsilon": 1e-10,
 *   "top_k": 10,
 *   "threads": 8
 * }
 * Unknown keys are logged and ignored.
 */
public class VectorConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(VectorConfigLoader.class);

    public static final String KEY_WINDOW_SIZE = "window_size";
    public static final String KEY_EPSILON = "epsilon";
    public static final String KEY_TOP_K = "top_k";
    public static final String KEY_THREADS = "threads";

    private static final Set<String> KNOWN_KEYS = Set.of(KEY_WINDOW_SIZE, KEY_EPSILON, KEY_TOP_K, KEY_THREADS);

    private VectorConfigLoader() {
    }

    /**
     * Load configuration from a file, or the defaults when {@code configPath} is null.
     *
     * @throws IOException if the file does not exist or cannot be read
     * @throws IllegalArgumentException if the content is not a JSON object or a value is invalid
     */
    public static VectorConfig load(Path configPath) throws IOException {
        if (configPath == null) {
            return VectorConfig.defaults();
        }
        if (!Files.exists(configPath)) {
            throw new IOException("Config file not found: " + configPath);
        }
        VectorConfig config = parse(Files.readString(configPath));
        logger.info("Loaded config from {}: window_size={}, epsilon={}, top_k={}, threads={}",
            configPath, config.windowSize(), config.epsilon(), config.topK(), config.threads());
        return config;
    }

    public static VectorConfig parse(String content) {
        JSONObject root;
        try {
            root = JSON.parseObject(content);
        } catch (JSONException e) {
            throw new IllegalArgumentException("Invalid config JSON: " + e.getMessage(), e);
        }
        VectorConfig defaults = VectorConfig.defaults();
        if (root == null) {
            return defaults;
        }

        for (String key : root.keySet()) {
            if (!KNOWN_KEYS.contains(key)) {
                logger.warn("Ignoring unknown config key '{}'", key);
            }
        }

        try {
            int windowSize = root.containsKey(KEY_WINDOW_SIZE) ? root.getIntValue(KEY_WINDOW_SIZE) : defaults.windowSize();
            double epsilon = root.containsKey(KEY_EPSILON) ? root.getDoubleValue(KEY_EPSILON) : defaults.epsilon();
            int topK = root.containsKey(KEY_TOP_K) ? root.getIntValue(KEY_TOP_K) : defaults.topK();
            int threads = root.containsKey(KEY_THREADS) ? root.getIntValue(KEY_THREADS) : defaults.threads();
            return new VectorConfig(windowSize, epsilon, topK, threads);
        } catch (JSONException | NumberFormatException e) {
            throw new IllegalArgumentException("Invalid config value: " + e.getMessage(), e);
        }
    }
}
