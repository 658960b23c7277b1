package pl.marcinmilkowski.word_vectors.api;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.word_vectors.config.VectorConfig;
import pl.marcinmilkowski.word_vectors.indexer.UnknownEntityException;
import pl.marcinmilkowski.word_vectors.query.MatrixKind;
import pl.marcinmilkowski.word_vectors.query.RankedEntity;
import pl.marcinmilkowski.word_vectors.query.SimilarityExplorer;
import pl.marcinmilkowski.word_vectors.query.VectorSpace;
import pl.marcinmilkowski.word_vectors.similarity.SimilarityMeasure;
import pl.marcinmilkowski.word_vectors.similarity.SimilarityMeasures;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * REST API server for similarity queries over a built {@link VectorSpace}.
 *
 * Endpoints:
 * - GET /health - Health check
 * - GET /api/stats - Vocabulary and document counts, hapax legomena, configuration
 * - GET /api/similar/documents/{name}?matrix=term-document&measure=cosine&top=10
 * - GET /api/similar/words/{word}?matrix=ppmi&measure=cosine&top=10
 */
public class VectorSpaceApiServer {

    private static final Logger logger = LoggerFactory.getLogger(VectorSpaceApiServer.class);

    private static final String DOCUMENTS_PATH = "/api/similar/documents/";
    private static final String WORDS_PATH = "/api/similar/words/";

    private final VectorSpace space;
    private final SimilarityExplorer explorer;
    private final VectorConfig config;
    private final int port;
    private HttpServer server;
    private ExecutorService executor;

    private VectorSpaceApiServer(Builder builder) {
        this.space = builder.space;
        this.explorer = new SimilarityExplorer(builder.space);
        this.config = builder.config;
        this.port = builder.port;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private VectorSpace space;
        private VectorConfig config = VectorConfig.defaults();
        private int port = 8080;

        public Builder withVectorSpace(VectorSpace space) {
            this.space = space;
            return this;
        }

        public Builder withConfig(VectorConfig config) {
            this.config = config;
            return this;
        }

        public Builder withPort(int port) {
            this.port = port;
            return this;
        }

        public VectorSpaceApiServer build() {
            if (space == null) {
                throw new IllegalStateException("A vector space is required");
            }
            return new VectorSpaceApiServer(this);
        }
    }

    public void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress(port), 0);

        server.createContext("/health", exchange ->
            sendJsonResponse(exchange, Collections.singletonMap("status", "ok")));

        server.createContext("/api/stats", exchange -> {
            JSONObject stats = new JSONObject();
            stats.put("vocabulary_size", space.getVocabulary().size());
            stats.put("document_count", space.getDocuments().size());
            stats.put("hapax_legomena", space.hapaxLegomena());
            stats.put("term_document_total", space.getTermDocument().sum());
            stats.put("term_context_total", space.getTermContext().sum());
            stats.put("config", config.toJson());
            sendJsonResponse(exchange, stats);
        });

        server.createContext(DOCUMENTS_PATH, exchange -> handleSimilar(exchange, DOCUMENTS_PATH, true));
        server.createContext(WORDS_PATH, exchange -> handleSimilar(exchange, WORDS_PATH, false));

        executor = Executors.newFixedThreadPool(config.threads());
        server.setExecutor(executor);
        server.start();
        logger.info("API server started on port {}", getPort());
    }

    /**
     * Actual listening port; differs from the configured one when that was 0.
     */
    public int getPort() {
        return server != null ? server.getAddress().getPort() : port;
    }

    private void handleSimilar(HttpExchange exchange, String prefix, boolean documents) throws IOException {
        String name = exchange.getRequestURI().getPath().substring(prefix.length());
        if (name.isEmpty()) {
            sendError(exchange, 400, (documents ? "Document" : "Word") + " required");
            return;
        }

        Map<String, String> params = parseQueryParams(exchange.getRequestURI().getRawQuery());
        try {
            MatrixKind kind = MatrixKind.fromId(params.getOrDefault("matrix",
                documents ? MatrixKind.TERM_DOCUMENT.id() : MatrixKind.PPMI.id()));
            SimilarityMeasure measure = SimilarityMeasures.byName(params.getOrDefault("measure", "cosine"));
            int top = params.containsKey("top") ? Integer.parseInt(params.get("top")) : config.topK();

            List<RankedEntity> results = documents
                ? explorer.similarDocuments(name, kind, measure, top)
                : explorer.similarWords(name, kind, measure, top);

            JSONArray items = new JSONArray();
            for (RankedEntity result : results) {
                JSONObject item = new JSONObject();
                item.put("rank", result.rank());
                item.put("name", result.name());
                item.put("score", result.score());
                items.add(item);
            }

            JSONObject response = new JSONObject();
            response.put(documents ? "document" : "word", name);
            response.put("matrix", kind.id());
            response.put("measure", measure.name());
            response.put("results", items);
            sendJsonResponse(exchange, response);
        } catch (UnknownEntityException e) {
            sendError(exchange, 404, e.getMessage());
        } catch (IllegalArgumentException e) {
            // covers NumberFormatException from "top"
            sendError(exchange, 400, e.getMessage());
        } catch (RuntimeException e) {
            logger.error("Similarity query failed for '{}'", name, e);
            sendError(exchange, 500, "Query failed: " + e.getMessage());
        }
    }

    private Map<String, String> parseQueryParams(String query) {
        Map<String, String> params = new HashMap<>();
        if (query == null || query.isEmpty()) {
            return params;
        }

        for (String pair : query.split("&")) {
            String[] keyValue = pair.split("=", 2);
            if (keyValue.length == 2) {
                params.put(
                    URLDecoder.decode(keyValue[0], StandardCharsets.UTF_8),
                    URLDecoder.decode(keyValue[1], StandardCharsets.UTF_8)
                );
            }
        }
        return params;
    }

    private void sendJsonResponse(HttpExchange exchange, Object data) throws IOException {
        send(exchange, 200, JSON.toJSONString(data));
    }

    private void sendError(HttpExchange exchange, int code, String message) throws IOException {
        JSONObject error = new JSONObject();
        error.put("error", message);
        send(exchange, code, JSON.toJSONString(error));
    }

    private void send(HttpExchange exchange, int code, String json) throws IOException {
        byte[] bytes = json.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
        exchange.sendResponseHeaders(code, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    public void stop() {
        if (server != null) {
            server.stop(0);
            logger.info("API server stopped");
        }
        if (executor != null) {
            executor.shutdown();
        }
    }
}
