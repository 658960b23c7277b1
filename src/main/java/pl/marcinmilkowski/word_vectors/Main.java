package pl.marcinmilkowski.word_vectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.word_vectors.api.VectorSpaceApiServer;
import pl.marcinmilkowski.word_vectors.config.VectorConfig;
import pl.marcinmilkowski.word_vectors.config.VectorConfigLoader;
import pl.marcinmilkowski.word_vectors.corpus.Corpus;
import pl.marcinmilkowski.word_vectors.corpus.PlayCorpusReader;
import pl.marcinmilkowski.word_vectors.query.MatrixKind;
import pl.marcinmilkowski.word_vectors.query.RankedEntity;
import pl.marcinmilkowski.word_vectors.query.SimilarityExplorer;
import pl.marcinmilkowski.word_vectors.query.VectorSpace;
import pl.marcinmilkowski.word_vectors.report.SimilarityReport;
import pl.marcinmilkowski.word_vectors.report.SimilarityTableFormatter;
import pl.marcinmilkowski.word_vectors.similarity.SimilarityMeasure;
import pl.marcinmilkowski.word_vectors.similarity.SimilarityMeasures;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Random;

/**
 * Command line entry point.
 *
 * Commands:
 *   stats --corpus plays.csv --vocab vocab.txt
 *   similar-documents --corpus plays.csv --vocab vocab.txt --document Hamlet --matrix tf-idf
 *   similar-words --corpus plays.csv --vocab vocab.txt --word gain --matrix ppmi --measure dice
 *   report --corpus plays.csv --vocab vocab.txt [--document Hamlet] [--word gain]
 *   server --corpus plays.csv --vocab vocab.txt --port 8080
 */
public class Main {

    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    static final String DEFAULT_WORD = "gain";

    public static void main(String[] args) {
        if (args.length == 0) {
            showUsage(System.out);
            return;
        }

        try {
            String command = args[0].toLowerCase();

            switch (command) {
                case "stats":
                    handleStatsCommand(Options.parse(args), System.out);
                    break;
                case "similar-documents":
                    handleSimilarDocumentsCommand(Options.parse(args), System.out);
                    break;
                case "similar-words":
                    handleSimilarWordsCommand(Options.parse(args), System.out);
                    break;
                case "report":
                    handleReportCommand(Options.parse(args), System.out);
                    break;
                case "server":
                    handleServerCommand(Options.parse(args));
                    break;
                case "help":
                    showUsage(System.out);
                    break;
                default:
                    logger.error("Unknown command: {}", command);
                    showUsage(System.out);
            }
        } catch (Exception e) {
            logger.error("Application error", e);
            System.err.println("Error: " + e.getMessage());
            System.err.println("Use 'help' command for usage information.");
        }
    }

    static void showUsage(PrintStream out) {
        out.println("Usage: java -jar word-vectors.jar <command> [options]");
        out.println();
        out.println("Commands:");
        out.println("  stats --corpus <file.csv> --vocab <vocab.txt>");
        out.println("      Print matrix dimensions, totals and the number of hapax legomena");
        out.println();
        out.println("  similar-documents --corpus <file.csv> --vocab <vocab.txt> --document <name>");
        out.println("      Rank documents by similarity to the given one");
        out.println("      Options:");
        out.println("        --matrix <m>     term-document (default) or tf-idf");
        out.println("        --measure <s>    cosine (default), jaccard or dice");
        out.println("        --limit <n>      Max results (default: top_k from config)");
        out.println();
        out.println("  similar-words --corpus <file.csv> --vocab <vocab.txt> --word <word>");
        out.println("      Rank vocabulary words by similarity to the given one");
        out.println("      Options:");
        out.println("        --matrix <m>     ppmi (default), term-context, term-document or tf-idf");
        out.println("        --measure <s>    cosine (default), jaccard or dice");
        out.println("        --limit <n>      Max results (default: top_k from config)");
        out.println();
        out.println("  report --corpus <file.csv> --vocab <vocab.txt> [--document <name>] [--word <word>] [--seed <n>]");
        out.println("      Side-by-side cosine/jaccard/dice tables for a document (random if omitted)");
        out.println("      and a word (default: " + DEFAULT_WORD + ")");
        out.println();
        out.println("  server --corpus <file.csv> --vocab <vocab.txt> [--port <port>]");
        out.println("      Start REST API server");
        out.println();
        out.println("Common options:");
        out.println("  --config <file.json>   window_size, epsilon, top_k, threads");
        out.println("  --window <n>           Override window_size");
    }

    static VectorSpace loadVectorSpace(Options options, VectorConfig config) throws IOException {
        if (options.corpus == null || options.vocab == null) {
            throw new IllegalArgumentException("--corpus and --vocab are required");
        }
        try (PlayCorpusReader reader = new PlayCorpusReader()) {
            Corpus corpus = reader.read(Paths.get(options.corpus), Paths.get(options.vocab));
            return VectorSpace.build(corpus, config);
        }
    }

    static VectorConfig loadConfig(Options options) throws IOException {
        VectorConfig config = VectorConfigLoader.load(options.config != null ? Path.of(options.config) : null);
        if (options.window != null) {
            config = config.withWindowSize(options.window);
        }
        if (options.limit != null) {
            config = config.withTopK(options.limit);
        }
        return config;
    }

    static void handleStatsCommand(Options options, PrintStream out) throws IOException {
        VectorConfig config = loadConfig(options);
        VectorSpace space = loadVectorSpace(options, config);

        out.println("=== Vector Space ===");
        out.printf("Vocabulary:           %d%n", space.getVocabulary().size());
        out.printf("Documents:            %d%n", space.getDocuments().size());
        out.printf("Term-document total:  %d%n", space.getTermDocument().sum());
        out.printf("Term-context total:   %d (window=%d)%n", space.getTermContext().sum(), space.getWindowSize());
        out.printf("Hapax legomena:       %d%n", space.hapaxLegomena());
    }

    static void handleSimilarDocumentsCommand(Options options, PrintStream out) throws IOException {
        if (options.document == null) {
            throw new IllegalArgumentException("--document is required");
        }
        VectorConfig config = loadConfig(options);
        MatrixKind kind = MatrixKind.fromId(options.matrix != null ? options.matrix : MatrixKind.TERM_DOCUMENT.id());
        SimilarityMeasure measure = SimilarityMeasures.byName(options.measure != null ? options.measure : "cosine");
        VectorSpace space = loadVectorSpace(options, config);

        List<RankedEntity> results = new SimilarityExplorer(space)
            .similarDocuments(options.document, kind, measure, config.topK());
        printRanking(out, String.format("The %d most similar documents to \"%s\" using %s on %s are:",
            results.size(), options.document, measure.name(), kind.id()), results);
    }

    static void handleSimilarWordsCommand(Options options, PrintStream out) throws IOException {
        if (options.word == null) {
            throw new IllegalArgumentException("--word is required");
        }
        VectorConfig config = loadConfig(options);
        MatrixKind kind = MatrixKind.fromId(options.matrix != null ? options.matrix : MatrixKind.PPMI.id());
        SimilarityMeasure measure = SimilarityMeasures.byName(options.measure != null ? options.measure : "cosine");
        VectorSpace space = loadVectorSpace(options, config);

        List<RankedEntity> results = new SimilarityExplorer(space)
            .similarWords(options.word, kind, measure, config.topK());
        printRanking(out, String.format("The %d most similar words to \"%s\" using %s on %s are:",
            results.size(), options.word, measure.name(), kind.id()), results);
    }

    static void handleReportCommand(Options options, PrintStream out) throws IOException, InterruptedException {
        VectorConfig config = loadConfig(options);
        VectorSpace space = loadVectorSpace(options, config);
        reportOn(space, config, options, out);
    }

    static void reportOn(VectorSpace space, VectorConfig config, Options options, PrintStream out)
            throws InterruptedException {
        if (space.getDocuments().size() == 0) {
            out.println("No documents in corpus.");
            return;
        }

        String document = options.document;
        if (document == null) {
            Random random = options.seed != null ? new Random(options.seed) : new Random();
            document = space.getDocuments().nameAt(random.nextInt(space.getDocuments().size()));
        }
        String word = options.word != null ? options.word : DEFAULT_WORD;

        SimilarityTableFormatter formatter = new SimilarityTableFormatter();
        try (SimilarityReport report = new SimilarityReport(new SimilarityExplorer(space),
                SimilarityMeasures.all(), config.topK(), config.threads())) {
            out.println();
            out.println("Selected document: " + document);
            for (MatrixKind kind : List.of(MatrixKind.TERM_DOCUMENT, MatrixKind.TF_IDF)) {
                out.println();
                out.print(formatter.format(report.documentTable(document, kind)));
            }

            if (!space.getVocabulary().contains(word)) {
                out.println();
                out.println("Error: Word \"" + word + "\" not in vocabulary");
                return;
            }
            for (MatrixKind kind : List.of(MatrixKind.TERM_CONTEXT, MatrixKind.PPMI)) {
                out.println();
                out.print(formatter.format(report.wordTable(word, kind)));
            }
        }
    }

    static void handleServerCommand(Options options) throws IOException {
        VectorConfig config = loadConfig(options);
        VectorSpace space = loadVectorSpace(options, config);

        VectorSpaceApiServer server = VectorSpaceApiServer.builder()
            .withVectorSpace(space)
            .withConfig(config)
            .withPort(options.port)
            .build();
        Runtime.getRuntime().addShutdownHook(new Thread(server::stop));
        server.start();

        System.out.println("API server running on http://localhost:" + server.getPort());
        System.out.println("  curl 'http://localhost:" + server.getPort() + "/api/similar/words/" + DEFAULT_WORD + "?matrix=ppmi'");
    }

    private static void printRanking(PrintStream out, String title, List<RankedEntity> results) {
        out.println();
        out.println(title);
        for (RankedEntity result : results) {
            out.println(result);
        }
    }

    /**
     * Options shared by all commands. Unknown options are rejected.
     */
    static class Options {
        String corpus;
        String vocab;
        String config;
        String document;
        String word;
        String matrix;
        String measure;
        Integer limit;
        Integer window;
        Long seed;
        int port = 8080;

        static Options parse(String[] args) {
            Options options = new Options();
            for (int i = 1; i < args.length; i++) {
                switch (args[i]) {
                    case "--corpus":
                    case "-c":
                        options.corpus = value(args, ++i);
                        break;
                    case "--vocab":
                    case "-v":
                        options.vocab = value(args, ++i);
                        break;
                    case "--config":
                        options.config = value(args, ++i);
                        break;
                    case "--document":
                    case "-d":
                        options.document = value(args, ++i);
                        break;
                    case "--word":
                    case "-w":
                        options.word = value(args, ++i);
                        break;
                    case "--matrix":
                    case "-m":
                        options.matrix = value(args, ++i);
                        break;
                    case "--measure":
                    case "-s":
                        options.measure = value(args, ++i);
                        break;
                    case "--limit":
                        options.limit = Integer.parseInt(value(args, ++i));
                        break;
                    case "--window":
                        options.window = Integer.parseInt(value(args, ++i));
                        break;
                    case "--seed":
                        options.seed = Long.parseLong(value(args, ++i));
                        break;
                    case "--port":
                        options.port = Integer.parseInt(value(args, ++i));
                        break;
                    default:
                        throw new IllegalArgumentException("Unknown option: " + args[i]);
                }
            }
            return options;
        }

        private static String value(String[] args, int i) {
            if (i >= args.length) {
                throw new IllegalArgumentException("Missing value for " + args[i - 1]);
            }
            return args[i];
        }
    }
}
