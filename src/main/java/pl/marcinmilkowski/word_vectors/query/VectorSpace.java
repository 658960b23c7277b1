package pl.marcinmilkowski.word_vectors.query;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.word_vectors.config.VectorConfig;
import pl.marcinmilkowski.word_vectors.corpus.Corpus;
import pl.marcinmilkowski.word_vectors.indexer.DoubleMatrix;
import pl.marcinmilkowski.word_vectors.indexer.EntityIndex;
import pl.marcinmilkowski.word_vectors.indexer.IntMatrix;
import pl.marcinmilkowski.word_vectors.indexer.Matrix;
import pl.marcinmilkowski.word_vectors.indexer.MatrixBuilder;
import pl.marcinmilkowski.word_vectors.weighting.PpmiWeighting;
import pl.marcinmilkowski.word_vectors.weighting.TfIdfWeighting;

/**
 * The vocabulary and document indexes of a corpus together with the four matrices built
 * against them. Row i of every matrix is vocabulary token i; column d of the term-document
 * and TF-IDF matrices is document d.
 *
 * Immutable, so safe to share between threads.
 */
public class VectorSpace {

    private static final Logger logger = LoggerFactory.getLogger(VectorSpace.class);

    private final EntityIndex vocabulary;
    private final EntityIndex documents;
    private final int windowSize;
    private final IntMatrix termDocument;
    private final IntMatrix termContext;
    private final DoubleMatrix tfIdf;
    private final DoubleMatrix ppmi;

    public VectorSpace(EntityIndex vocabulary, EntityIndex documents, int windowSize,
                       IntMatrix termDocument, IntMatrix termContext,
                       DoubleMatrix tfIdf, DoubleMatrix ppmi) {
        requireShape("term-document", termDocument, vocabulary.size(), documents.size());
        requireShape("tf-idf", tfIdf, vocabulary.size(), documents.size());
        requireShape("term-context", termContext, vocabulary.size(), vocabulary.size());
        requireShape("ppmi", ppmi, vocabulary.size(), vocabulary.size());
        this.vocabulary = vocabulary;
        this.documents = documents;
        this.windowSize = windowSize;
        this.termDocument = termDocument;
        this.termContext = termContext;
        this.tfIdf = tfIdf;
        this.ppmi = ppmi;
    }

    /**
     * Run the whole pipeline: index, count, weight.
     */
    public static VectorSpace build(Corpus corpus, VectorConfig config) {
        long start = System.currentTimeMillis();
        EntityIndex vocabulary = EntityIndex.ofWords(corpus.vocabulary());
        EntityIndex documents = EntityIndex.ofDocuments(corpus.documentNames());
        MatrixBuilder builder = new MatrixBuilder(vocabulary, documents, config.windowSize());

        logger.info("Computing term document matrix...");
        IntMatrix termDocument = builder.buildTermDocument(corpus.lines());

        logger.info("Computing tf-idf matrix...");
        DoubleMatrix tfIdf = new TfIdfWeighting(config.epsilon()).apply(termDocument);

        logger.info("Computing term context matrix...");
        IntMatrix termContext = builder.buildTermContext(corpus.lines());

        logger.info("Computing PPMI matrix...");
        DoubleMatrix ppmi = PpmiWeighting.apply(termContext);

        logger.info("Vector space built in {} ms: |V|={}, |D|={}",
            System.currentTimeMillis() - start, vocabulary.size(), documents.size());
        return new VectorSpace(vocabulary, documents, config.windowSize(), termDocument, termContext, tfIdf, ppmi);
    }

    public Matrix matrix(MatrixKind kind) {
        switch (kind) {
            case TERM_DOCUMENT:
                return termDocument;
            case TF_IDF:
                return tfIdf;
            case TERM_CONTEXT:
                return termContext;
            case PPMI:
                return ppmi;
            default:
                throw new IllegalArgumentException("Unsupported matrix: " + kind);
        }
    }

    public EntityIndex getVocabulary() { return vocabulary; }
    public EntityIndex getDocuments() { return documents; }
    public int getWindowSize() { return windowSize; }
    public IntMatrix getTermDocument() { return termDocument; }
    public IntMatrix getTermContext() { return termContext; }
    public DoubleMatrix getTfIdf() { return tfIdf; }
    public DoubleMatrix getPpmi() { return ppmi; }

    public int hapaxLegomena() {
        return termDocument.hapaxLegomena();
    }

    private static void requireShape(String name, Matrix matrix, int rows, int columns) {
        if (matrix.rows() != rows || matrix.columns() != columns) {
            throw new IllegalArgumentException(String.format("%s matrix is %dx%d, expected %dx%d",
                name, matrix.rows(), matrix.columns(), rows, columns));
        }
    }
}
