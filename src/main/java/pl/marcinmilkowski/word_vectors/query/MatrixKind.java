package pl.marcinmilkowski.word_vectors.query;

import java.util.Locale;

/**
 * The four matrices of a {@link VectorSpace}.
 */
public enum MatrixKind {
    TERM_DOCUMENT("term-document", "Term-Document", true),
    TF_IDF("tf-idf", "TF-IDF", true),
    TERM_CONTEXT("term-context", "Term-Context Frequency Matrix", false),
    PPMI("ppmi", "PPMI Matrix", false);

    private final String id;
    private final String label;
    private final boolean hasDocumentColumns;

    MatrixKind(String id, String label, boolean hasDocumentColumns) {
        this.id = id;
        this.label = label;
        this.hasDocumentColumns = hasDocumentColumns;
    }

    public String id() { return id; }
    public String label() { return label; }

    /**
     * Whether columns are documents. Rows are always vocabulary tokens.
     */
    public boolean hasDocumentColumns() { return hasDocumentColumns; }

    /**
     * Parse "term-document", "tf-idf", "term-context" or "ppmi" (case-insensitive;
     * underscores accepted in place of dashes).
     */
    public static MatrixKind fromId(String id) {
        if (id != null) {
            String key = id.trim().toLowerCase(Locale.ROOT).replace('_', '-');
            for (MatrixKind kind : values()) {
                if (kind.id.equals(key)) {
                    return kind;
                }
            }
        }
        throw new IllegalArgumentException("Unknown matrix: " + id
            + " (expected term-document, tf-idf, term-context or ppmi)");
    }
}
