package pl.marcinmilkowski.word_vectors.indexer;

/**
 * Thrown when a name is looked up in an {@link EntityIndex} that never indexed it.
 */
public class UnknownEntityException extends IllegalArgumentException {

    private final String kind;
    private final String name;

    public UnknownEntityException(String kind, String name) {
        super("Unknown " + kind + ": \"" + name + "\"");
        this.kind = kind;
        this.name = name;
    }

    public String getKind() { return kind; }
    public String getName() { return name; }
}
