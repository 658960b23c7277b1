package pl.marcinmilkowski.word_vectors.indexer;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Bidirectional mapping between entity names (vocabulary tokens or document names)
 * and dense integer positions in [0, size).
 *
 * Positions follow the order of the names passed in, so row/column i of every matrix
 * built against this index denotes the same entity. Immutable once constructed.
 */
public class EntityIndex {

    public static final String WORD = "word";
    public static final String DOCUMENT = "document";

    private final String kind;
    private final List<String> names;
    private final Map<String, Integer> positions;

    /**
     * @param kind  what the names denote, used in error messages ("word", "document")
     * @param names ordered unique names, none null
     * @throws IllegalArgumentException on a duplicate name
     */
    public EntityIndex(String kind, Collection<String> names) {
        this.kind = kind;
        this.names = List.copyOf(names);
        this.positions = new HashMap<>(this.names.size() * 2);
        for (int i = 0; i < this.names.size(); i++) {
            Integer previous = positions.putIfAbsent(this.names.get(i), i);
            if (previous != null) {
                throw new IllegalArgumentException("Duplicate " + kind + " '" + this.names.get(i)
                    + "' at positions " + previous + " and " + i);
            }
        }
    }

    public static EntityIndex ofWords(Collection<String> vocabulary) {
        return new EntityIndex(WORD, vocabulary);
    }

    public static EntityIndex ofDocuments(Collection<String> documentNames) {
        return new EntityIndex(DOCUMENT, documentNames);
    }

    /**
     * Position of a name that a caller asked for directly.
     *
     * @throws UnknownEntityException if the name was never indexed
     */
    public int positionOf(String name) {
        Integer position = positions.get(name);
        if (position == null) {
            throw new UnknownEntityException(kind, name);
        }
        return position;
    }

    /**
     * Position of the name, or -1 when it is not indexed.
     */
    public int find(String name) {
        return positions.getOrDefault(name, -1);
    }

    public boolean contains(String name) {
        return positions.containsKey(name);
    }

    public String nameAt(int position) {
        return names.get(position);
    }

    public int size() {
        return names.size();
    }

    public String getKind() {
        return kind;
    }

    /**
     * Names in position order (unmodifiable).
     */
    public List<String> names() {
        return names;
    }
}
