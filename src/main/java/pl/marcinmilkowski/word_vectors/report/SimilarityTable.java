package pl.marcinmilkowski.word_vectors.report;

import pl.marcinmilkowski.word_vectors.query.MatrixKind;
import pl.marcinmilkowski.word_vectors.query.RankedEntity;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Top-k rankings of one pivot entity under several similarity measures, side by side.
 * Columns keep the order in which the measures were given.
 */
public record SimilarityTable(
    String entityKind,
    String pivot,
    MatrixKind matrix,
    Map<String, List<RankedEntity>> columns
) {
    public SimilarityTable {
        columns = Collections.unmodifiableMap(new LinkedHashMap<>(columns));
    }

    /**
     * Number of rows: the length of the shortest column.
     */
    public int depth() {
        int depth = Integer.MAX_VALUE;
        for (List<RankedEntity> column : columns.values()) {
            depth = Math.min(depth, column.size());
        }
        return columns.isEmpty() ? 0 : depth;
    }
}
