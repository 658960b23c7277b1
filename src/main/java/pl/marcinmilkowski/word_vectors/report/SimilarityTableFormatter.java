package pl.marcinmilkowski.word_vectors.report;

import pl.marcinmilkowski.word_vectors.query.RankedEntity;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders a {@link SimilarityTable} as fixed-width text:
 *
 * <pre>
 * --- Top 10 similar documents to "Hamlet" using TF-IDF ---
 * Rank  Cosine Similarity              Jaccard Similarity             Dice Similarity
 * ----------------------------------------------------------------------------------------------------
 * 1     Macbeth (0.8123)               Othello (0.5012)               Othello (0.6677)
 * </pre>
 */
public class SimilarityTableFormatter {

    static final int RANK_WIDTH = 5;
    static final int COLUMN_WIDTH = 30;
    static final int RULE_WIDTH = 100;

    public String format(SimilarityTable table) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("--- Top %d similar %ss to \"%s\" using %s ---%n",
            table.depth(), table.entityKind(), table.pivot(), table.matrix().label()));

        sb.append(pad("Rank", RANK_WIDTH));
        for (String measure : table.columns().keySet()) {
            sb.append(' ').append(pad(measure + " Similarity", COLUMN_WIDTH));
        }
        sb.append(System.lineSeparator());
        sb.append("-".repeat(RULE_WIDTH)).append(System.lineSeparator());

        for (int i = 0; i < table.depth(); i++) {
            sb.append(pad(Integer.toString(i + 1), RANK_WIDTH));
            for (Map.Entry<String, List<RankedEntity>> column : table.columns().entrySet()) {
                sb.append(' ').append(pad(cell(column.getValue().get(i)), COLUMN_WIDTH));
            }
            sb.append(System.lineSeparator());
        }
        return sb.toString();
    }

    static String cell(RankedEntity entity) {
        return String.format(Locale.ROOT, "%s (%.4f)", entity.name(), entity.score());
    }

    private static String pad(String text, int width) {
        return String.format("%-" + width + "s", text);
    }
}
