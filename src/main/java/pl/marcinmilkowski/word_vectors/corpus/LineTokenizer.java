package pl.marcinmilkowski.word_vectors.corpus;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.LowerCaseFilter;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.Tokenizer;
import org.apache.lucene.analysis.pattern.PatternTokenizer;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;

import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits a line of text into lowercase alphanumeric tokens.
 *
 * Every character outside [a-zA-Z0-9] acts as a separator, so "Ay, sir!" becomes
 * [ay, sir] and "o'er" becomes [o, er].
 */
public class LineTokenizer implements Closeable {

    private static final String FIELD = "line";
    private static final Pattern SEPARATOR = Pattern.compile("[^a-zA-Z0-9]+");

    private final Analyzer analyzer = new Analyzer() {
        @Override
        protected TokenStreamComponents createComponents(String fieldName) {
            // group -1: the pattern matches separators, not tokens
            Tokenizer source = new PatternTokenizer(SEPARATOR, -1);
            TokenStream result = new LowerCaseFilter(source);
            return new TokenStreamComponents(source, result);
        }
    };

    public List<String> tokenize(String line) {
        List<String> tokens = new ArrayList<>();
        if (line == null || line.isEmpty()) {
            return tokens;
        }
        try (TokenStream stream = analyzer.tokenStream(FIELD, line)) {
            CharTermAttribute term = stream.addAttribute(CharTermAttribute.class);
            stream.reset();
            while (stream.incrementToken()) {
                tokens.add(term.toString());
            }
            stream.end();
        } catch (IOException e) {
            // StringReader input; only reachable on an analyzer bug
            throw new UncheckedIOException("Failed to tokenize line: " + line, e);
        }
        return tokens;
    }

    @Override
    public void close() {
        analyzer.close();
    }
}
