package pl.marcinmilkowski.word_fold.corpus;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.LowerCaseFilter;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.Tokenizer;
import org.apache.lucene.analysis.core.LetterTokenizer;
import org.apache.lucene.analysis.core.WhitespaceTokenizer;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Token source backed by a Lucene tokenizer chain.
 *
 * In {@link Tokenization#WHITESPACE} mode a token is any run of
 * non-whitespace characters; {@link Tokenization#LETTER} keeps only runs of
 * letters. Tokens may be up to {@value #MAX_TOKEN_LENGTH} characters long,
 * Lucene's upper limit. Files are decoded as UTF-8; malformed bytes become
 * U+FFFD instead of failing the scan.
 */
public final class WhitespaceTokenSource implements TokenSource {

    private static final String FIELD = "text";

    static final int MAX_TOKEN_LENGTH = 1024 * 1024;

    private final ReaderOpener opener;
    private final Tokenization tokenization;
    private final boolean lowercase;
    private final String description;

    private WhitespaceTokenSource(ReaderOpener opener, Tokenization tokenization,
                                  boolean lowercase, String description) {
        this.opener = opener;
        this.tokenization = tokenization;
        this.lowercase = lowercase;
        this.description = description;
    }

    /**
     * Reads tokens from a UTF-8 text file. The file is checked here so that a
     * missing corpus fails before any pass begins.
     *
     * @throws NoSuchFileException if the file does not exist
     * @throws IOException if the path is not a readable regular file
     */
    public static WhitespaceTokenSource ofFile(Path path, Tokenization tokenization, boolean lowercase)
            throws IOException {
        if (!Files.exists(path)) {
            throw new NoSuchFileException(path.toString(), null, "Corpus file not found");
        }
        if (!Files.isRegularFile(path) || !Files.isReadable(path)) {
            throw new IOException("Corpus is not a readable file: " + path);
        }
        return new WhitespaceTokenSource(
            () -> new InputStreamReader(Files.newInputStream(path), StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE)),
            tokenization, lowercase, path.toString());
    }

    public static WhitespaceTokenSource ofFile(Path path) throws IOException {
        return ofFile(path, Tokenization.WHITESPACE, false);
    }

    public static WhitespaceTokenSource ofText(String text, Tokenization tokenization, boolean lowercase) {
        return new WhitespaceTokenSource(() -> new StringReader(text), tokenization, lowercase,
            "<text:" + text.length() + " chars>");
    }

    public static WhitespaceTokenSource ofText(String text) {
        return ofText(text, Tokenization.WHITESPACE, false);
    }

    @Override
    public void scan(TokenConsumer consumer) throws IOException {
        try (Analyzer analyzer = newAnalyzer();
             Reader reader = opener.open();
             TokenStream stream = analyzer.tokenStream(FIELD, reader)) {
            CharTermAttribute term = stream.addAttribute(CharTermAttribute.class);
            stream.reset();
            while (stream.incrementToken()) {
                consumer.accept(term.toString());
            }
            stream.end();
        }
    }

    private Analyzer newAnalyzer() {
        return new Analyzer() {
            @Override
            protected TokenStreamComponents createComponents(String fieldName) {
                Tokenizer source = tokenization == Tokenization.LETTER
                    ? new LetterTokenizer(TokenStream.DEFAULT_TOKEN_ATTRIBUTE_FACTORY, MAX_TOKEN_LENGTH)
                    : new WhitespaceTokenizer(TokenStream.DEFAULT_TOKEN_ATTRIBUTE_FACTORY, MAX_TOKEN_LENGTH);
                TokenStream result = lowercase ? new LowerCaseFilter(source) : source;
                return new TokenStreamComponents(source, result);
            }
        };
    }

    @Override
    public String toString() {
        return String.format("WhitespaceTokenSource[%s, %s%s]",
            description, tokenization.configName(), lowercase ? ", lowercase" : "");
    }

    @FunctionalInterface
    private interface ReaderOpener {
        Reader open() throws IOException;
    }

    /**
     * How the corpus text is split into tokens.
     */
    public enum Tokenization {
        WHITESPACE,
        LETTER;

        public String configName() {
            return name().toLowerCase(Locale.ROOT);
        }

        public static Tokenization fromName(String name) {
            if (name == null) {
                throw new IllegalArgumentException("Tokenizer name must not be null");
            }
            for (Tokenization t : values()) {
                if (t.configName().equals(name.trim().toLowerCase(Locale.ROOT))) {
                    return t;
                }
            }
            throw new IllegalArgumentException("Unknown tokenizer: " + name + " (expected whitespace or letter)");
        }
    }
}
