package pl.marcinmilkowski.word_fold.corpus;

import java.io.IOException;

/**
 * A re-readable sequence of corpus tokens.
 *
 * Each call to {@link #scan(TokenConsumer)} is one complete pass from the
 * first token to the last. Implementations must yield the same sequence on
 * every pass, since the vocabulary and the forest are built in two passes.
 */
public interface TokenSource {

    /**
     * Feeds every token of the corpus, in order, to the consumer.
     *
     * @throws IOException if the underlying corpus cannot be read
     */
    void scan(TokenConsumer consumer) throws IOException;

    /**
     * Receives tokens during a scan.
     */
    @FunctionalInterface
    interface TokenConsumer {
        void accept(String token);
    }
}
