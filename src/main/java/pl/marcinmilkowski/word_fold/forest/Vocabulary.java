package pl.marcinmilkowski.word_fold.forest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.word_fold.corpus.TokenSource;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Assigns dense integer IDs to tokens in order of first occurrence.
 *
 * IDs start at 0 and never change once assigned; there is no removal.
 * Not thread-safe: the vocabulary is filled by a single corpus pass.
 */
public class Vocabulary {

    private static final Logger log = LoggerFactory.getLogger(Vocabulary.class);

    private final Map<String, Integer> tokenToId = new HashMap<>();
    private final List<String> idToToken = new ArrayList<>();

    /**
     * Builds a vocabulary from one full pass over the token source.
     */
    public static Vocabulary build(TokenSource source) throws IOException {
        Vocabulary vocabulary = new Vocabulary();
        long[] tokens = {0};
        source.scan(token -> {
            vocabulary.intern(token);
            tokens[0]++;
        });
        log.info("Vocabulary built: {} distinct words from {} tokens", vocabulary.size(), tokens[0]);
        return vocabulary;
    }

    /**
     * Returns the ID for the token, assigning the next sequential one if the
     * token has not been seen before.
     */
    public int intern(String token) {
        if (token == null) {
            throw new IllegalArgumentException("Token must not be null");
        }
        Integer existing = tokenToId.get(token);
        if (existing != null) {
            return existing;
        }
        int id = idToToken.size();
        tokenToId.put(token, id);
        idToToken.add(token);
        return id;
    }

    /**
     * Returns the token for an assigned ID.
     *
     * @throws WordLookupException if the ID was never assigned
     */
    public String resolve(int wordId) {
        if (wordId < 0 || wordId >= idToToken.size()) {
            throw new WordLookupException(wordId, idToToken.size());
        }
        return idToToken.get(wordId);
    }

    /**
     * Looks up a token without interning it.
     */
    public Optional<Integer> idOf(String token) {
        return Optional.ofNullable(tokenToId.get(token));
    }

    public int size() {
        return idToToken.size();
    }

    /**
     * All tokens in ID order (read-only view).
     */
    public List<String> tokens() {
        return Collections.unmodifiableList(idToToken);
    }
}
