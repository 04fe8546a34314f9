package pl.marcinmilkowski.word_fold.forest;

/**
 * A word id was used outside the range assigned by the vocabulary.
 *
 * Raised by {@link Vocabulary#resolve(int)} and by every read accessor of
 * {@link AssociationForest}. It always indicates an indexing bug upstream.
 */
public class WordLookupException extends RuntimeException {

    private final int wordId;
    private final int limit;

    public WordLookupException(int wordId, int limit) {
        super("Word id " + wordId + " out of range [0, " + limit + ")");
        this.wordId = wordId;
        this.limit = limit;
    }

    public int getWordId() {
        return wordId;
    }

    public int getLimit() {
        return limit;
    }
}
