package pl.marcinmilkowski.word_fold.fold;

/**
 * The root has no leaves, so there is no coordinate to start from.
 * Callers skip such roots.
 */
public class EmptyRootException extends RuntimeException {

    private final int root;

    public EmptyRootException(int root) {
        super("Root " + root + " has no branch leaves to enumerate");
        this.root = root;
    }

    public int getRoot() {
        return root;
    }
}
