package pl.marcinmilkowski.word_fold.fold;

import pl.marcinmilkowski.word_fold.forest.AssociationForest;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Lazily yields the branch words of {@code B} that are also branch words of
 * {@code D}, in the order they appear under {@code B}.
 *
 * One instance per (B, D) pair; once exhausted it stays exhausted.
 */
public final class SharedContinuations implements Iterator<Integer> {

    private final AssociationForest forest;
    private final int other;
    private final List<Integer> candidates;
    private int cursor = 0;
    private int pending = -1;

    public SharedContinuations(AssociationForest forest, int first, int second) {
        this.forest = forest;
        this.other = second;
        this.candidates = forest.branchIds(first);
        // validate the second id now rather than on first use
        forest.branchIds(second);
    }

    @Override
    public boolean hasNext() {
        if (pending >= 0) {
            return true;
        }
        while (cursor < candidates.size()) {
            int candidate = candidates.get(cursor++);
            if (forest.hasBranch(other, candidate)) {
                pending = candidate;
                return true;
            }
        }
        return false;
    }

    @Override
    public Integer next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No further shared continuations");
        }
        int match = pending;
        pending = -1;
        return match;
    }
}
