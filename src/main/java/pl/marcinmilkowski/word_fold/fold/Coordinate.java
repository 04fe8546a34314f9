package pl.marcinmilkowski.word_fold.fold;

/**
 * A (branch, leaf) position within one root's entry, with the word ids found
 * there.
 */
public record Coordinate(
    int branchIndex,
    int leafIndex,
    int branchWord,
    int leafWord
) {

    @Override
    public String toString() {
        return "(" + branchIndex + "," + leafIndex + ")";
    }
}
