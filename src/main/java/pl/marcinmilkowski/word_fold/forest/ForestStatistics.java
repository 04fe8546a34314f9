package pl.marcinmilkowski.word_fold.forest;

/**
 * Summary counts for a built forest.
 */
public record ForestStatistics(
    int vocabularySize,      // Distinct words in the corpus
    long windowCount,        // 3-token windows observed
    int nonEmptyRoots,       // Roots with at least one branch
    long branchCount,        // Branch entries over all roots
    long leafCount,          // Leaf entries over all branches
    long coordinatePairs     // Sum of L*(L+1)/2 over all roots
) {

    @Override
    public String toString() {
        return String.format("vocabulary=%d windows=%d roots=%d branches=%d leaves=%d pairs=%d",
            vocabularySize, windowCount, nonEmptyRoots, branchCount, leafCount, coordinatePairs);
    }
}
