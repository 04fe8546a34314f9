package pl.marcinmilkowski.word_fold.fold;

/**
 * Counters from one enumeration run.
 */
public record FoldSummary(
    int rootsVisited,       // Roots whose coordinates were enumerated
    int rootsSkipped,       // Roots with no leaves
    int rootsFailed,        // Roots aborted on a lookup failure
    long coordinatePairs,   // (main, sweep) pairs visited
    long framesEmitted
) {

    @Override
    public String toString() {
        return String.format("visited=%d skipped=%d failed=%d pairs=%d frames=%d",
            rootsVisited, rootsSkipped, rootsFailed, coordinatePairs, framesEmitted);
    }
}
