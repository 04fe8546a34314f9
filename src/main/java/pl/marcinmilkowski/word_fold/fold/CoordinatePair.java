package pl.marcinmilkowski.word_fold.fold;

/**
 * The main and sweep coordinates of one enumeration step. The sweep never
 * precedes the main coordinate in flattened order.
 */
public record CoordinatePair(Coordinate main, Coordinate sweep) {

    public boolean isDiagonal() {
        return main.equals(sweep);
    }

    @Override
    public String toString() {
        return "main: " + main + "  sweep: " + sweep;
    }
}
