package pl.marcinmilkowski.word_fold.fold;

import java.util.OptionalInt;

/**
 * One emitted word combination.
 *
 * Laid out over nine slots: 0 root, 1 main branch, 2 main leaf, 3 sweep
 * branch, 4 shared continuation, 6 sweep leaf. Slots 5, 7 and 8 are reserved
 * and always empty.
 */
public record Frame(
    int root,
    int mainBranch,
    int mainLeaf,
    int sweepBranch,
    int continuation,
    int sweepLeaf
) {

    public static final int SLOT_COUNT = 9;

    /**
     * Word at the given slot, or empty for a reserved slot.
     *
     * @throws IllegalArgumentException if {@code index} is not in 0..8
     */
    public OptionalInt slot(int index) {
        return switch (index) {
            case 0 -> OptionalInt.of(root);
            case 1 -> OptionalInt.of(mainBranch);
            case 2 -> OptionalInt.of(mainLeaf);
            case 3 -> OptionalInt.of(sweepBranch);
            case 4 -> OptionalInt.of(continuation);
            case 6 -> OptionalInt.of(sweepLeaf);
            case 5, 7, 8 -> OptionalInt.empty();
            default -> throw new IllegalArgumentException("Frame slot out of range: " + index);
        };
    }

    static Frame of(int root, CoordinatePair pair, int continuation) {
        return new Frame(root,
            pair.main().branchWord(), pair.main().leafWord(),
            pair.sweep().branchWord(), continuation, pair.sweep().leafWord());
    }
}
