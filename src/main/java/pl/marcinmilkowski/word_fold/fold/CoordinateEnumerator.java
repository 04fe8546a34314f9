package pl.marcinmilkowski.word_fold.fold;

import pl.marcinmilkowski.word_fold.forest.AssociationForest;
import pl.marcinmilkowski.word_fold.forest.Branch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Walks the upper triangle (diagonal included) of all pairs of (branch, leaf)
 * positions of one root, in row-major order.
 *
 * The root's positions are flattened in branch order, then leaf order. The
 * main coordinate starts at the first position with the sweep on top of it.
 * After each step the sweep moves one position forward; when it is already
 * on the last position the main coordinate moves forward instead and the
 * sweep is reset onto it. A root with L positions yields L*(L+1)/2 pairs.
 */
public final class CoordinateEnumerator implements Iterator<CoordinatePair> {

    private final int root;
    private final List<Coordinate> positions;
    private int main = 0;
    private int sweep = 0;

    /**
     * @throws EmptyRootException if the root has no leaves at all
     * @throws pl.marcinmilkowski.word_fold.forest.WordLookupException if the root id is out of range
     */
    public CoordinateEnumerator(AssociationForest forest, int root) {
        this.root = root;
        List<Branch> branches = forest.branches(root);
        List<Coordinate> flat = new ArrayList<>(forest.leafCount(root));
        for (int b = 0; b < branches.size(); b++) {
            Branch branch = branches.get(b);
            for (int l = 0; l < branch.leafCount(); l++) {
                flat.add(new Coordinate(b, l, branch.wordId(), branch.leaf(l)));
            }
        }
        if (flat.isEmpty()) {
            throw new EmptyRootException(root);
        }
        this.positions = Collections.unmodifiableList(flat);
    }

    public int getRoot() {
        return root;
    }

    /**
     * Number of flattened (branch, leaf) positions (L).
     */
    public int positionCount() {
        return positions.size();
    }

    /**
     * Total number of pairs this enumerator yields, L*(L+1)/2.
     */
    public long pairCount() {
        long l = positions.size();
        return l * (l + 1) / 2;
    }

    public List<Coordinate> positions() {
        return positions;
    }

    @Override
    public boolean hasNext() {
        return main < positions.size();
    }

    @Override
    public CoordinatePair next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Coordinates exhausted for root " + root);
        }
        CoordinatePair pair = new CoordinatePair(positions.get(main), positions.get(sweep));
        if (sweep == positions.size() - 1) {
            main++;
            sweep = main;
        } else {
            sweep++;
        }
        return pair;
    }
}
