package pl.marcinmilkowski.word_fold.fold;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.word_fold.forest.AssociationForest;
import pl.marcinmilkowski.word_fold.forest.WordLookupException;
import pl.marcinmilkowski.word_fold.output.FrameEmitter;

import java.io.IOException;
import java.util.Collection;
import java.util.Set;
import java.util.TreeSet;

/**
 * Drives the search over every root of a forest.
 *
 * For each root with at least one leaf, every (main, sweep) coordinate pair
 * is visited; for each pair the branch words under the main branch that are
 * also branch words under the sweep branch complete a frame. Roots are
 * visited in ascending id order, pairs in triangular order, matches in the
 * main branch's branch order.
 *
 * A lookup failure aborts only the root being enumerated.
 */
public class FoldEnumerator {

    private static final Logger log = LoggerFactory.getLogger(FoldEnumerator.class);

    private final AssociationForest forest;
    private Set<Integer> rootFilter = null;

    public FoldEnumerator(AssociationForest forest) {
        this.forest = forest;
    }

    /**
     * Restricts the run to the given root ids; {@code null} means all roots.
     * An empty collection selects nothing.
     */
    public void setRootFilter(Collection<Integer> roots) {
        this.rootFilter = roots == null ? null : new TreeSet<>(roots);
    }

    public FoldSummary run(FrameEmitter emitter) throws IOException {
        int visited = 0;
        int skipped = 0;
        int failed = 0;
        long pairs = 0;
        long frames = 0;

        log.info("Begin search phase over {} roots{}", forest.rootCount(),
            rootFilter != null ? " (filtered to " + rootFilter.size() + ")" : "");

        for (int root = 0; root < forest.rootCount(); root++) {
            if (rootFilter != null && !rootFilter.contains(root)) {
                continue;
            }

            CoordinateEnumerator coordinates;
            try {
                coordinates = new CoordinateEnumerator(forest, root);
            } catch (EmptyRootException e) {
                log.debug("Skipping root {}: no leaves", root);
                skipped++;
                continue;
            }

            visited++;
            try {
                emitter.beginRoot(root);
                while (coordinates.hasNext()) {
                    CoordinatePair pair = coordinates.next();
                    pairs++;
                    SharedContinuations matches = new SharedContinuations(
                        forest, pair.main().branchWord(), pair.sweep().branchWord());
                    while (matches.hasNext()) {
                        emitter.emit(Frame.of(root, pair, matches.next()));
                        frames++;
                    }
                }
            } catch (WordLookupException e) {
                failed++;
                log.error("Aborting root {}: {}", root, e.getMessage());
            }
        }

        emitter.finish();
        FoldSummary summary = new FoldSummary(visited, skipped, failed, pairs, frames);
        log.info("Search complete: {}", summary);
        return summary;
    }
}
