package pl.marcinmilkowski.word_fold.forest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.word_fold.corpus.TokenSource;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Two-level association graph built from every 3-token window of a corpus.
 *
 * For a window (root, branch, leaf) the root's entry holds a branch for
 * {@code branch}, and that branch holds {@code leaf}. Branches of a root and
 * leaves of a branch are deduplicated and kept in first-seen order.
 *
 * The forest has exactly one slot per vocabulary id and is read-only once
 * built. Accessors throw {@link WordLookupException} for ids outside
 * {@code [0, rootCount())}.
 */
public final class AssociationForest {

    private static final Logger log = LoggerFactory.getLogger(AssociationForest.class);

    private final RootEntry[] roots;
    private final long windowCount;

    private AssociationForest(RootEntry[] roots, long windowCount) {
        this.roots = roots;
        this.windowCount = windowCount;
    }

    /**
     * Builds the forest in one pass over the source. The vocabulary must
     * already hold every token of the source.
     *
     * @throws IllegalStateException if the source yields a token the
     *         vocabulary does not know (the corpus changed between passes)
     */
    public static AssociationForest build(Vocabulary vocabulary, TokenSource source) throws IOException {
        Builder builder = new Builder(vocabulary.size());
        source.scan(token -> {
            Integer id = vocabulary.idOf(token).orElseThrow(() ->
                new IllegalStateException("Token '" + token + "' missing from vocabulary; corpus changed between passes?"));
            builder.accept(id);
        });
        AssociationForest forest = builder.build();
        log.info("Forest built: {} roots, {} windows", forest.rootCount(), forest.windowCount());
        return forest;
    }

    /**
     * Convenience: builds vocabulary and forest from the same source.
     */
    public static AssociationForest build(TokenSource source) throws IOException {
        return build(Vocabulary.build(source), source);
    }

    public int rootCount() {
        return roots.length;
    }

    public long windowCount() {
        return windowCount;
    }

    /**
     * Branch entries of a root, in first-seen order. Empty for a word never
     * seen at the start of a window.
     */
    public List<Branch> branches(int root) {
        return entry(root).branches();
    }

    /**
     * Branch word ids of a root, in first-seen order.
     */
    public List<Integer> branchIds(int root) {
        return entry(root).branchIds();
    }

    public boolean hasBranch(int root, int branchWord) {
        return entry(root).byWord().containsKey(branchWord);
    }

    /**
     * Leaves under (root, branch); empty when the root has no such branch.
     */
    public List<Integer> leaves(int root, int branchWord) {
        Branch branch = entry(root).byWord().get(branchWord);
        return branch != null ? branch.leaves() : List.of();
    }

    /**
     * Total leaf count over all branches of the root ("grandchildren").
     */
    public int leafCount(int root) {
        return entry(root).leafCount();
    }

    public ForestStatistics statistics() {
        int nonEmpty = 0;
        long branchTotal = 0;
        long leafTotal = 0;
        long pairs = 0;
        for (RootEntry e : roots) {
            if (!e.branches().isEmpty()) {
                nonEmpty++;
            }
            branchTotal += e.branches().size();
            long l = e.leafCount();
            leafTotal += l;
            pairs += l * (l + 1) / 2;
        }
        return new ForestStatistics(roots.length, windowCount, nonEmpty, branchTotal, leafTotal, pairs);
    }

    private RootEntry entry(int root) {
        if (root < 0 || root >= roots.length) {
            throw new WordLookupException(root, roots.length);
        }
        return roots[root];
    }

    private record RootEntry(List<Branch> branches, List<Integer> branchIds, Map<Integer, Branch> byWord,
                             int leafCount) {

        static final RootEntry EMPTY = new RootEntry(List.of(), List.of(), Map.of(), 0);
    }

    /**
     * Accumulates windows from a stream of word ids.
     */
    private static final class Builder {

        private final List<LinkedHashMap<Integer, LinkedHashSet<Integer>>> pending;
        private int twoBack = -1;
        private int oneBack = -1;
        private long windows = 0;

        Builder(int vocabularySize) {
            pending = new ArrayList<>(vocabularySize);
            for (int i = 0; i < vocabularySize; i++) {
                pending.add(null);
            }
        }

        void accept(int wordId) {
            if (twoBack >= 0) {
                LinkedHashMap<Integer, LinkedHashSet<Integer>> branches = pending.get(twoBack);
                if (branches == null) {
                    branches = new LinkedHashMap<>();
                    pending.set(twoBack, branches);
                }
                branches.computeIfAbsent(oneBack, k -> new LinkedHashSet<>()).add(wordId);
                windows++;
            }
            twoBack = oneBack;
            oneBack = wordId;
        }

        AssociationForest build() {
            RootEntry[] roots = new RootEntry[pending.size()];
            for (int i = 0; i < roots.length; i++) {
                roots[i] = freeze(pending.get(i));
            }
            return new AssociationForest(roots, windows);
        }

        private static RootEntry freeze(LinkedHashMap<Integer, LinkedHashSet<Integer>> branches) {
            if (branches == null) {
                return RootEntry.EMPTY;
            }
            List<Branch> list = new ArrayList<>(branches.size());
            List<Integer> ids = new ArrayList<>(branches.size());
            Map<Integer, Branch> byWord = new LinkedHashMap<>();
            int leafCount = 0;
            for (Map.Entry<Integer, LinkedHashSet<Integer>> e : branches.entrySet()) {
                Branch branch = new Branch(e.getKey(), new ArrayList<>(e.getValue()));
                list.add(branch);
                ids.add(branch.wordId());
                byWord.put(branch.wordId(), branch);
                leafCount += branch.leafCount();
            }
            return new RootEntry(Collections.unmodifiableList(list), Collections.unmodifiableList(ids),
                Collections.unmodifiableMap(byWord), leafCount);
        }
    }
}
