package pl.marcinmilkowski.word_fold.forest;

import java.util.List;

/**
 * One branch entry of a root: the word that followed the root, and the
 * distinct words that followed the pair, in first-seen order.
 */
public record Branch(
    int wordId,           // The branch word
    List<Integer> leaves  // Leaf word ids, insertion-ordered, no duplicates
) {

    public Branch {
        leaves = List.copyOf(leaves);
    }

    public int leafCount() {
        return leaves.size();
    }

    public int leaf(int index) {
        return leaves.get(index);
    }

    @Override
    public String toString() {
        return String.format("Branch[%d -> %s]", wordId, leaves);
    }
}
