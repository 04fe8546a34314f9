package pl.marcinmilkowski.word_fold.fold;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import pl.marcinmilkowski.word_fold.corpus.TokenSource;
import pl.marcinmilkowski.word_fold.corpus.WhitespaceTokenSource;
import pl.marcinmilkowski.word_fold.forest.AssociationForest;
import pl.marcinmilkowski.word_fold.forest.Vocabulary;
import pl.marcinmilkowski.word_fold.forest.WordLookupException;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

class SharedContinuationsTest {

    // p: a, b, c, d   q: c, x, a
    private static final String CORPUS = "p a 1 p b 2 p c 3 p d 4 q c 5 q x 6 q a 7";

    private Vocabulary vocabulary;
    private AssociationForest forest;

    private int id(String word) {
        return vocabulary.idOf(word).orElseThrow();
    }

    private List<String> drain(SharedContinuations matches) {
        List<String> words = new ArrayList<>();
        while (matches.hasNext()) {
            words.add(vocabulary.resolve(matches.next()));
        }
        return words;
    }

    private void build() throws IOException {
        TokenSource source = WhitespaceTokenSource.ofText(CORPUS);
        vocabulary = Vocabulary.build(source);
        forest = AssociationForest.build(vocabulary, source);
    }

    @Test
    @DisplayName("Yields shared branch words in the first word's order")
    void testSharedInOrder() throws IOException {
        build();
        assertEquals(List.of("a", "c"), drain(new SharedContinuations(forest, id("p"), id("q"))));
        assertEquals(List.of("c", "a"), drain(new SharedContinuations(forest, id("q"), id("p"))));
    }

    @Test
    @DisplayName("A word shares all of its own branches with itself")
    void testSelf() throws IOException {
        build();
        assertEquals(List.of("a", "b", "c", "d"), drain(new SharedContinuations(forest, id("p"), id("p"))));
    }

    @Test
    @DisplayName("Exhausted matcher stays exhausted")
    void testExhaustion() throws IOException {
        build();
        SharedContinuations m = new SharedContinuations(forest, id("p"), id("q"));
        assertTrue(m.hasNext());
        assertEquals(id("a"), m.next());
        assertTrue(m.hasNext());
        assertTrue(m.hasNext());
        assertEquals(id("c"), m.next());
        assertFalse(m.hasNext());
        assertFalse(m.hasNext());
        assertThrows(NoSuchElementException.class, m::next);
    }

    @Test
    @DisplayName("No overlap or no branches yields nothing")
    void testNoMatches() throws IOException {
        build();
        assertFalse(new SharedContinuations(forest, id("p"), id("1")).hasNext());
        assertFalse(new SharedContinuations(forest, id("7"), id("p")).hasNext());
    }

    @Test
    @DisplayName("Out-of-range ids are rejected up front")
    void testRange() throws IOException {
        build();
        assertThrows(WordLookupException.class, () -> new SharedContinuations(forest, 999, id("p")));
        assertThrows(WordLookupException.class, () -> new SharedContinuations(forest, id("p"), -1));
    }
}
