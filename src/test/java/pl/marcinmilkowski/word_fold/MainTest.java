package pl.marcinmilkowski.word_fold;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONObject;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import pl.marcinmilkowski.word_fold.config.TestFoldConfig;
import pl.marcinmilkowski.word_fold.corpus.TokenSource;
import pl.marcinmilkowski.word_fold.forest.AssociationForest;
import pl.marcinmilkowski.word_fold.forest.Vocabulary;
import pl.marcinmilkowski.word_fold.output.TextFrameEmitter;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end runs of the command line.
 */
class MainTest {

    private static final Path TINY_CORPUS = Paths.get("src/test/resources/corpus/tiny.txt");

    @TempDir
    Path tempDir;

    private Path corpus(String text) throws IOException {
        Path p = tempDir.resolve("corpus.txt");
        Files.writeString(p, text);
        return p;
    }

    @Test
    @DisplayName("fold writes root headers and frames as text")
    void testFoldText() throws IOException {
        Path out = tempDir.resolve("out/frames.txt");
        int status = Main.run(new String[]{"fold", "--corpus", corpus("a b c a b d").toString(), "--output", out.toString()});
        assertEquals(Main.EXIT_OK, status);

        List<String> lines = Files.readAllLines(out);
        String d = TextFrameEmitter.DEFAULT_DIVIDER;
        assertEquals(List.of(
            "root: a",
            d, "a", "b", "c", "b", "c", "c",
            d, "a", "b", "c", "b", "c", "d",
            d, "a", "b", "d", "b", "c", "d",
            "root: b",
            d, "b", "c", "a", "c", "a", "a",
            "root: c",
            d, "c", "a", "b", "a", "b", "b"), lines);
    }

    @Test
    @DisplayName("--no-headers and --root narrow the text output")
    void testFoldFilteredWithoutHeaders() throws IOException {
        Path out = tempDir.resolve("frames.txt");
        int status = Main.run(new String[]{"fold", "-c", corpus("a b c a b d").toString(), "-o", out.toString(),
            "--no-headers", "--root", "c", "--root", "zzz"});
        assertEquals(Main.EXIT_OK, status);

        assertEquals(List.of(TextFrameEmitter.DEFAULT_DIVIDER, "c", "a", "b", "a", "b", "b"), Files.readAllLines(out));
    }

    @Test
    @DisplayName("fold with the test config emits JSON for the configured roots")
    void testFoldWithConfig() throws IOException {
        Path out = tempDir.resolve("frames.jsonl");
        int status = Main.run(new String[]{"fold", "--corpus", TINY_CORPUS.toString(), "--output", out.toString(),
            "--config", TestFoldConfig.TEST_CONFIG_PATH.toString()});
        assertEquals(Main.EXIT_OK, status);

        List<String> lines = Files.readAllLines(out);
        // "the" yields 7 frames, "cat" yields 2
        assertEquals(9, lines.size());
        JSONObject first = JSON.parseObject(lines.get(0));
        assertEquals("the", first.getString("root"));
        assertEquals("cat", first.getString("main_branch"));
        assertEquals("sat", first.getString("main_leaf"));
        JSONObject last = JSON.parseObject(lines.get(8));
        assertEquals("cat", last.getString("root"));
        assertEquals("ate", last.getString("main_branch"));
        assertEquals("the", last.getString("continuation"));
    }

    @Test
    @DisplayName("Short corpus produces empty output and succeeds")
    void testShortCorpus() throws IOException {
        Path out = tempDir.resolve("frames.txt");
        assertEquals(Main.EXIT_OK, Main.run(new String[]{"fold", "-c", corpus("a b").toString(), "-o", out.toString()}));
        assertTrue(Files.readAllLines(out).isEmpty());
    }

    @Test
    @DisplayName("stats reports forest counts as JSON")
    void testStats() throws IOException {
        Path out = tempDir.resolve("stats.json");
        assertEquals(Main.EXIT_OK, Main.run(new String[]{"stats", "-c", corpus("a b c a b d").toString(), "-o", out.toString()}));

        JSONObject stats = JSON.parseObject(Files.readString(out));
        assertEquals(4, stats.getIntValue("vocabulary_size"));
        assertEquals(4, stats.getIntValue("windows"));
        assertEquals(3, stats.getIntValue("non_empty_roots"));
        assertEquals(5, stats.getIntValue("coordinate_pairs"));
        assertEquals("text", stats.getJSONObject("config").getString("output_format"));
    }

    @Test
    @DisplayName("vocab lists ids in first-occurrence order")
    void testVocab() throws IOException {
        Path out = tempDir.resolve("vocab.tsv");
        assertEquals(Main.EXIT_OK, Main.run(new String[]{"vocab", "-c", corpus("The cat the CAT").toString(),
            "-o", out.toString(), "--lowercase"}));
        assertEquals(List.of("id\tword", "0\tthe", "1\tcat"), Files.readAllLines(out));
    }

    @Test
    @DisplayName("Missing corpus fails before any output is written")
    void testMissingCorpus() {
        Path out = tempDir.resolve("frames.txt");
        int status = Main.run(new String[]{"fold", "-c", tempDir.resolve("absent.txt").toString(), "-o", out.toString()});
        assertEquals(Main.EXIT_ERROR, status);
        assertFalse(Files.exists(out));
    }

    @Test
    @DisplayName("Usage errors return the usage status")
    void testUsageErrors() {
        assertEquals(Main.EXIT_USAGE, Main.run(new String[]{}));
        assertEquals(Main.EXIT_USAGE, Main.run(new String[]{"bogus"}));
        assertEquals(Main.EXIT_USAGE, Main.run(new String[]{"fold"}));
        assertEquals(Main.EXIT_USAGE, Main.run(new String[]{"fold", "--unknown"}));
        assertEquals(Main.EXIT_USAGE, Main.run(new String[]{"fold", "--corpus"}));
        assertEquals(Main.EXIT_OK, Main.run(new String[]{"help"}));
    }

    @Test
    @DisplayName("Invalid format value is a usage error")
    void testBadFormat() throws IOException {
        Path c = corpus("a b c");
        assertEquals(Main.EXIT_USAGE, Main.run(new String[]{"fold", "-c", c.toString(), "--format", "xml",
            "-o", tempDir.resolve("x.txt").toString()}));
    }

    @Test
    @DisplayName("A corpus that changes between passes ends with an error status")
    void testCorpusChangedBetweenPasses() {
        AtomicInteger passes = new AtomicInteger();
        TokenSource changing = consumer -> {
            String text = passes.getAndIncrement() == 0 ? "a b c" : "a b z";
            for (String token : text.split(" ")) {
                consumer.accept(token);
            }
        };

        int status = Main.runGuarded(() -> {
            Vocabulary vocabulary = Vocabulary.build(changing);
            AssociationForest.build(vocabulary, changing);
            return Main.EXIT_OK;
        });
        assertEquals(Main.EXIT_ERROR, status);
        assertEquals(2, passes.get());
    }

    @Test
    @DisplayName("I/O failures inside a command end with an error status")
    void testIoFailure() {
        assertEquals(Main.EXIT_ERROR, Main.runGuarded(() -> {
            throw new IOException("disk full");
        }));
    }
}
