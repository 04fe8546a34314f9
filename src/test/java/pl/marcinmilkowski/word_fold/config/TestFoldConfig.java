package pl.marcinmilkowski.word_fold.config;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Test helper for loading the test fold configuration.
 */
public class TestFoldConfig {

    public static final Path TEST_CONFIG_PATH = Paths.get("src/test/resources/test-fold.json");

    private static FoldConfigLoader testConfig;

    /**
     * Get the test config. Loads on first call.
     */
    public static FoldConfigLoader getTestConfig() throws IOException {
        if (testConfig == null) {
            testConfig = new FoldConfigLoader(TEST_CONFIG_PATH);
        }
        return testConfig;
    }
}
