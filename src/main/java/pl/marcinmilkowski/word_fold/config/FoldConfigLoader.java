package pl.marcinmilkowski.word_fold.config;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.word_fold.corpus.WhitespaceTokenSource.Tokenization;
import pl.marcinmilkowski.word_fold.output.TextFrameEmitter;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Loads run settings from JSON.
 *
 * Expected JSON structure (only "version" is required):
 * {
 *   "version": "1.0",
 *   "tokenizer": "whitespace",
 *   "lowercase": false,
 *   "output_format": "text",
 *   "divider": "/////////////////////////////////",
 *   "print_root_headers": true,
 *   "roots": ["the", "of"]
 * }
 */
public class FoldConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(FoldConfigLoader.class);

    private final String version;
    private final Path configPath;
    private final Tokenization tokenization;
    private final boolean lowercase;
    private final OutputFormat outputFormat;
    private final String divider;
    private final boolean printRootHeaders;
    private final List<String> roots;

    /**
     * Load configuration from the specified path.
     *
     * @param configPath Path to the JSON file
     * @throws IOException if the file cannot be read
     * @throws IllegalArgumentException if the file is invalid
     */
    public FoldConfigLoader(Path configPath) throws IOException {
        this.configPath = configPath;

        if (!Files.exists(configPath)) {
            throw new IOException("Fold config file not found: " + configPath);
        }

        JSONObject root;
        try {
            root = JSON.parseObject(Files.readString(configPath));
        } catch (JSONException e) {
            throw new IllegalArgumentException("Malformed fold config " + configPath + ": " + e.getMessage(), e);
        }
        if (root == null) {
            throw new IllegalArgumentException("Empty fold config: " + configPath);
        }

        String parsedVersion = root.getString("version");
        if (parsedVersion == null || parsedVersion.isBlank()) {
            throw new IllegalArgumentException("Missing 'version' field in fold config");
        }
        this.version = parsedVersion;

        this.tokenization = Tokenization.fromName(root.getString("tokenizer") != null
            ? root.getString("tokenizer") : Tokenization.WHITESPACE.configName());
        Boolean parsedLowercase = root.getBoolean("lowercase");
        this.lowercase = parsedLowercase != null && parsedLowercase;
        this.outputFormat = OutputFormat.fromName(root.getString("output_format") != null
            ? root.getString("output_format") : OutputFormat.TEXT.configName());

        String parsedDivider = root.getString("divider");
        this.divider = parsedDivider != null ? parsedDivider : TextFrameEmitter.DEFAULT_DIVIDER;
        Boolean parsedHeaders = root.getBoolean("print_root_headers");
        this.printRootHeaders = parsedHeaders == null || parsedHeaders;

        List<String> loadedRoots = new ArrayList<>();
        JSONArray rootsArray = root.getJSONArray("roots");
        if (rootsArray != null) {
            for (int i = 0; i < rootsArray.size(); i++) {
                String word = rootsArray.getString(i);
                if (word != null && !word.isBlank()) {
                    loadedRoots.add(word.trim());
                }
            }
        }
        this.roots = Collections.unmodifiableList(loadedRoots);

        logger.info("Loaded fold config version {}: tokenizer={}, format={}, {} roots from {}",
            version, tokenization.configName(), outputFormat.configName(), roots.size(), configPath);
    }

    private FoldConfigLoader() {
        this.version = "default";
        this.configPath = null;
        this.tokenization = Tokenization.WHITESPACE;
        this.lowercase = false;
        this.outputFormat = OutputFormat.TEXT;
        this.divider = TextFrameEmitter.DEFAULT_DIVIDER;
        this.printRootHeaders = true;
        this.roots = List.of();
    }

    /**
     * Built-in settings used when no config file is given.
     */
    public static FoldConfigLoader defaults() {
        return new FoldConfigLoader();
    }

    public String getVersion() {
        return version;
    }

    /**
     * Get the config file path, or null for the built-in defaults.
     */
    public Path getConfigPath() {
        return configPath;
    }

    public Tokenization getTokenization() {
        return tokenization;
    }

    public boolean isLowercase() {
        return lowercase;
    }

    public OutputFormat getOutputFormat() {
        return outputFormat;
    }

    public String getDivider() {
        return divider;
    }

    public boolean isPrintRootHeaders() {
        return printRootHeaders;
    }

    /**
     * Root words to restrict the search to; empty means all roots.
     */
    public List<String> getRoots() {
        return roots;
    }

    /**
     * Export the loaded config, e.g. for the stats command.
     */
    public JSONObject toJson() {
        JSONObject obj = new JSONObject();
        obj.put("version", version);
        if (configPath != null) obj.put("config_path", configPath.toString());
        obj.put("tokenizer", tokenization.configName());
        obj.put("lowercase", lowercase);
        obj.put("output_format", outputFormat.configName());
        obj.put("divider", divider);
        obj.put("print_root_headers", printRootHeaders);
        obj.put("roots", new JSONArray(roots));
        return obj;
    }

    /**
     * Frame rendering formats.
     */
    public enum OutputFormat {
        TEXT,
        JSON;

        public String configName() {
            return name().toLowerCase(Locale.ROOT);
        }

        public static OutputFormat fromName(String name) {
            if (name == null) {
                throw new IllegalArgumentException("Output format must not be null");
            }
            for (OutputFormat f : values()) {
                if (f.configName().equals(name.trim().toLowerCase(Locale.ROOT))) {
                    return f;
                }
            }
            throw new IllegalArgumentException("Unknown output format: " + name + " (expected text or json)");
        }
    }
}
