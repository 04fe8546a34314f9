package pl.marcinmilkowski.word_fold;

import com.alibaba.fastjson2.JSONObject;
import com.alibaba.fastjson2.JSONWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.word_fold.config.FoldConfigLoader;
import pl.marcinmilkowski.word_fold.config.FoldConfigLoader.OutputFormat;
import pl.marcinmilkowski.word_fold.corpus.WhitespaceTokenSource;
import pl.marcinmilkowski.word_fold.corpus.WhitespaceTokenSource.Tokenization;
import pl.marcinmilkowski.word_fold.fold.FoldEnumerator;
import pl.marcinmilkowski.word_fold.fold.FoldSummary;
import pl.marcinmilkowski.word_fold.forest.AssociationForest;
import pl.marcinmilkowski.word_fold.forest.ForestStatistics;
import pl.marcinmilkowski.word_fold.forest.Vocabulary;
import pl.marcinmilkowski.word_fold.output.FrameEmitter;
import pl.marcinmilkowski.word_fold.output.JsonFrameEmitter;
import pl.marcinmilkowski.word_fold.output.TextFrameEmitter;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Main entry point for the Word Fold tool.
 *
 * Reads a corpus, builds the vocabulary and the association forest, and
 * either enumerates shared continuations ({@code fold}) or reports on the
 * forest ({@code stats}, {@code vocab}).
 */
public class Main {

    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_USAGE = 2;

    public static void main(String[] args) {
        int status = run(args);
        if (status != EXIT_OK) {
            System.exit(status);
        }
    }

    static int run(String[] args) {
        if (args.length == 0) {
            showUsage();
            return EXIT_USAGE;
        }

        String command = args[0].toLowerCase(Locale.ROOT);
        return runGuarded(() -> dispatch(command, args));
    }

    private static int dispatch(String command, String[] args) throws IOException {
        switch (command) {
            case "fold":
                return handleFoldCommand(RunOptions.parse(args));
            case "stats":
                return handleStatsCommand(RunOptions.parse(args));
            case "vocab":
                return handleVocabCommand(RunOptions.parse(args));
            case "help":
                showUsage();
                return EXIT_OK;
            default:
                logger.error("Unknown command: {}", command);
                showUsage();
                return EXIT_USAGE;
        }
    }

    /**
     * Runs a command, turning failures into a one-line message and an exit
     * status.
     */
    static int runGuarded(Command command) {
        try {
            return command.execute();
        } catch (IllegalArgumentException e) {
            logger.error("Invalid arguments: {}", e.getMessage());
            System.err.println("Error: " + e.getMessage());
            System.err.println("Use 'help' command for usage information.");
            return EXIT_USAGE;
        } catch (NoSuchFileException e) {
            logger.error("File not found: {}", e.getFile());
            System.err.println("Error: file not found: " + e.getFile());
            return EXIT_ERROR;
        } catch (IOException e) {
            logger.error("I/O error", e);
            System.err.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        } catch (IllegalStateException e) {
            logger.error("Inconsistent corpus: {}", e.getMessage());
            System.err.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        }
    }

    @FunctionalInterface
    interface Command {
        int execute() throws IOException;
    }

    private static int handleFoldCommand(RunOptions options) throws IOException {
        if (options.corpus == null) {
            System.err.println("Error: --corpus is required");
            System.err.println("Usage: java -jar word-fold.jar fold --corpus <file> [--output <file>]");
            return EXIT_USAGE;
        }

        FoldConfigLoader config = options.loadConfig();
        WhitespaceTokenSource source = options.tokenSource(config);

        Vocabulary vocabulary = Vocabulary.build(source);
        AssociationForest forest = AssociationForest.build(vocabulary, source);

        FoldEnumerator enumerator = new FoldEnumerator(forest);
        enumerator.setRootFilter(resolveRoots(vocabulary, options.roots.isEmpty() ? config.getRoots() : options.roots));

        OutputFormat format = options.format != null ? OutputFormat.fromName(options.format) : config.getOutputFormat();
        boolean headers = config.isPrintRootHeaders() && !options.noHeaders;

        FoldSummary summary;
        try (OutputTarget target = OutputTarget.open(options.output)) {
            FrameEmitter emitter = format == OutputFormat.JSON
                ? new JsonFrameEmitter(vocabulary, target.writer())
                : new TextFrameEmitter(vocabulary, target.writer(), config.getDivider(), headers);
            summary = enumerator.run(emitter);
        }

        logger.info("Fold finished for {}: {}", source, summary);
        return summary.rootsFailed() == 0 ? EXIT_OK : EXIT_ERROR;
    }

    private static int handleStatsCommand(RunOptions options) throws IOException {
        if (options.corpus == null) {
            System.err.println("Error: --corpus is required");
            System.err.println("Usage: java -jar word-fold.jar stats --corpus <file> [--output <file>]");
            return EXIT_USAGE;
        }

        FoldConfigLoader config = options.loadConfig();
        WhitespaceTokenSource source = options.tokenSource(config);
        AssociationForest forest = AssociationForest.build(source);
        ForestStatistics stats = forest.statistics();

        JSONObject obj = new JSONObject();
        obj.put("corpus", options.corpus);
        obj.put("vocabulary_size", stats.vocabularySize());
        obj.put("windows", stats.windowCount());
        obj.put("non_empty_roots", stats.nonEmptyRoots());
        obj.put("branches", stats.branchCount());
        obj.put("leaves", stats.leafCount());
        obj.put("coordinate_pairs", stats.coordinatePairs());
        obj.put("config", config.toJson());

        try (OutputTarget target = OutputTarget.open(options.output)) {
            target.writer().write(obj.toJSONString(JSONWriter.Feature.PrettyFormat));
            target.writer().write('\n');
        }
        logger.info("Forest statistics: {}", stats);
        return EXIT_OK;
    }

    private static int handleVocabCommand(RunOptions options) throws IOException {
        if (options.corpus == null) {
            System.err.println("Error: --corpus is required");
            System.err.println("Usage: java -jar word-fold.jar vocab --corpus <file> [--output <file>]");
            return EXIT_USAGE;
        }

        FoldConfigLoader config = options.loadConfig();
        Vocabulary vocabulary = Vocabulary.build(options.tokenSource(config));

        try (OutputTarget target = OutputTarget.open(options.output)) {
            Writer w = target.writer();
            w.write("id\tword\n");
            List<String> tokens = vocabulary.tokens();
            for (int id = 0; id < tokens.size(); id++) {
                w.write(id + "\t" + tokens.get(id) + "\n");
            }
        }
        return EXIT_OK;
    }

    /**
     * Maps root words to ids; null when no roots were requested.
     */
    private static List<Integer> resolveRoots(Vocabulary vocabulary, List<String> words) {
        if (words.isEmpty()) {
            return null;
        }
        List<Integer> ids = new ArrayList<>();
        for (String word : words) {
            Optional<Integer> id = vocabulary.idOf(word);
            if (id.isPresent()) {
                ids.add(id.get());
            } else {
                logger.warn("Root word '{}' does not occur in the corpus; ignoring", word);
            }
        }
        return ids;
    }

    private static void showUsage() {
        System.out.println("Usage: java -jar word-fold.jar <command> [options]");
        System.out.println();
        System.out.println("Commands:");
        System.out.println("  fold   Enumerate shared continuations and print word frames");
        System.out.println("  stats  Print forest statistics as JSON");
        System.out.println("  vocab  Print the vocabulary as id<TAB>word");
        System.out.println("  help   Show this message");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --corpus, -c <file>     Corpus of whitespace-separated words (required)");
        System.out.println("  --output, -o <file>     Write to file instead of stdout");
        System.out.println("  --config <file>         JSON configuration file");
        System.out.println("  --format <text|json>    Frame output format (fold)");
        System.out.println("  --tokenizer <name>      whitespace (default) or letter");
        System.out.println("  --lowercase             Fold corpus to lower case");
        System.out.println("  --root, -r <word>       Only enumerate this root (repeatable)");
        System.out.println("  --no-headers            Omit 'root:' header lines in text output");
    }

    /**
     * Options shared by all corpus commands.
     */
    private static final class RunOptions {
        String corpus;
        String output;
        String config;
        String format;
        String tokenizer;
        boolean lowercase;
        boolean noHeaders;
        final List<String> roots = new ArrayList<>();

        static RunOptions parse(String[] args) {
            RunOptions o = new RunOptions();
            for (int i = 1; i < args.length; i++) {
                switch (args[i]) {
                    case "--corpus":
                    case "-c":
                        o.corpus = value(args, ++i);
                        break;
                    case "--output":
                    case "-o":
                        o.output = value(args, ++i);
                        break;
                    case "--config":
                        o.config = value(args, ++i);
                        break;
                    case "--format":
                        o.format = value(args, ++i);
                        break;
                    case "--tokenizer":
                        o.tokenizer = value(args, ++i);
                        break;
                    case "--root":
                    case "-r":
                        o.roots.add(value(args, ++i));
                        break;
                    case "--lowercase":
                        o.lowercase = true;
                        break;
                    case "--no-headers":
                        o.noHeaders = true;
                        break;
                    default:
                        throw new IllegalArgumentException("Unknown option: " + args[i]);
                }
            }
            return o;
        }

        private static String value(String[] args, int i) {
            if (i >= args.length) {
                throw new IllegalArgumentException("Missing value for " + args[i - 1]);
            }
            return args[i];
        }

        FoldConfigLoader loadConfig() throws IOException {
            return config != null ? new FoldConfigLoader(Paths.get(config)) : FoldConfigLoader.defaults();
        }

        WhitespaceTokenSource tokenSource(FoldConfigLoader cfg) throws IOException {
            Tokenization t = tokenizer != null ? Tokenization.fromName(tokenizer) : cfg.getTokenization();
            return WhitespaceTokenSource.ofFile(Paths.get(corpus), t, lowercase || cfg.isLowercase());
        }
    }

    /**
     * Stdout or a file; stdout is flushed but never closed.
     */
    private static final class OutputTarget implements AutoCloseable {
        private final Writer writer;
        private final boolean owned;

        private OutputTarget(Writer writer, boolean owned) {
            this.writer = writer;
            this.owned = owned;
        }

        static OutputTarget open(String output) throws IOException {
            if (output == null) {
                return new OutputTarget(new BufferedWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8)), false);
            }
            Path path = Paths.get(output);
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            return new OutputTarget(Files.newBufferedWriter(path, StandardCharsets.UTF_8), true);
        }

        Writer writer() {
            return writer;
        }

        @Override
        public void close() throws IOException {
            if (owned) {
                writer.close();
            } else {
                writer.flush();
            }
        }
    }
}
