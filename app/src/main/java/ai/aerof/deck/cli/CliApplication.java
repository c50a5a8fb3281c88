package ai.aerof.deck.cli;

import ai.aerof.deck.DeckException;
import ai.aerof.deck.batch.BatchParseOutcome;
import ai.aerof.deck.batch.DeckLoader;
import ai.aerof.deck.batch.DocumentBatchParser;
import ai.aerof.deck.batch.ParsedDocument;
import ai.aerof.deck.batch.SourceDocument;
import ai.aerof.deck.config.Config;
import ai.aerof.deck.config.ConfigLoader;
import ai.aerof.deck.config.OutputFormat;
import ai.aerof.deck.config.ParameterAssignment;
import ai.aerof.deck.config.SystemEnvironmentReader;
import ai.aerof.deck.inference.InferredParameters;
import ai.aerof.deck.inference.ParameterInference;
import ai.aerof.deck.interchange.TreeJsonCodec;
import ai.aerof.deck.logging.LoggingConfigurator;
import ai.aerof.deck.merge.MergeEngine;
import ai.aerof.deck.merge.MergeReport;
import ai.aerof.deck.parser.ParseResult;
import ai.aerof.deck.parser.Parser;
import ai.aerof.deck.serializer.Serializer;
import ai.aerof.deck.tree.Block;
import ai.aerof.deck.tree.Node;
import ai.aerof.deck.tree.Scalar;
import ai.aerof.deck.tree.Tree;
import ai.aerof.deck.tree.TreePath;
import ai.aerof.deck.writer.DocumentWriter;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and the deck pipeline:
 * base deck, overlays, inferred parameters, explicit overrides, then rendering.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    static final int EXIT_FAILURE = 1;

    private final ConfigLoader configLoader;
    private final DocumentWriter documentWriter;
    private final ParameterInference parameterInference;
    private final MergeEngine mergeEngine;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()), new DocumentWriter(), new ParameterInference(), new MergeEngine());
    }

    CliApplication(ConfigLoader configLoader, DocumentWriter documentWriter, ParameterInference parameterInference,
                   MergeEngine mergeEngine) {
        this.configLoader = configLoader;
        this.documentWriter = documentWriter;
        this.parameterInference = parameterInference;
        this.mergeEngine = mergeEngine;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);
        return run(commandLine, cliArguments, args);
    }

    int run(CommandLine commandLine, CliArguments cliArguments, String[] args) {
        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException ex) {
            commandLine.getErr().println(ex.getMessage());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }
        LoggingConfigurator.configure(config.logFormat(), config.verbose());
        LOGGER.debug("Running with policy={} indent={} format={}", config.parsePolicy(), config.indentWidth(), config.outputFormat());

        try {
            return execute(config, commandLine.getOut(), commandLine.getErr());
        } catch (DeckException | UncheckedIOException ex) {
            LOGGER.error("Failed: {}", ex.getMessage());
            commandLine.getErr().println(ex.getMessage());
            return EXIT_FAILURE;
        }
    }

    private int execute(Config config, PrintWriter out, PrintWriter err) {
        Parser parser = new Parser(config.parsePolicy());
        TreeJsonCodec jsonCodec = new TreeJsonCodec();
        DeckLoader deckLoader = new DeckLoader(parser, jsonCodec);
        Serializer serializer = new Serializer(config.indentWidth());

        Tree tree = config.basePath().map(path -> loadBase(deckLoader, path)).orElseGet(Tree::empty);
        tree = applyOverlays(tree, config.overlayPaths(), deckLoader);

        if (config.prompt().isPresent()) {
            InferredParameters inferred = parameterInference.infer(config.prompt().get());
            if (inferred.isEmpty()) {
                LOGGER.warn("No parameters could be inferred from the prompt");
            } else {
                LOGGER.info("Inferred parameters: {}", inferred.facts());
                tree = mergeLogged(tree, inferred.overlay(), "prompt");
            }
        }

        for (ParameterAssignment assignment : config.assignments()) {
            tree = tree.set(assignment.path(), assignment.value());
        }

        String rendered;
        if (config.query().isPresent()) {
            List<String> path = config.query().get();
            Optional<Node> node = tree.get(path);
            if (node.isEmpty()) {
                err.println("No value at " + TreePath.format(path));
                return EXIT_FAILURE;
            }
            rendered = renderNode(path.get(path.size() - 1), node.get(), config.outputFormat(), serializer, jsonCodec);
        } else {
            rendered = config.outputFormat() == OutputFormat.JSON ? jsonCodec.toJson(tree) + "\n" : serializer.serialize(tree);
        }

        if (config.outputPath().isPresent()) {
            documentWriter.write(config.outputPath().get(), rendered);
        } else {
            out.print(rendered);
            out.flush();
        }
        return 0;
    }

    private Tree loadBase(DeckLoader deckLoader, Path path) {
        ParseResult result = deckLoader.load(path);
        result.warnings().forEach(warning -> LOGGER.warn("{}: {}", path, warning));
        LOGGER.info("Loaded base deck {} ({} top-level entries)", path, result.tree().entries().size());
        return result.tree();
    }

    private Tree applyOverlays(Tree base, List<Path> overlayPaths, DeckLoader deckLoader) {
        if (overlayPaths.isEmpty()) {
            return base;
        }
        List<SourceDocument> documents = new ArrayList<>();
        for (Path overlayPath : overlayPaths) {
            try {
                documents.add(deckLoader.read(overlayPath));
            } catch (UncheckedIOException ex) {
                LOGGER.warn("Skipping overlay {}: {}", overlayPath, ex.getMessage());
            }
        }
        BatchParseOutcome outcome = new DocumentBatchParser(deckLoader::parse).parseAll(documents);
        if (!outcome.failures().isEmpty()) {
            LOGGER.warn("Skipped overlays that failed to parse: {}", String.join(", ", outcome.failedNames()));
        }
        Tree merged = base;
        for (ParsedDocument overlay : outcome.parsed()) {
            merged = mergeLogged(merged, overlay.tree(), overlay.name());
        }
        return merged;
    }

    private Tree mergeLogged(Tree base, Tree overlay, String source) {
        MergeReport report = mergeEngine.mergeWithReport(base, overlay);
        if (!report.warnings().isEmpty()) {
            LOGGER.info("{} overrode {} existing values", source, report.warnings().size());
        }
        return report.tree();
    }

    private static String renderNode(String key, Node node, OutputFormat format, Serializer serializer, TreeJsonCodec jsonCodec) {
        if (node instanceof Scalar scalar) {
            return scalar.text() + "\n";
        }
        Block block = (Block) node;
        return format == OutputFormat.JSON
                ? jsonCodec.toJson(Tree.of(block.children())) + "\n"
                : serializer.serialize(key, block);
    }
}
