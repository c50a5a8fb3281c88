package ai.aerof.deck.batch;

import ai.aerof.deck.interchange.TreeJsonCodec;
import ai.aerof.deck.parser.ParseResult;
import ai.aerof.deck.parser.Parser;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Reads deck files from disk and parses them as input deck text, or as JSON when the name ends in {@code .json}.
 */
public class DeckLoader {

    private static final String JSON_SUFFIX = ".json";

    private final Parser parser;
    private final TreeJsonCodec jsonCodec;

    public DeckLoader(Parser parser, TreeJsonCodec jsonCodec) {
        this.parser = Objects.requireNonNull(parser, "parser");
        this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
    }

    public SourceDocument read(Path path) {
        Objects.requireNonNull(path, "path");
        try {
            return new SourceDocument(path.toString(), Files.readString(path, StandardCharsets.UTF_8));
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read deck: " + path, ex);
        }
    }

    public ParseResult parse(SourceDocument document) {
        if (document.name().toLowerCase(Locale.ROOT).endsWith(JSON_SUFFIX)) {
            return new ParseResult(jsonCodec.fromJson(document.text()), List.of());
        }
        return parser.parseWithDiagnostics(document.text());
    }

    public ParseResult load(Path path) {
        return parse(read(path));
    }
}
