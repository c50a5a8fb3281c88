package ai.aerof.deck.batch;

import ai.aerof.deck.DeckException;
import ai.aerof.deck.parser.ParseResult;
import ai.aerof.deck.parser.Parser;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Parses several documents independently so that one malformed document does not abort the rest.
 */
public class DocumentBatchParser {

    static final String MDC_DOCUMENT = "document";

    private static final Logger LOGGER = LoggerFactory.getLogger(DocumentBatchParser.class);

    private final Function<SourceDocument, ParseResult> parseFunction;

    public DocumentBatchParser(Parser parser) {
        this(textParser(parser));
    }

    public DocumentBatchParser(Function<SourceDocument, ParseResult> parseFunction) {
        this.parseFunction = Objects.requireNonNull(parseFunction, "parseFunction");
    }

    public BatchParseOutcome parseAll(List<SourceDocument> documents) {
        if (documents == null || documents.isEmpty()) {
            return new BatchParseOutcome(List.of(), List.of());
        }
        List<ParsedDocument> parsed = new ArrayList<>();
        List<DocumentFailure> failures = new ArrayList<>();
        for (SourceDocument document : documents) {
            MDC.put(MDC_DOCUMENT, document.name());
            try {
                ParseResult result = parseFunction.apply(document);
                parsed.add(new ParsedDocument(document.name(), result.tree(), result.warnings()));
                LOGGER.debug("Parsed {} ({} top-level entries)", document.name(), result.tree().entries().size());
            } catch (DeckException ex) {
                LOGGER.error("Skipping {}: {}", document.name(), ex.getMessage());
                failures.add(new DocumentFailure(document.name(), ex.getMessage()));
            } finally {
                MDC.remove(MDC_DOCUMENT);
            }
        }
        if (!failures.isEmpty()) {
            LOGGER.warn("{} of {} documents could not be parsed", failures.size(), documents.size());
        }
        return new BatchParseOutcome(parsed, failures);
    }

    private static Function<SourceDocument, ParseResult> textParser(Parser parser) {
        Objects.requireNonNull(parser, "parser");
        return document -> parser.parseWithDiagnostics(document.text());
    }
}
