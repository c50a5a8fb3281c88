package ai.aerof.deck.batch;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Documents that parsed, in input order, and the ones that were skipped.
 */
public record BatchParseOutcome(List<ParsedDocument> parsed, List<DocumentFailure> failures) {

    public BatchParseOutcome {
        parsed = List.copyOf(Objects.requireNonNull(parsed, "parsed"));
        failures = List.copyOf(Objects.requireNonNull(failures, "failures"));
    }

    public List<String> failedNames() {
        return failures.stream().map(DocumentFailure::name).collect(Collectors.toList());
    }
}
