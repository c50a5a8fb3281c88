package ai.aerof.deck.cli;

import ai.aerof.deck.parser.ParsePolicy;
import picocli.CommandLine;

public class ParsePolicyConverter implements CommandLine.ITypeConverter<ParsePolicy> {

    @Override
    public ParsePolicy convert(String value) {
        return ParsePolicy.from(value);
    }
}
