package ai.aerof.deck.interchange;

import ai.aerof.deck.DeckException;
import ai.aerof.deck.tree.Block;
import ai.aerof.deck.tree.Entry;
import ai.aerof.deck.tree.Scalar;
import ai.aerof.deck.tree.ScalarStyle;
import ai.aerof.deck.tree.Tree;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.io.StringWriter;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Reads and writes trees as JSON objects using the Jackson streaming API, which keeps entry order and duplicate keys.
 *
 * <p>Numeric scalars are written as JSON numbers when JSON allows their literal, everything else as strings. A quoted
 * scalar whose text would otherwise read back as a bare word or a number keeps its surrounding quotes inside the JSON
 * string. On input, JSON numbers become numeric scalars, quoted strings become quoted scalars, and other strings and
 * booleans get their style inferred from their text.
 */
public class TreeJsonCodec {

    private static final Pattern JSON_NUMBER = Pattern.compile("-?(0|[1-9]\\d*)(\\.\\d+)?([eE][+-]?\\d+)?");
    private static final String QUOTE = "\"";

    private final JsonFactory jsonFactory;

    public TreeJsonCodec() {
        this(new JsonFactory());
    }

    public TreeJsonCodec(JsonFactory jsonFactory) {
        this.jsonFactory = Objects.requireNonNull(jsonFactory, "jsonFactory");
    }

    public String toJson(Tree tree) {
        Objects.requireNonNull(tree, "tree");
        StringWriter writer = new StringWriter();
        try (JsonGenerator generator = jsonFactory.createGenerator(writer)) {
            generator.useDefaultPrettyPrinter();
            writeBlock(generator, tree.root());
        } catch (IOException ex) {
            throw new DeckException("Failed to write tree as JSON", ex);
        }
        return writer.toString();
    }

    public Tree fromJson(String json) {
        Objects.requireNonNull(json, "json");
        try (JsonParser parser = jsonFactory.createParser(json)) {
            if (parser.nextToken() != JsonToken.START_OBJECT) {
                throw new DeckException("JSON document must be an object");
            }
            Block root = readBlock(parser, Block.ROOT_NAME);
            if (parser.nextToken() != null) {
                throw new DeckException("Unexpected content after JSON object at " + parser.currentLocation());
            }
            return new Tree(root);
        } catch (IOException ex) {
            throw new DeckException("Malformed JSON: " + ex.getMessage(), ex);
        }
    }

    private void writeBlock(JsonGenerator generator, Block block) throws IOException {
        generator.writeStartObject();
        for (Entry entry : block.children()) {
            generator.writeFieldName(entry.key());
            if (entry.value() instanceof Block child) {
                writeBlock(generator, child);
            } else {
                writeScalar(generator, (Scalar) entry.value());
            }
        }
        generator.writeEndObject();
    }

    private void writeScalar(JsonGenerator generator, Scalar scalar) throws IOException {
        String text = scalar.text();
        switch (scalar.style()) {
            case NUMERIC -> {
                if (JSON_NUMBER.matcher(text).matches()) {
                    generator.writeNumber(text);
                } else {
                    generator.writeString(text);
                }
            }
            case QUOTED -> {
                if (Scalar.of(text).style() == ScalarStyle.QUOTED) {
                    generator.writeString(text);
                } else {
                    generator.writeString(QUOTE + text + QUOTE);
                }
            }
            case BARE -> generator.writeString(text);
        }
    }

    private static Scalar readString(String text) {
        if (text.length() >= 2 && text.startsWith(QUOTE) && text.endsWith(QUOTE)) {
            return Scalar.quoted(text.substring(1, text.length() - 1));
        }
        return Scalar.of(text);
    }

    private Block readBlock(JsonParser parser, String name) throws IOException {
        Block.Builder builder = Block.builder(name);
        JsonToken token;
        while ((token = parser.nextToken()) != JsonToken.END_OBJECT) {
            if (token != JsonToken.FIELD_NAME) {
                throw new DeckException("Expected field name at " + parser.currentLocation());
            }
            String key = TreeMapper.blockKey(parser.currentName());
            JsonToken valueToken = parser.nextToken();
            try {
                switch (valueToken) {
                    case START_OBJECT -> builder.block(readBlock(parser, key));
                    case VALUE_STRING -> builder.scalar(key, readString(parser.getText()));
                    case VALUE_NUMBER_INT, VALUE_NUMBER_FLOAT ->
                            builder.scalar(key, new Scalar(parser.getText(), ScalarStyle.NUMERIC));
                    case VALUE_TRUE, VALUE_FALSE -> builder.scalar(key, Scalar.of(parser.getText()));
                    default -> throw new DeckException("Unsupported JSON value " + valueToken + " for key '" + key
                            + "' at " + parser.currentLocation());
                }
            } catch (IllegalArgumentException ex) {
                throw new DeckException("Invalid entry '" + key + "': " + ex.getMessage(), ex);
            }
        }
        return builder.build();
    }
}
