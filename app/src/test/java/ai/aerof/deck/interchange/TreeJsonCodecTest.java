package ai.aerof.deck.interchange;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.aerof.deck.DeckException;
import ai.aerof.deck.parser.Parser;
import ai.aerof.deck.serializer.Serializer;
import ai.aerof.deck.tree.Entry;
import ai.aerof.deck.tree.Scalar;
import ai.aerof.deck.tree.ScalarStyle;
import ai.aerof.deck.tree.Tree;
import org.junit.jupiter.api.Test;

class TreeJsonCodecTest {

    private final TreeJsonCodec codec = new TreeJsonCodec();
    private final Parser parser = new Parser();

    @Test
    void writesNestedObjectsWithNumbersAsJsonNumbers() {
        Tree tree = parser.parse("under Problem { Type = Steady; } Mach = 0.8; Prefix = \"out/run\";");

        String json = codec.toJson(tree);

        assertThat(json.replaceAll("\\s", ""))
                .isEqualTo("{\"Problem\":{\"Type\":\"Steady\"},\"Mach\":0.8,\"Prefix\":\"out/run\"}");
    }

    @Test
    void quotedScalarsThatLookBareOrNumericSurviveRoundTrip() {
        Tree tree = parser.parse("Name = \"Steady\"; Prefix = \"100\"; Label = \"under\"; Empty = \"\";");

        String json = codec.toJson(tree);

        assertThat(json).contains("\"Name\" : \"\\\"Steady\\\"\"");
        assertThat(codec.fromJson(json)).isEqualTo(tree);
        assertThat(new Serializer().serialize(codec.fromJson(json)))
                .isEqualTo("Name = \"Steady\";\nPrefix = \"100\";\nLabel = \"under\";\nEmpty = \"\";\n");
    }

    @Test
    void numberLiteralsOutsideJsonGrammarSurviveRoundTrip() {
        Tree tree = parser.parse("A = +2; B = .5; C = 1.; D = 007; E = -1.5e-3;");

        assertThat(codec.fromJson(codec.toJson(tree))).isEqualTo(tree);
    }

    @Test
    void jsonRoundTripKeepsOrderAndDuplicates() {
        Tree tree = parser.parse("""
                under Surfaces { under SurfaceData { Id = 1; } }
                under Surfaces { under SurfaceData { Id = 2; } }
                Equations.Type = Euler;
                Equations.Type = NavierStokes;
                """);

        assertThat(codec.fromJson(codec.toJson(tree))).isEqualTo(tree);
    }

    @Test
    void readsNumbersBooleansAndUnderPrefixedKeys() {
        Tree tree = codec.fromJson("{\"under Inlet\": {\"Mach\": 0.8, \"Alpha\": -2, \"Viscous\": false}, \"Prefix\": \"out/run\"}");

        assertThat(tree.entries()).extracting(Entry::key).containsExactly("Inlet", "Prefix");
        assertThat(tree.scalar("Inlet", "Mach")).contains(new Scalar("0.8", ScalarStyle.NUMERIC));
        assertThat(tree.scalar("Inlet", "Alpha")).contains(new Scalar("-2", ScalarStyle.NUMERIC));
        assertThat(tree.scalar("Inlet", "Viscous")).contains(new Scalar("false", ScalarStyle.BARE));
        assertThat(tree.scalar("Prefix")).contains(new Scalar("out/run", ScalarStyle.QUOTED));
    }

    @Test
    void rejectsArraysNullsAndNonObjects() {
        assertThatThrownBy(() -> codec.fromJson("{\"A\": [1, 2]}")).isInstanceOf(DeckException.class);
        assertThatThrownBy(() -> codec.fromJson("{\"A\": null}")).isInstanceOf(DeckException.class);
        assertThatThrownBy(() -> codec.fromJson("[1]")).isInstanceOf(DeckException.class);
    }

    @Test
    void rejectsInvalidKeysAndMalformedJson() {
        assertThatThrownBy(() -> codec.fromJson("{\"bad key\": \"x\"}"))
                .isInstanceOf(DeckException.class)
                .hasMessageContaining("bad key");
        assertThatThrownBy(() -> codec.fromJson("{\"A\": \"x\""))
                .isInstanceOf(DeckException.class)
                .hasMessageContaining("Malformed JSON");
        assertThatThrownBy(() -> codec.fromJson("{} {}"))
                .isInstanceOf(DeckException.class);
    }

    @Test
    void emptyTreeIsEmptyObject() {
        assertThat(codec.toJson(Tree.empty()).replaceAll("\\s", "")).isEqualTo("{}");
        assertThat(codec.fromJson("{ }")).isEqualTo(Tree.empty());
    }
}
