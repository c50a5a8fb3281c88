package ai.aerof.deck.serializer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.aerof.deck.parser.Parser;
import ai.aerof.deck.tree.Block;
import ai.aerof.deck.tree.Scalar;
import ai.aerof.deck.tree.Tree;
import org.junit.jupiter.api.Test;

class SerializerTest {

    private final Serializer serializer = new Serializer();
    private final Parser parser = new Parser();

    @Test
    void rendersCanonicalForm() {
        Tree tree = parser.parse("under Problem{Type=Steady;Mode=NonDimensional;}Equations.Type=Euler;");

        assertThat(serializer.serialize(tree)).isEqualTo("""
                under Problem {
                  Type = Steady;
                  Mode = NonDimensional;
                }
                Equations.Type = Euler;
                """);
    }

    @Test
    void rendersNestedBlocksWithIncreasingIndentation() {
        Tree tree = parser.parse("under Time { MaxIts = 10; under Implicit { MatrixVectorProduct = FiniteDifference; } }");

        assertThat(serializer.serialize(tree)).isEqualTo("""
                under Time {
                  MaxIts = 10;
                  under Implicit {
                    MatrixVectorProduct = FiniteDifference;
                  }
                }
                """);
    }

    @Test
    void requotesQuotedScalarsOnly() {
        Tree tree = parser.parse("Geometry = \"wing.top\"; Mach = 0.8; Flux = Roe; Name = \"Roe\";");

        assertThat(serializer.serialize(tree)).isEqualTo("""
                Geometry = "wing.top";
                Mach = 0.8;
                Flux = Roe;
                Name = "Roe";
                """);
    }

    @Test
    void keepsChildOrderAndDuplicates() {
        Tree tree = new Tree(Tree.builder().scalar("B", "2").scalar("A", "1").scalar("B", "3").build());

        assertThat(serializer.serialize(tree)).isEqualTo("B = 2;\nA = 1;\nB = 3;\n");
    }

    @Test
    void honoursIndentWidth() {
        Tree tree = new Tree(Tree.builder().block(Block.builder("Output").scalar("Frequency", "5").build()).build());

        assertThat(new Serializer(4).serialize(tree)).isEqualTo("under Output {\n    Frequency = 5;\n}\n");
    }

    @Test
    void rendersEmptyTreeAndEmptyBlock() {
        assertThat(serializer.serialize(Tree.empty())).isEmpty();
        Tree tree = new Tree(Tree.builder().block(Block.empty("Restart")).build());
        assertThat(serializer.serialize(tree)).isEqualTo("under Restart {\n}\n");
    }

    @Test
    void rendersSingleEntry() {
        assertThat(serializer.serialize("Mach", Scalar.of("0.5"))).isEqualTo("Mach = 0.5;\n");
    }

    @Test
    void rejectsInvalidIndentWidth() {
        assertThatThrownBy(() -> new Serializer(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Serializer(9)).isInstanceOf(IllegalArgumentException.class);
    }
}
