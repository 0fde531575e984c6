package com.stratdsl.unit.parser;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.stratdsl.ast.AstNode;
import com.stratdsl.ast.AtomNode;
import com.stratdsl.ast.ListKind;
import com.stratdsl.ast.ListNode;
import com.stratdsl.ast.NodeKind;
import com.stratdsl.ast.SourcePosition;
import com.stratdsl.ast.SymbolNode;
import com.stratdsl.exception.DslParseException;
import com.stratdsl.parser.StrategyParser;
import java.math.BigDecimal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class StrategyParserTest {

    private StrategyParser parser;

    @BeforeEach
    void setUp() {
        parser = new StrategyParser();
    }

    @Nested
    @DisplayName("Well-formed sources")
    class WellFormed {

        @Test
        @DisplayName("(weight-equal \"AAPL\" \"MSFT\") is a list of a symbol and two string atoms")
        void weightEqualCall() {
            AstNode root = parser.parse("(weight-equal \"AAPL\" \"MSFT\")");

            assertThat(root).isInstanceOf(ListNode.class);
            ListNode list = (ListNode) root;
            assertThat(list.getListKind()).isEqualTo(ListKind.PLAIN);
            assertThat(list.getChildren()).hasSize(3);
            assertThat(list.getChildren().get(0)).isEqualTo(new SymbolNode("weight-equal", new SourcePosition(1, 2)));
            assertThat(list.getChildren().get(1)).isEqualTo(AtomNode.string("AAPL", new SourcePosition(1, 15)));
            assertThat(list.getChildren().get(2)).isEqualTo(AtomNode.string("MSFT", new SourcePosition(1, 22)));
        }

        @Test
        @DisplayName("numbers are exact decimals")
        void numbersAreExact() {
            ListNode list = (ListNode) parser.parse("(> 0.1 1e-2)");

            AtomNode first = (AtomNode) list.getChildren().get(1);
            AtomNode second = (AtomNode) list.getChildren().get(2);
            assertThat(first.getValue()).isEqualTo(new BigDecimal("0.1"));
            assertThat(((BigDecimal) second.getValue()).compareTo(new BigDecimal("0.01"))).isZero();
        }

        @Test
        @DisplayName("vectors, maps and booleans keep their kinds")
        void nestedKinds() {
            ListNode list = (ListNode) parser.parse("(f [1 2] {:window 14} true)");

            assertThat(list.getChildren().get(1).getKind()).isEqualTo(NodeKind.VECTOR);
            assertThat(list.getChildren().get(2).getKind()).isEqualTo(NodeKind.MAP_LITERAL);
            assertThat(((AtomNode) list.getChildren().get(3)).isBoolean()).isTrue();
            assertThat(((SymbolNode) ((ListNode) list.getChildren().get(2)).getChildren().get(0)).isKeyword()).isTrue();
        }

        @Test
        @DisplayName("render reproduces a canonical form of the source")
        void renderRoundTrip() {
            String source = "(defsymphony \"Test\" {:rebalance :daily} (weight-equal [(asset \"SPY\")]))";

            assertThat(parser.parse(source).render()).isEqualTo(source);
        }

        @Test
        @DisplayName("leading comments and whitespace are ignored")
        void commentsIgnored() {
            AstNode root = parser.parse(";; my strategy\n\n  (asset \"SPY\") ; done\n");

            assertThat(root.getPosition()).isEqualTo(new SourcePosition(3, 3));
        }

        @Test
        @DisplayName("a bare atom is a valid program")
        void bareAtom() {
            assertThat(parser.parse("\"SPY\"")).isEqualTo(AtomNode.string("SPY", SourcePosition.START));
        }
    }

    @Nested
    @DisplayName("Malformed sources")
    class Malformed {

        @Test
        @DisplayName("empty source")
        void emptySource() {
            assertThatThrownBy(() -> parser.parse("   ")).isInstanceOf(DslParseException.class);
            assertThatThrownBy(() -> parser.parse("; only a comment")).isInstanceOf(DslParseException.class);
        }

        @Test
        @DisplayName("unclosed list reports the opening bracket")
        void unclosedList() {
            assertThatThrownBy(() -> parser.parse("(weight-equal\n  (asset \"SPY\")"))
                    .isInstanceOf(DslParseException.class)
                    .hasMessageContaining("Unclosed '('")
                    .extracting(e -> ((DslParseException) e).getPosition())
                    .isEqualTo(new SourcePosition(1, 1));
        }

        @Test
        @DisplayName("mismatched closing bracket")
        void mismatchedBracket() {
            assertThatThrownBy(() -> parser.parse("(f [1 2))"))
                    .isInstanceOf(DslParseException.class)
                    .hasMessageContaining("Mismatched ')'")
                    .extracting(e -> ((DslParseException) e).getColumn())
                    .isEqualTo(8);
        }

        @Test
        @DisplayName("numeral with an out-of-range exponent is a positioned parse error")
        void exponentOverflow() {
            assertThatThrownBy(() -> parser.parse("(weight-specified 1e9999999999 \"SPY\")"))
                    .isInstanceOf(DslParseException.class)
                    .hasMessageContaining("Malformed numeric literal '1e9999999999'")
                    .extracting(e -> ((DslParseException) e).getPosition())
                    .isEqualTo(new SourcePosition(1, 19));
        }

        @Test
        @DisplayName("stray closing bracket")
        void strayClose() {
            assertThatThrownBy(() -> parser.parse(")")).isInstanceOf(DslParseException.class);
        }

        @Test
        @DisplayName("more than one top-level form")
        void trailingForm() {
            assertThatThrownBy(() -> parser.parse("(asset \"A\") (asset \"B\")"))
                    .isInstanceOf(DslParseException.class)
                    .hasMessageContaining("after top-level expression")
                    .extracting(e -> ((DslParseException) e).getColumn())
                    .isEqualTo(13);
        }

        @Test
        @DisplayName("map literal with an odd number of elements")
        void unpairedMapKey() {
            assertThatThrownBy(() -> parser.parse("{\"A\" 0.5 \"B\"}"))
                    .isInstanceOf(DslParseException.class)
                    .hasMessageContaining("Unpaired map key")
                    .extracting(e -> ((DslParseException) e).getColumn())
                    .isEqualTo(10);
        }
    }

    @Nested
    @DisplayName("Guard rails")
    class GuardRails {

        @Test
        @DisplayName("nesting beyond the depth limit fails instead of overflowing the stack")
        void depthLimit() {
            StrategyParser shallow = new StrategyParser(3, 1000);

            assertThat(shallow.parse("(a (b (c)))")).isNotNull();
            assertThatThrownBy(() -> shallow.parse("(a (b (c (d))))"))
                    .isInstanceOf(DslParseException.class)
                    .hasMessageContaining("Maximum nesting depth of 3");
        }

        @Test
        @DisplayName("deeply nested hostile input fails with a parse error")
        void hostileNesting() {
            String hostile = "(".repeat(100_000) + ")".repeat(100_000);

            assertThatThrownBy(() -> parser.parse(hostile)).isInstanceOf(DslParseException.class);
        }

        @Test
        @DisplayName("node count limit")
        void nodeLimit() {
            StrategyParser small = new StrategyParser(10, 5);

            assertThat(small.parse("(f 1 2 3)")).isNotNull();
            assertThatThrownBy(() -> small.parse("(f 1 2 3 4)"))
                    .isInstanceOf(DslParseException.class)
                    .hasMessageContaining("Maximum node count of 5");
        }
    }
}
