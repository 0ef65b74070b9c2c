package nl.nfi.djcnf;

import nl.nfi.djcnf.grammar.Grammar;
import nl.nfi.djcnf.grammar.GrammarParser;
import nl.nfi.djcnf.grammar.Production;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

import static java.util.stream.Collectors.toSet;

public final class Utils {

    // grammars exercising every pipeline stage, shared by the property tests
    public static final List<String> SAMPLE_GRAMMARS = List.of(
            text("S -> AB | a", "A -> aA | ε", "B -> b"),
            text("S -> aS | b"),
            text("S -> ε | a"),
            text("A -> B A B | B | ε", "B -> 0 0 | ε"),
            text("S -> (S)S | ε"),
            text("S -> A S A | a B", "A -> B | S", "B -> b | ε"),
            text("S -> aSb | E"),
            text("S -> A | b", "A -> S | a"),
            text("S -> ABCD", "A -> a", "B -> b | E", "C -> c", "D -> d"),
            text("E -> E + T | T", "T -> T * F | F", "F -> ( E ) | a"),
            text("S -> A B | a", "A -> a", "B -> b B"),
            text("S -> S S | ε | a"),
            text("S0 -> S1 X1 T_a a b | S0 S0", "S1 -> X2 a | ε")
    );

    public static String text(final String... lines) {
        return String.join("\n", lines);
    }

    public static Grammar grammar(final String... lines) {
        return GrammarParser.parse(text(lines));
    }

    public static Stream<String> sampleGrammars() {
        return SAMPLE_GRAMMARS.stream();
    }

    // productions per nonterminal, ignoring order
    public static Map<String, Set<List<String>>> asSets(final Grammar grammar) {
        final Map<String, Set<List<String>>> sets = new LinkedHashMap<>();
        for (final String nonTerminal : grammar.nonTerminals()) {
            sets.put(nonTerminal, grammar.productions(nonTerminal).stream()
                    .map(Production::symbols)
                    .collect(toSet()));
        }
        return sets;
    }
}
