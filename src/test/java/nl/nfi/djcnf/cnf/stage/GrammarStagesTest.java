package nl.nfi.djcnf.cnf.stage;

import nl.nfi.djcnf.grammar.Grammar;
import nl.nfi.djcnf.grammar.Production;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static nl.nfi.djcnf.Utils.asSets;
import static nl.nfi.djcnf.Utils.grammar;
import static org.assertj.core.api.Assertions.assertThat;

class GrammarStagesTest {

    @Nested
    class StartIsolationStage {

        private final GrammarStage stage = new StartIsolation();

        @Test
        void prependsFreshStart() {
            final Grammar result = stage.apply(grammar("S -> a S | b"));

            assertThat(result.start()).isEqualTo("S0");
            assertThat(result.nonTerminals()).containsExactly("S0", "S");
            assertThat(result.productions("S0")).containsExactly(Production.of("S"));
        }

        @Test
        void skipsTakenNames() {
            // S1 is a terminal here, it must not be captured
            final Grammar result = stage.apply(grammar("S0 -> S1 a"));

            assertThat(result.start()).isEqualTo("S2");
            assertThat(result.productions("S2")).containsExactly(Production.of("S0"));
        }

        @Test
        void usesExplicitStart() {
            final Grammar result = stage.apply(grammar("S -> a A", "A -> b").toBuilder().start("A").build());

            assertThat(result.productions("S0")).containsExactly(Production.of("A"));
        }
    }

    @Nested
    class EpsilonEliminationStage {

        private final GrammarStage stage = new EpsilonElimination();

        @Test
        void onlyStartKeepsEpsilon() {
            final Grammar isolated = new StartIsolation().apply(grammar("A -> B A B | B | ε", "B -> 0 0 | ε"));
            final Grammar result = stage.apply(isolated);

            for (final String nonTerminal : result.nonTerminals()) {
                if (!nonTerminal.equals(result.start())) {
                    assertThat(result.productions(nonTerminal)).noneMatch(Production::isEpsilon);
                }
            }
            assertThat(asSets(result)).isEqualTo(Map.of(
                    "S0", Set.of(List.of("A"), List.of("ε")),
                    "A", Set.of(
                            List.of("B", "A", "B"), List.of("A", "B"), List.of("B", "B"),
                            List.of("B", "A"), List.of("A"), List.of("B")),
                    "B", Set.of(List.of("0", "0"))
            ));
        }

        @Test
        void nonTerminalWithOnlyEpsilonStaysDeclared() {
            final Grammar result = stage.apply(grammar("S -> a A", "A -> ε"));

            assertThat(result.productions("S")).containsExactly(Production.of("a", "A"), Production.of("a"));
            assertThat(result.isNonTerminal("A")).isTrue();
            assertThat(result.productions("A")).isEmpty();
        }

        @Test
        void startKeepsOwnEpsilon() {
            final Grammar result = stage.apply(grammar("S -> ε | a"));

            assertThat(result.productions("S")).containsExactly(Production.epsilon(), Production.of("a"));
        }

        @Test
        void emptiedVariantOfStartBecomesEpsilon() {
            final Grammar result = stage.apply(grammar("S -> A A", "A -> a | ε"));

            assertThat(result.productions("S")).containsExactly(
                    Production.of("A", "A"), Production.of("A"), Production.epsilon());
            assertThat(result.productions("A")).containsExactly(Production.of("a"));
        }
    }

    @Nested
    class UnitEliminationStage {

        private final GrammarStage stage = new UnitElimination();

        @Test
        void unitCycle() {
            final Grammar result = stage.apply(grammar("S -> A | s", "A -> S | a"));

            assertThat(result.productions("S")).containsExactly(Production.of("s"), Production.of("a"));
            assertThat(result.productions("A")).containsExactly(Production.of("a"), Production.of("s"));
        }

        @Test
        void transitiveChain() {
            final Grammar result = stage.apply(grammar("S -> A", "A -> B", "B -> b | S S"));

            for (final String nonTerminal : List.of("S", "A", "B")) {
                assertThat(result.productions(nonTerminal)).containsExactly(Production.of("b"), Production.of("S", "S"));
            }
        }

        @Test
        void epsilonIsNotAUnitProduction() {
            final Grammar result = stage.apply(grammar("S -> A | ε", "A -> a"));

            assertThat(result.productions("S")).containsExactly(Production.epsilon(), Production.of("a"));
        }

        @Test
        void noUnitProductionsRemain() {
            final Grammar result = stage.apply(grammar("S -> A B | C", "A -> C | a", "B -> b | A", "C -> S | c"));

            for (final String nonTerminal : result.nonTerminals()) {
                assertThat(result.productions(nonTerminal))
                        .noneMatch(production -> UnitElimination.isUnit(result, production));
            }
        }
    }

    @Nested
    class UselessSymbolEliminationStage {

        private final GrammarStage stage = new UselessSymbolElimination();

        @Test
        void nonGeneratingThenUnreachable() {
            // dropping S → A B (B generates nothing) disconnects A
            final Grammar result = stage.apply(grammar("S -> A B | a", "A -> a", "B -> b B"));

            assertThat(result.nonTerminals()).containsExactly("S");
            assertThat(result.productions("S")).containsExactly(Production.of("a"));
        }

        @Test
        void unreachable() {
            final Grammar result = stage.apply(grammar("S -> a", "A -> b"));

            assertThat(result.nonTerminals()).containsExactly("S");
        }

        @Test
        void declaredWithoutProductionsIsDropped() {
            final Grammar input = Grammar.builder()
                    .add("S", Production.of("a", "A"))
                    .add("S", Production.of("a"))
                    .declare("A")
                    .build();
            final Grammar result = stage.apply(input);

            assertThat(result.nonTerminals()).containsExactly("S");
            assertThat(result.productions("S")).containsExactly(Production.of("a"));
        }

        @Test
        void emptyLanguageKeepsOnlyStart() {
            final Grammar result = stage.apply(grammar("S -> a S", "A -> a"));

            assertThat(result.nonTerminals()).containsExactly("S");
            assertThat(result.productions("S")).isEmpty();
        }

        @Test
        void startEpsilonIsUseful() {
            final Grammar input = grammar("S -> ε | A", "A -> a");

            assertThat(stage.apply(input)).isEqualTo(input);
        }
    }

    @Nested
    class TerminalIsolationStage {

        private final GrammarStage stage = new TerminalIsolation();

        @Test
        void replacesTerminalsInLongRules() {
            final Grammar result = stage.apply(grammar("S -> a B | a", "B -> b"));

            assertThat(result.productions("S")).containsExactly(Production.of("T_a", "B"), Production.of("a"));
            assertThat(result.productions("B")).containsExactly(Production.of("b"));
            assertThat(result.productions("T_a")).containsExactly(Production.of("a"));
        }

        @Test
        void oneNonTerminalPerTerminal() {
            final Grammar result = stage.apply(grammar("S -> aSa | b", "A -> a A"));

            assertThat(result.productions("S")).containsExactly(Production.of("T_a", "S", "T_a"), Production.of("b"));
            assertThat(result.productions("A")).containsExactly(Production.of("T_a", "A"));
            assertThat(result.nonTerminals()).containsExactly("S", "A", "T_a");
        }

        @Test
        void avoidsTakenNames() {
            final Grammar result = stage.apply(grammar("S -> a T_a", "T_a -> b"));

            assertThat(result.productions("S")).containsExactly(Production.of("T_a2", "T_a"));
            assertThat(result.productions("T_a")).containsExactly(Production.of("b"));
            assertThat(result.productions("T_a2")).containsExactly(Production.of("a"));
        }
    }

    @Nested
    class BinarizationStage {

        private final GrammarStage stage = new Binarization();

        @Test
        void chainsLongRule() {
            final Grammar result = stage.apply(grammar("S -> ABCD", "A -> a", "B -> b", "C -> c", "D -> d"));

            assertThat(result.productions("S")).containsExactly(Production.of("A", "X1"));
            assertThat(result.productions("X1")).containsExactly(Production.of("B", "X2"));
            assertThat(result.productions("X2")).containsExactly(Production.of("C", "D"));
        }

        @Test
        void freshNamePerChainLink() {
            final Grammar result = stage.apply(grammar("S -> ABC | BCA | AB", "A -> a", "B -> b", "C -> c"));

            assertThat(result.productions("S")).containsExactly(
                    Production.of("A", "X1"), Production.of("B", "X2"), Production.of("A", "B"));
            assertThat(result.productions("X1")).containsExactly(Production.of("B", "C"));
            assertThat(result.productions("X2")).containsExactly(Production.of("C", "A"));
        }

        @Test
        void avoidsTerminalNames() {
            final Grammar input = Grammar.builder()
                    .add("S", Production.of("A", "B", "C"))
                    .add("A", Production.of("X1"))
                    .add("B", Production.of("b"))
                    .add("C", Production.of("c"))
                    .build();
            final Grammar result = stage.apply(input);

            assertThat(result.productions("S")).containsExactly(Production.of("A", "X2"));
            assertThat(result.productions("X2")).containsExactly(Production.of("B", "C"));
            assertThat(result.productions("A")).containsExactly(Production.of("X1"));
        }
    }
}
