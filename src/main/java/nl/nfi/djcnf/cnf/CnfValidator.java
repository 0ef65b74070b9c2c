package nl.nfi.djcnf.cnf;

import nl.nfi.djcnf.grammar.Grammar;
import nl.nfi.djcnf.grammar.Production;
import nl.nfi.djcnf.grammar.UndefinedStartException;

import java.util.ArrayList;
import java.util.List;

import static nl.nfi.djcnf.grammar.Symbols.ARROW;

// strict CNF: A → a, A → B C, and only for the start symbol S → ε
public final class CnfValidator {

    private CnfValidator() {
    }

    public static boolean isStrictCnf(final Grammar grammar) {
        return isStrictCnf(grammar, grammar.start());
    }

    public static boolean isStrictCnf(final Grammar grammar, final String start) {
        return violations(grammar, start).isEmpty();
    }

    public static List<String> violations(final Grammar grammar, final String start) {
        UndefinedStartException.requireDeclared(grammar, start);

        final List<String> violations = new ArrayList<>();
        for (final String nonTerminal : grammar.nonTerminals()) {
            for (final Production production : grammar.productions(nonTerminal)) {
                final String rule = nonTerminal + " " + ARROW + " " + production;
                if (production.isEpsilon()) {
                    if (!nonTerminal.equals(start)) {
                        violations.add("ε-production of a nonterminal other than the start symbol: " + rule);
                    }
                } else if (production.size() == 1) {
                    if (!grammar.isTerminal(production.symbolAt(0))) {
                        violations.add("unit production: " + rule);
                    }
                } else if (production.size() == 2) {
                    if (!grammar.isNonTerminal(production.symbolAt(0)) || !grammar.isNonTerminal(production.symbolAt(1))) {
                        violations.add("terminal in a binary production: " + rule);
                    }
                } else {
                    violations.add("production longer than two symbols: " + rule);
                }
            }
        }
        return violations;
    }
}
