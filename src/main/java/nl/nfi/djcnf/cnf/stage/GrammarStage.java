package nl.nfi.djcnf.cnf.stage;

import nl.nfi.djcnf.grammar.Grammar;

// one rewrite of the CNF pipeline, returns a new grammar generating the same language
public interface GrammarStage {

    String title();

    Grammar apply(Grammar grammar);
}
