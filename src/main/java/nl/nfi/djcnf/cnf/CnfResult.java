package nl.nfi.djcnf.cnf;

import nl.nfi.djcnf.grammar.Grammar;

import java.util.List;

public record CnfResult(Grammar grammar, List<TransformationStep> steps) {

    public CnfResult {
        steps = List.copyOf(steps);
    }

    // the start symbol introduced by the pipeline
    public String start() {
        return grammar.start();
    }

    public String formatted() {
        return steps.get(steps.size() - 1).snapshot();
    }
}
