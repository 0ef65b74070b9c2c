package nl.nfi.djcnf.cnf;

import nl.nfi.djcnf.cnf.stage.Binarization;
import nl.nfi.djcnf.cnf.stage.EpsilonElimination;
import nl.nfi.djcnf.cnf.stage.GrammarStage;
import nl.nfi.djcnf.cnf.stage.StartIsolation;
import nl.nfi.djcnf.cnf.stage.TerminalIsolation;
import nl.nfi.djcnf.cnf.stage.UnitElimination;
import nl.nfi.djcnf.cnf.stage.UselessSymbolElimination;
import nl.nfi.djcnf.common.Timers.TimedResult;
import nl.nfi.djcnf.grammar.Grammar;
import nl.nfi.djcnf.grammar.GrammarFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static nl.nfi.djcnf.common.Timers.time;

/**
 * Converts a grammar to strict Chomsky Normal Form. The stages run in a fixed order, each
 * one recorded as a {@link TransformationStep}; the last step repeats the final grammar
 * under the title {@value #CNF_TITLE}.
 */
public final class CnfPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(CnfPipeline.class);

    public static final String CNF_TITLE = "Chomsky Normal Form";

    private final List<GrammarStage> stages;

    private CnfPipeline(final List<GrammarStage> stages) {
        this.stages = stages;
    }

    public static CnfPipeline standard() {
        return new CnfPipeline(List.of(
                new StartIsolation(),
                new EpsilonElimination(),
                new UnitElimination(),
                new UselessSymbolElimination(),
                new TerminalIsolation(),
                new Binarization()
        ));
    }

    public static CnfResult toCnf(final Grammar grammar) {
        return standard().apply(grammar);
    }

    public List<GrammarStage> stages() {
        return stages;
    }

    public CnfResult apply(final Grammar grammar) {
        LOG.debug("Converting grammar: {} nonterminals, {} productions", grammar.nonTerminals().size(), grammar.productionCount());

        final List<TransformationStep> steps = new ArrayList<>();
        Grammar current = grammar;
        for (final GrammarStage stage : stages) {
            final Grammar input = current;
            final TimedResult<Grammar> result = time(() -> stage.apply(input));
            current = result.value();

            LOG.debug("{}: {} nonterminals, {} productions in {} ms",
                    stage.title(), current.nonTerminals().size(), current.productionCount(), result.duration().toMillis());
            steps.add(new TransformationStep(stage.title(), GrammarFormatter.format(current)));
        }
        steps.add(new TransformationStep(CNF_TITLE, GrammarFormatter.format(current)));

        return new CnfResult(current, steps);
    }
}
