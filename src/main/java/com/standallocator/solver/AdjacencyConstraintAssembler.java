package com.standallocator.solver;

import com.standallocator.domain.AdjacencyRule;
import com.standallocator.domain.ConfigurationException;
import com.standallocator.domain.TimeWindowDefinition;
import com.standallocator.solver.engine.OptionalInterval;
import com.standallocator.solver.engine.SolverAdapter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns adjacency rules into no-overlap constraints over shadow intervals.
 *
 * For each rule every candidate on stand A gets a shadow interval from window
 * A and every candidate on stand B one from window B, gated by the candidate's
 * presence variable. All shadows of a rule form a single no-overlap
 * constraint. A rule without candidates on either side adds nothing.
 *
 * When a rule names the same stand on both sides only window A applies.
 */
public class AdjacencyConstraintAssembler {

    private static final Logger log = LoggerFactory.getLogger(AdjacencyConstraintAssembler.class);

    /**
     * Derives every shadow window first and declares intervals only once all
     * rules resolved, so a malformed window leaves the adapter untouched.
     *
     * @return the shadow intervals declared, in rule order
     * @throws ConfigurationException if a rule names a stand outside the problem or a window
     *                                ends before it starts for some turn
     */
    public List<ShadowInterval> assemble(List<AdjacencyRule> rules, AssignmentVariables variables,
                                         SolverAdapter adapter) {
        List<List<PendingShadow>> pendingByRule = new ArrayList<>();
        for (AdjacencyRule rule : rules) {
            requireKnownStand(rule, rule.getStandA(), variables);
            requireKnownStand(rule, rule.getStandB(), variables);
            pendingByRule.add(deriveShadows(rule, variables));
        }

        List<ShadowInterval> shadows = new ArrayList<>();
        int constraints = 0;
        for (int r = 0; r < rules.size(); r++) {
            AdjacencyRule rule = rules.get(r);
            List<PendingShadow> pending = pendingByRule.get(r);
            if (pending.isEmpty()) {
                log.debug("Adjacency rule {} has no candidates on {} or {}, inactive",
                    rule.getName(), rule.getStandA(), rule.getStandB());
                continue;
            }

            List<OptionalInterval> group = new ArrayList<>();
            for (PendingShadow p : pending) {
                AssignmentCandidate candidate = p.candidate;
                OptionalInterval interval = adapter.newOptionalInterval(
                    p.span.getStart(),
                    p.span.getLength(),
                    p.span.getEnd(),
                    candidate.getPresence(),
                    "Shadow_" + rule.getName() + "_" + candidate.getTurn().getKey() + "_"
                        + candidate.getStand().getStandId());
                group.add(interval);
                shadows.add(new ShadowInterval(rule, p.side, candidate, p.span, interval));
            }
            adapter.addNoOverlap(group);
            constraints++;
        }

        log.debug("Added {} adjacency no-overlap constraints over {} shadow intervals ({} rules)",
            constraints, shadows.size(), rules.size());
        return shadows;
    }

    private List<PendingShadow> deriveShadows(AdjacencyRule rule, AssignmentVariables variables) {
        List<PendingShadow> pending = new ArrayList<>();
        for (AssignmentCandidate candidate : variables.getCandidates()) {
            ShadowInterval.Side side;
            TimeWindowDefinition window;
            if (candidate.isOn(rule.getStandA())) {
                side = ShadowInterval.Side.A;
                window = rule.getTimeConstraintA();
            } else if (candidate.isOn(rule.getStandB())) {
                side = ShadowInterval.Side.B;
                window = rule.getTimeConstraintB();
            } else {
                continue;
            }
            try {
                pending.add(new PendingShadow(candidate, side,
                    ShadowIntervalCalculator.compute(candidate.getTurn(), window)));
            } catch (ConfigurationException e) {
                throw new ConfigurationException("Adjacency rule " + rule.getRuleId() + " side " + side
                    + " (" + candidate.getStand().getStandId() + "): " + e.getMessage(), e);
            }
        }
        return pending;
    }

    private static void requireKnownStand(AdjacencyRule rule, String standId, AssignmentVariables variables) {
        if (!variables.hasStand(standId)) {
            throw new ConfigurationException("Adjacency rule " + rule.getRuleId()
                + " references unknown stand " + standId);
        }
    }

    private static final class PendingShadow {
        private final AssignmentCandidate candidate;
        private final ShadowInterval.Side side;
        private final TimeSpan span;

        private PendingShadow(AssignmentCandidate candidate, ShadowInterval.Side side, TimeSpan span) {
            this.candidate = candidate;
            this.side = side;
            this.span = span;
        }
    }
}
