package com.standallocator.solver.engine.timefold;

import ai.timefold.solver.core.api.score.buildin.hardsoft.HardSoftScore;
import ai.timefold.solver.core.api.score.stream.Constraint;
import ai.timefold.solver.core.api.score.stream.ConstraintCollectors;
import ai.timefold.solver.core.api.score.stream.ConstraintFactory;
import ai.timefold.solver.core.api.score.stream.ConstraintProvider;
import ai.timefold.solver.core.api.score.stream.Joiners;

/**
 * Hard constraints of a recorded solver-adapter model.
 *
 * HARD only:
 * - exactly one present literal per exactly-one group
 * - no two present literals whose intervals overlap within a no-overlap group
 */
public class PresenceConstraintProvider implements ConstraintProvider {

    @Override
    public Constraint[] defineConstraints(ConstraintFactory factory) {
        return new Constraint[] {
            exactlyOnePresent(factory),
            noOverlapBetweenLiterals(factory),
            noOverlapWithinLiteral(factory),
        };
    }

    /**
     * Penalises each group by how far its present count is from one.
     */
    Constraint exactlyOnePresent(ConstraintFactory factory) {
        return factory.forEach(ExactlyOneGroup.class)
            .join(PresenceLiteral.class,
                Joiners.filtering((group, literal) -> group.contains(literal)))
            .groupBy((group, literal) -> group,
                ConstraintCollectors.sum((group, literal) -> literal.isPresent() ? 1 : 0))
            .filter((group, presentCount) -> presentCount != 1)
            .penalize(HardSoftScore.ONE_HARD,
                (group, presentCount) -> Math.abs(presentCount - 1))
            .asConstraint("Exactly one present");
    }

    Constraint noOverlapBetweenLiterals(ConstraintFactory factory) {
        return factory.forEach(PresenceLiteral.class)
            .filter(PresenceLiteral::isPresent)
            .join(factory.forEach(PresenceLiteral.class).filter(PresenceLiteral::isPresent),
                Joiners.lessThan(PresenceLiteral::getIndex),
                Joiners.filtering(PresenceLiteral::overlapsWith))
            .penalize(HardSoftScore.ONE_HARD, PresenceLiteral::countOverlaps)
            .asConstraint("No overlap");
    }

    Constraint noOverlapWithinLiteral(ConstraintFactory factory) {
        return factory.forEach(PresenceLiteral.class)
            .filter(PresenceLiteral::isPresent)
            .filter(literal -> literal.countSelfOverlaps() > 0)
            .penalize(HardSoftScore.ONE_HARD, PresenceLiteral::countSelfOverlaps)
            .asConstraint("No overlap within one literal");
    }
}
