package com.openworkout.owf.ast;

/** Exhaustive dispatch over the step family; a new step kind adds a method here. */
public interface StepVisitor<R> {
    R visitEndurance(EnduranceStep step);

    R visitStrength(StrengthStep step);

    R visitRest(RestStep step);

    R visitInclude(IncludeStep step);

    R visitRepeat(RepeatStep step);

    R visitSuperset(SupersetStep step);

    R visitCircuit(CircuitStep step);

    R visitEmom(EmomStep step);

    R visitAlternatingEmom(AlternatingEmomStep step);

    R visitCustomInterval(CustomIntervalStep step);

    R visitAmrap(AmrapStep step);

    R visitForTime(ForTimeStep step);
}
