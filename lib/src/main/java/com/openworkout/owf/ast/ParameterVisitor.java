package com.openworkout.owf.ast;

public interface ParameterVisitor<R> {
    R visitPace(PaceParameter parameter);

    R visitPower(PowerParameter parameter);

    R visitWeight(WeightParameter parameter);

    R visitHeartRate(HeartRateParameter parameter);

    R visitRpe(RpeParameter parameter);

    R visitRir(RirParameter parameter);

    R visitIntensity(IntensityParameter parameter);
}
