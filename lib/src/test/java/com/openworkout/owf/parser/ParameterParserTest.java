package com.openworkout.owf.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.openworkout.owf.Owf;
import com.openworkout.owf.ast.BinaryOperation;
import com.openworkout.owf.ast.HeartRateParameter;
import com.openworkout.owf.ast.IntensityParameter;
import com.openworkout.owf.ast.PaceParameter;
import com.openworkout.owf.ast.Parameter;
import com.openworkout.owf.ast.PercentageOf;
import com.openworkout.owf.ast.PowerParameter;
import com.openworkout.owf.ast.RirParameter;
import com.openworkout.owf.ast.RpeParameter;
import com.openworkout.owf.ast.VariableReference;
import com.openworkout.owf.ast.WeightParameter;
import java.util.List;
import org.junit.jupiter.api.Test;

final class ParameterParserTest {

    private static List<Parameter> parameters(String step) throws OwfParseException {
        return Owf.parse("- " + step).getEntries().get(0).getSteps().get(0).getParameters();
    }

    private static Parameter single(String step) throws OwfParseException {
        List<Parameter> parameters = parameters(step);
        assertEquals(1, parameters.size());
        return parameters.get(0);
    }

    @Test
    void parsesPaceWithAndWithoutPrefix() throws Exception {
        PaceParameter pace = assertInstanceOf(PaceParameter.class, single("run 10km @4:30/km"));
        assertEquals("4:30/km", pace.getPace().toString());
        PaceParameter prefixed = assertInstanceOf(PaceParameter.class, single("row 2km @pace: 1:55/500m"));
        assertEquals("500m", prefixed.getPace().getUnit());
        assertThrows(OwfParseException.class, () -> single("run 1km @pace:fast"));
    }

    @Test
    void parsesIntensityRpeRirAndZone() throws Exception {
        assertEquals("tempo", assertInstanceOf(IntensityParameter.class, single("run 5km @Tempo")).getName());
        assertEquals("7.5", assertInstanceOf(RpeParameter.class, single("squat 5 @RPE 7.5")).getValue().toPlainString());
        assertEquals("8", assertInstanceOf(RpeParameter.class, single("squat 5 @rpe8")).getValue().toPlainString());
        assertEquals(2, assertInstanceOf(RirParameter.class, single("squat 5 @RIR 2")).getValue());
        HeartRateParameter zone = assertInstanceOf(HeartRateParameter.class, single("run 30min @z2"));
        assertTrue(zone.isZone());
        assertEquals("Z2", zone.getZone());
    }

    @Test
    void typesLiteralsByUnit() throws Exception {
        assertInstanceOf(PowerParameter.class, single("bike 5min @200W"));
        assertInstanceOf(WeightParameter.class, single("squat 5 @100kg"));
        assertInstanceOf(WeightParameter.class, single("squat 5 @225lbs"));
        assertInstanceOf(HeartRateParameter.class, single("run 5km @150bpm"));
        assertInstanceOf(WeightParameter.class, single("box jump 10 @24in"));
        assertInstanceOf(PowerParameter.class, single("bike 5min @250"));
    }

    @Test
    void typesPercentagesByBase() throws Exception {
        PowerParameter ftp = assertInstanceOf(PowerParameter.class, single("bike 5min @95% of FTP"));
        PercentageOf percentage = assertInstanceOf(PercentageOf.class, ftp.getValue());
        assertEquals("95", percentage.getPercentage().toPlainString());
        assertInstanceOf(HeartRateParameter.class, single("run 5km @70% of max HR"));
        assertInstanceOf(HeartRateParameter.class, single("run 5km @70% of 180bpm"));
        assertInstanceOf(PowerParameter.class, single("bike 5min @90% of 300W"));
        assertInstanceOf(WeightParameter.class, single("bench press 3x8 @80% of 1RM bench press"));
    }

    @Test
    void typesBinaryOperationsByLeaves() throws Exception {
        assertInstanceOf(WeightParameter.class, single("weighted pull-up 5 @bodyweight + 20kg"));
        assertInstanceOf(PowerParameter.class, single("bike 5min @FTP - 20W"));
        assertInstanceOf(HeartRateParameter.class, single("run 5km @resting + 60bpm"));
        assertInstanceOf(PowerParameter.class, single("bike 5min @CP - offset"));
        assertInstanceOf(WeightParameter.class, single("squat 5 @training max - 10"));
    }

    @Test
    void typesBareVariables() throws Exception {
        assertInstanceOf(PowerParameter.class, single("bike 20min @FTP"));
        assertInstanceOf(HeartRateParameter.class, single("run 20min @threshold heart rate"));
    }

    @Test
    void keepsParameterOrderAndLocations() throws Exception {
        List<Parameter> parameters = parameters("run 5km @4:30/km @Z2 @RPE 6");
        assertInstanceOf(PaceParameter.class, parameters.get(0));
        assertInstanceOf(HeartRateParameter.class, parameters.get(1));
        assertInstanceOf(RpeParameter.class, parameters.get(2));
        assertEquals(11, parameters.get(0).getLocation().getColumn());
        assertEquals(20, parameters.get(1).getLocation().getColumn());
    }

    @Test
    void rejectsEmptyParameter() {
        assertThrows(OwfParseException.class, () -> single("run 5km @"));
    }

    @Test
    void oversizedPaceIsAParseError() {
        OwfParseException ex =
                assertThrows(OwfParseException.class, () -> single("run 5km @99999999999:00/km"));
        assertTrue(ex.getReason().startsWith("Invalid pace '99999999999:00/km'"));
    }

    @Test
    void gluedOperatorsSplitIntoBinaryOperations() throws Exception {
        WeightParameter plus = assertInstanceOf(WeightParameter.class, single("dip 3x8 @bodyweight+20kg"));
        BinaryOperation sum = assertInstanceOf(BinaryOperation.class, plus.getValue());
        assertEquals(BinaryOperation.Operator.PLUS, sum.getOperator());
        assertEquals("bodyweight", assertInstanceOf(VariableReference.class, sum.getLeft()).getName());

        WeightParameter minus = assertInstanceOf(WeightParameter.class, single("dip 3x8 @bodyweight-20kg"));
        BinaryOperation difference = assertInstanceOf(BinaryOperation.class, minus.getValue());
        assertEquals(BinaryOperation.Operator.MINUS, difference.getOperator());
        assertEquals("20kg", difference.getRight().toString());
    }
}
