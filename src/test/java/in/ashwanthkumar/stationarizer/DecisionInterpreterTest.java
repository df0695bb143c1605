package in.ashwanthkumar.stationarizer;

import in.ashwanthkumar.stationarizer.model.Conclusion;
import in.ashwanthkumar.stationarizer.model.CorrectedResult;
import in.ashwanthkumar.stationarizer.model.Decision;
import in.ashwanthkumar.stationarizer.model.TestFamily;
import in.ashwanthkumar.stationarizer.model.Transformation;
import org.junit.Test;

import java.util.EnumSet;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

public class DecisionInterpreterTest {
    private final DecisionInterpreter interpreter = new DecisionInterpreter();

    @Test
    public void testEachRejectionDecidesOneTransformation() {
        assertThat(interpreter.decide(false, false), is(Decision.of(true, true)));
        assertThat(interpreter.decide(false, true), is(Decision.of(true, false)));
        assertThat(interpreter.decide(true, false), is(Decision.of(false, true)));
        assertThat(interpreter.decide(true, true), is(Decision.NONE));
    }

    @Test
    public void testDetrendingComesBeforeDifferencing() {
        assertThat(interpreter.decide(false, false).transformations(),
                is(EnumSet.of(Transformation.DETREND, Transformation.DIFFERENCE)));
        assertThat(Decision.NONE.transformations().isEmpty(), is(true));
    }

    @Test
    public void testConclusions() {
        assertThat(interpreter.conclude(unitRoot("a", true), trendStationarity("a", true)), is(Conclusion.CONTRADICTION));
        assertThat(interpreter.conclude(unitRoot("a", true), trendStationarity("a", false)), is(Conclusion.TREND_STATIONARY));
        assertThat(interpreter.conclude(unitRoot("a", false), trendStationarity("a", true)), is(Conclusion.UNIT_ROOT));
        assertThat(interpreter.conclude(unitRoot("a", false), trendStationarity("a", false)), is(Conclusion.NO_REJECTION));
    }

    @Test
    public void testDecisionFromCorrectedResults() {
        Decision decision = interpreter.decide(unitRoot("a", false), trendStationarity("a", true));
        assertThat(decision.isDifference(), is(true));
        assertThat(decision.isDetrend(), is(false));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testSwappedFamiliesAreRejected() {
        interpreter.decide(trendStationarity("a", true), unitRoot("a", true));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testResultsOfDifferentColumnsAreRejected() {
        interpreter.conclude(unitRoot("a", true), trendStationarity("b", true));
    }

    private static CorrectedResult unitRoot(String column, boolean reject) {
        return CorrectedResult.of(column, TestFamily.UNIT_ROOT, 0.01, 0.02, reject);
    }

    private static CorrectedResult trendStationarity(String column, boolean reject) {
        return CorrectedResult.of(column, TestFamily.TREND_STATIONARITY, 0.01, 0.02, reject);
    }
}
