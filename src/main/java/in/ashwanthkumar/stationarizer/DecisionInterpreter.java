package in.ashwanthkumar.stationarizer;

import com.google.common.base.Preconditions;
import in.ashwanthkumar.stationarizer.model.Conclusion;
import in.ashwanthkumar.stationarizer.model.CorrectedResult;
import in.ashwanthkumar.stationarizer.model.Decision;
import in.ashwanthkumar.stationarizer.model.TestFamily;

/**
 * Turns the corrected outcomes of a series into the transformations it needs. Each test decides
 * one transformation on its own:
 * <ul>
 *     <li>unit root not rejected: difference</li>
 *     <li>trend stationarity not rejected: detrend</li>
 * </ul>
 */
public class DecisionInterpreter {

    public Decision decide(boolean rejectUnitRoot, boolean rejectTrendStationarity) {
        return Decision.of(!rejectUnitRoot, !rejectTrendStationarity);
    }

    public Decision decide(CorrectedResult unitRoot, CorrectedResult trendStationarity) {
        checkFamilies(unitRoot, trendStationarity);
        return decide(unitRoot.isRejectNull(), trendStationarity.isRejectNull());
    }

    public Conclusion conclude(CorrectedResult unitRoot, CorrectedResult trendStationarity) {
        checkFamilies(unitRoot, trendStationarity);
        return Conclusion.of(unitRoot.isRejectNull(), trendStationarity.isRejectNull());
    }

    private static void checkFamilies(CorrectedResult unitRoot, CorrectedResult trendStationarity) {
        Preconditions.checkArgument(unitRoot.getFamily() == TestFamily.UNIT_ROOT, "Expected a unit root result, got %s", unitRoot);
        Preconditions.checkArgument(trendStationarity.getFamily() == TestFamily.TREND_STATIONARITY, "Expected a trend stationarity result, got %s", trendStationarity);
        Preconditions.checkArgument(unitRoot.getColumn().equals(trendStationarity.getColumn()), "Results of %s and %s can't be combined", unitRoot.getColumn(), trendStationarity.getColumn());
    }
}
