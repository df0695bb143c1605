package in.ashwanthkumar.stationarizer;

import com.google.common.base.Preconditions;
import in.ashwanthkumar.stationarizer.model.TestFamily;
import in.ashwanthkumar.stationarizer.model.TestResult;
import in.ashwanthkumar.stationarizer.plugins.TrendStationarityTest;
import in.ashwanthkumar.stationarizer.plugins.UnitRootTest;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.EnumMap;
import java.util.Map;

/**
 * Runs both stationarity tests on a series.
 */
@Slf4j
@Getter
@RequiredArgsConstructor
public class StationarityTestRunner {
    private final UnitRootTest unitRootTest;
    private final TrendStationarityTest trendStationarityTest;

    /**
     * @return One result per {@link TestFamily}
     * @throws in.ashwanthkumar.stationarizer.exception.InsufficientDataException when either test cannot run on the series
     */
    public Map<TestFamily, TestResult> run(String column, double[] series) {
        TestResult unitRoot = unitRootTest.test(column, series);
        Preconditions.checkState(unitRoot.getFamily() == TestFamily.UNIT_ROOT, "%s returned a %s result", unitRootTest, unitRoot.getFamily());
        log.info("{}: ADF test statistic={}, p-val={}.", column, unitRoot.getStatistic(), unitRoot.getPValue());

        TestResult trendStationarity = trendStationarityTest.test(column, series);
        Preconditions.checkState(trendStationarity.getFamily() == TestFamily.TREND_STATIONARITY, "%s returned a %s result", trendStationarityTest, trendStationarity.getFamily());
        log.info("{}: KPSS test statistic={}, p-val={}.", column, trendStationarity.getStatistic(), trendStationarity.getPValue());

        Map<TestFamily, TestResult> results = new EnumMap<>(TestFamily.class);
        results.put(TestFamily.UNIT_ROOT, unitRoot);
        results.put(TestFamily.TREND_STATIONARITY, trendStationarity);
        return results;
    }
}
