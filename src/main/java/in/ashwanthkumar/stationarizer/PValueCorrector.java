package in.ashwanthkumar.stationarizer;

import com.google.common.base.Preconditions;
import in.ashwanthkumar.stationarizer.model.CorrectedResult;
import in.ashwanthkumar.stationarizer.model.PoolingMode;
import in.ashwanthkumar.stationarizer.model.TestFamily;
import in.ashwanthkumar.stationarizer.model.TestResult;
import in.ashwanthkumar.stationarizer.plugins.CorrectionOutcome;
import in.ashwanthkumar.stationarizer.plugins.MultipleTestingCorrection;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Applies the multiple testing correction across all tested series. This is the only step where
 * the result of one series can influence the decision for another.
 */
@Slf4j
@Getter
public class PValueCorrector {
    private final MultipleTestingCorrection correction;
    private final double alpha;
    private final PoolingMode poolingMode;

    public PValueCorrector(MultipleTestingCorrection correction, double alpha, PoolingMode poolingMode) {
        Preconditions.checkArgument(alpha > 0.0 && alpha < 1.0, "alpha must be in (0, 1), got %s", alpha);
        this.correction = Preconditions.checkNotNull(correction, "correction");
        this.alpha = alpha;
        this.poolingMode = Preconditions.checkNotNull(poolingMode, "poolingMode");
    }

    /**
     * @param results Every test result of the run, of both families
     * @return Column -> family -> corrected result, columns in the order they first appear in {@code results}
     */
    public Map<String, Map<TestFamily, CorrectedResult>> correct(List<TestResult> results) {
        log.info("Controlling the error rate using the {} procedure with α={} ({} pooling).", correction.label(), alpha, poolingMode);
        Map<String, Map<TestFamily, CorrectedResult>> corrected = new LinkedHashMap<>();
        for (TestResult result : results) {
            corrected.putIfAbsent(result.getColumn(), new EnumMap<>(TestFamily.class));
        }

        List<List<TestResult>> batches = new ArrayList<>();
        if (poolingMode == PoolingMode.POOLED) {
            List<TestResult> pooled = new ArrayList<>();
            for (TestFamily family : TestFamily.values()) {
                pooled.addAll(ofFamily(results, family));
            }
            batches.add(pooled);
        } else {
            for (TestFamily family : TestFamily.values()) {
                batches.add(ofFamily(results, family));
            }
        }

        for (List<TestResult> batch : batches) {
            double[] pValues = batch.stream().mapToDouble(TestResult::getPValue).toArray();
            CorrectionOutcome outcome = correction.correct(pValues, alpha);
            Preconditions.checkState(outcome.size() == pValues.length, "%s returned %s decisions for %s p-values", correction.label(), outcome.size(), pValues.length);
            for (int i = 0; i < batch.size(); i++) {
                TestResult result = batch.get(i);
                CorrectedResult correctedResult = CorrectedResult.of(result.getColumn(), result.getFamily(), result.getPValue(),
                        outcome.adjustedPValue(i), outcome.isRejected(i));
                Map<TestFamily, CorrectedResult> byFamily = corrected.get(result.getColumn());
                Preconditions.checkArgument(byFamily.put(result.getFamily(), correctedResult) == null,
                        "Column %s has more than one %s result", result.getColumn(), result.getFamily());
            }
        }
        return corrected;
    }

    private static List<TestResult> ofFamily(List<TestResult> results, TestFamily family) {
        List<TestResult> ofFamily = new ArrayList<>();
        for (TestResult result : results) {
            if (result.getFamily() == family) {
                ofFamily.add(result);
            }
        }
        return ofFamily;
    }
}
