package in.ashwanthkumar.stationarizer.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;
import lombok.With;

import java.util.Optional;
import java.util.Set;

/**
 * Everything the pipeline learnt and did for a single column. Test and correction fields are null
 * for a column that was skipped because it could not be tested.
 */
@RequiredArgsConstructor(staticName = "of")
@Getter
@EqualsAndHashCode
@ToString
public class ColumnReport {
    private final String column;
    private final TestResult unitRoot;
    private final TestResult trendStationarity;
    private final CorrectedResult correctedUnitRoot;
    private final CorrectedResult correctedTrendStationarity;
    private final Decision decision;
    private final Conclusion conclusion;
    @With
    private final TransformRecord record;
    // reason the column was not tested, if it was not
    private final String skipReason;

    public static ColumnReport skipped(String column, String reason) {
        return ColumnReport.of(column, null, null, null, null, Decision.NONE, null, null, reason);
    }

    public boolean isSkipped() {
        return skipReason != null;
    }

    public Optional<Conclusion> conclusion() {
        return Optional.ofNullable(conclusion);
    }

    public Set<Transformation> actions() {
        return decision.transformations();
    }
}
