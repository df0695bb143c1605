package in.ashwanthkumar.stationarizer.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * A test result after the multiple testing correction was applied to its batch.
 */
@RequiredArgsConstructor(staticName = "of")
@Getter
@EqualsAndHashCode
@ToString
public class CorrectedResult {
    private final String column;
    private final TestFamily family;
    private final double rawPValue;
    private final double adjustedPValue;
    private final boolean rejectNull;
}
