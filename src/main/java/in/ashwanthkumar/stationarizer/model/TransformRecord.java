package in.ashwanthkumar.stationarizer.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;
import lombok.With;

import java.util.Set;

/**
 * What was done to a series and how long it is at each step. The reconciler fills in the
 * trimmed count once every series has been transformed.
 */
@RequiredArgsConstructor(staticName = "of")
@Getter
@EqualsAndHashCode
@ToString
public class TransformRecord {
    private final String column;
    private final Set<Transformation> applied;
    private final int originalLength;
    // length right after detrending / differencing
    private final int transformedLength;
    // leading observations dropped to align with the shortest series
    @With
    private final int trimmed;

    public boolean wasDifferenced() {
        return applied.contains(Transformation.DIFFERENCE);
    }

    public int finalLength() {
        return transformedLength - trimmed;
    }
}
