package in.ashwanthkumar.stationarizer.plugins;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor(staticName = "of")
@Getter
public class CorrectionOutcome {
    // reject H0 at the requested level, one per input p-value
    private final boolean[] rejected;
    private final double[] adjustedPValues;

    public int size() {
        return rejected.length;
    }

    public boolean isRejected(int i) {
        return rejected[i];
    }

    public double adjustedPValue(int i) {
        return adjustedPValues[i];
    }
}
