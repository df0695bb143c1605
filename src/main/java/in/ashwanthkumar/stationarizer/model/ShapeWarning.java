package in.ashwanthkumar.stationarizer.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * Raised (but never thrown) when a table has no more rows than columns. Rows are expected to be
 * time steps and columns variables, so either the data is transposed or it has far more
 * variables than samples.
 */
@RequiredArgsConstructor(staticName = "of")
@Getter
@EqualsAndHashCode
@ToString
public class ShapeWarning {
    private final int timeSteps;
    private final int variables;

    public String message() {
        return String.format("Input table has %d rows and %d columns. Columns are expected to represent variables, "
                + "while rows represent time steps, and thus the input table is expected to have more rows than "
                + "columns. Either the input data is inverted, or the data has far more variables than samples.",
                timeSteps, variables);
    }
}
