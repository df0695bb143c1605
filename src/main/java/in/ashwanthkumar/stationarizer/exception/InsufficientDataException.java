package in.ashwanthkumar.stationarizer.exception;

import lombok.Getter;

/**
 * Raised by a test when a series is too short or degenerate (constant, non-finite) to produce a
 * statistic.
 */
@Getter
public class InsufficientDataException extends StationarizerException {
    private final String column;

    public InsufficientDataException(String column, String reason) {
        super(String.format("Column '%s' cannot be tested: %s", column, reason));
        this.column = column;
    }

    public InsufficientDataException(String column, String reason, Throwable cause) {
        super(String.format("Column '%s' cannot be tested: %s", column, reason), cause);
        this.column = column;
    }
}
