package in.ashwanthkumar.stationarizer.exception;

import lombok.Getter;

/**
 * Raised when the configured multiple testing correction method is not recognised.
 */
@Getter
public class CorrectionMethodException extends StationarizerException {
    private final String method;

    public CorrectionMethodException(String method, String supported) {
        super(String.format("Unknown multiple testing correction method '%s', supported methods are: %s", method, supported));
        this.method = method;
    }
}
