package in.ashwanthkumar.stationarizer.exception;

/**
 * Base type for every fatal failure of a stationarization run. When one of these is thrown no
 * output table is produced.
 */
public abstract class StationarizerException extends RuntimeException {

    protected StationarizerException(String message) {
        super(message);
    }

    protected StationarizerException(String message, Throwable cause) {
        super(message, cause);
    }
}
