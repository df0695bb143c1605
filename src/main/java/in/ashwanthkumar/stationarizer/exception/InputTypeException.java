package in.ashwanthkumar.stationarizer.exception;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Raised when the input table cannot be analysed at all: it is empty or some of its columns are
 * not numeric.
 */
@Getter
public class InputTypeException extends StationarizerException {
    // offending column name -> its column type
    private final Map<String, String> offendingColumns;

    public InputTypeException(Map<String, String> offendingColumns) {
        super("All columns of the input table must be numeric, found non-numeric columns: " + offendingColumns);
        this.offendingColumns = Collections.unmodifiableMap(new LinkedHashMap<>(offendingColumns));
    }

    public InputTypeException(String message) {
        super(message);
        this.offendingColumns = Map.of();
    }

    public List<String> getOffendingColumnNames() {
        return List.copyOf(offendingColumns.keySet());
    }
}
