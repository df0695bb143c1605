package in.ashwanthkumar.stationarizer;

import in.ashwanthkumar.stationarizer.exception.InputTypeException;
import in.ashwanthkumar.stationarizer.model.ShapeWarning;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import tech.tablesaw.api.NumericColumn;
import tech.tablesaw.api.Table;
import tech.tablesaw.columns.Column;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Checks that a table can be stationarized. Rows are time steps and columns are variables.
 */
@Slf4j
public class TableValidator {

    /**
     * @param table Table to check, it is not modified
     * @return A warning when the table has no more rows than columns
     * @throws InputTypeException when the table is empty or has non-numeric columns
     */
    public Optional<ShapeWarning> validate(@NonNull Table table) {
        int timeSteps = table.rowCount();
        int variables = table.columnCount();
        log.info("Data shape (time, variables) is ({}, {}).", timeSteps, variables);
        if (variables == 0 || timeSteps == 0) {
            throw new InputTypeException(String.format("Input table %s is empty, shape (%d, %d)", table.name(), timeSteps, variables));
        }

        Map<String, String> nonNumeric = new LinkedHashMap<>();
        for (Column<?> column : table.columns()) {
            if (!(column instanceof NumericColumn)) {
                nonNumeric.put(column.name(), column.type().name());
            }
        }
        if (!nonNumeric.isEmpty()) {
            throw new InputTypeException(nonNumeric);
        }

        if (timeSteps <= variables) {
            ShapeWarning warning = ShapeWarning.of(timeSteps, variables);
            log.warn(warning.message());
            return Optional.of(warning);
        }
        log.info("Data orientation is valid.");
        return Optional.empty();
    }
}
