package in.ashwanthkumar.stationarizer.plugins;

import lombok.extern.slf4j.Slf4j;
import tech.tablesaw.api.Table;

import java.util.List;

/**
 * Removes the columns that index the rows (dates, timestamps, row numbers) so that only the
 * series remain. Columns that are not present are ignored.
 */
@Slf4j
public class DropColumnsTransformation implements TableTransformation {
    private final List<String> columnsToDrop;

    public DropColumnsTransformation(List<String> columnsToDrop) {
        this.columnsToDrop = List.copyOf(columnsToDrop);
    }

    public DropColumnsTransformation(String... columnsToDrop) {
        this(List.of(columnsToDrop));
    }

    @Override
    public Table transform(Table table) {
        Table copy = table.copy();
        for (String column : columnsToDrop) {
            if (copy.containsColumn(column)) {
                copy.removeColumns(column);
            } else {
                log.warn("Column {} is not present in {}, nothing to drop", column, table.name());
            }
        }
        return copy;
    }
}
