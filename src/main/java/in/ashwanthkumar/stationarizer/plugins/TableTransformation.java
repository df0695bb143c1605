package in.ashwanthkumar.stationarizer.plugins;

import tech.tablesaw.api.Table;

public interface TableTransformation {
    TableTransformation IDENTITY = table -> table;

    /**
     * Transform the parsed Table
     *
     * @param input Table that is parsed from the CSV
     * @return Table that has only the numeric series that need to be stationarized
     */
    Table transform(Table input);
}
