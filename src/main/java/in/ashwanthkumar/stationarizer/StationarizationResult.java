package in.ashwanthkumar.stationarizer;

import in.ashwanthkumar.stationarizer.model.ColumnReport;
import in.ashwanthkumar.stationarizer.model.Conclusion;
import in.ashwanthkumar.stationarizer.model.ShapeWarning;
import in.ashwanthkumar.stationarizer.model.Transformation;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import tech.tablesaw.api.Table;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

@RequiredArgsConstructor
@Getter
public class StationarizationResult {
    // stationarized table, every column has the same length
    private final Table table;
    // one per input column, in the input order
    private final List<ColumnReport> reports;
    private final List<ShapeWarning> warnings;

    public ColumnReport report(String column) {
        return reports.stream()
                .filter(report -> report.getColumn().equals(column))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("No column named " + column));
    }

    /**
     * @return Column -> conclusion, skipped columns are left out
     */
    public Map<String, Conclusion> conclusions() {
        Map<String, Conclusion> conclusions = new LinkedHashMap<>();
        for (ColumnReport report : reports) {
            report.conclusion().ifPresent(conclusion -> conclusions.put(report.getColumn(), conclusion));
        }
        return conclusions;
    }

    /**
     * @return Column -> transformations applied to it
     */
    public Map<String, Set<Transformation>> actions() {
        Map<String, Set<Transformation>> actions = new LinkedHashMap<>();
        for (ColumnReport report : reports) {
            actions.put(report.getColumn(), report.actions());
        }
        return actions;
    }
}
