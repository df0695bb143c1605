package in.ashwanthkumar.stationarizer.io;

import in.ashwanthkumar.stationarizer.plugins.TableTransformation;
import lombok.extern.slf4j.Slf4j;
import tech.tablesaw.api.Table;

@Slf4j
public class DataImporter {
    // Treated as immutable once imported, the stationarizer never writes to its input
    private final Table table;

    public DataImporter(Table table, TableTransformation transformation) {
        // we store a copy in our reference, so we're not affected by any lingering references held elsewhere
        this.table = transformation.transform(table).copy();
    }

    public static DataImporter fromCsv(String path, TableTransformation transformation) {
        log.info("Loading the file {}", path);
        Table t = Table.read().file(path);
        return new DataImporter(t, transformation);
    }

    public Table getTable() {
        return table;
    }
}
