package in.ashwanthkumar.stationarizer;

import com.google.common.base.Preconditions;
import in.ashwanthkumar.stationarizer.io.DataImporter;
import in.ashwanthkumar.stationarizer.io.DataWriter;
import in.ashwanthkumar.stationarizer.model.ColumnReport;
import in.ashwanthkumar.stationarizer.plugins.DropColumnsTransformation;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import tech.tablesaw.api.Table;

import java.io.File;
import java.io.IOException;
import java.util.Arrays;

/**
 * Stationarizes a CSV file.
 * <pre>
 *     StationarizeApp input.csv output.(csv|arrow) [index columns to drop...]
 * </pre>
 * Options are read from {@code -Dstationarizer.*} system properties, see {@link StationarizerConfig}.
 * Writing Arrow files on JDK 17 needs {@code --add-opens=java.base/java.nio=ALL-UNNAMED}.
 */
@Slf4j
public class StationarizeApp {

    public static void main(String[] args) throws IOException {
        Preconditions.checkArgument(args.length >= 2, "Usage: StationarizeApp <input.csv> <output.csv|output.arrow> [index columns...]");
        String input = args[0];
        File outputFile = new File(args[1]);

        DropColumnsTransformation dropIndexColumns = new DropColumnsTransformation(Arrays.copyOfRange(args, 2, args.length));
        Table table = DataImporter.fromCsv(input, dropIndexColumns).getTable();

        StationarizerConfig config = StationarizerConfig.fromProperties(System.getProperties());
        log.info("Stationarizing {} with {}", input, config);
        StationarizationResult result = new Stationarizer(config).analyze(table);
        for (ColumnReport report : result.getReports()) {
            log.info("{}: {} -> {}", report.getColumn(),
                    report.isSkipped() ? "skipped" : report.getConclusion(), report.actions());
        }

        // create the output directory if not exists
        if (outputFile.getAbsoluteFile().getParentFile() != null) {
            outputFile.getAbsoluteFile().getParentFile().mkdirs();
        }
        if (StringUtils.endsWithIgnoreCase(outputFile.getName(), ".arrow")) {
            new DataWriter(result.getTable(), outputFile).write();
        } else {
            result.getTable().write().csv(outputFile);
        }
        log.info("Wrote {} rows x {} columns to {}", result.getTable().rowCount(), result.getTable().columnCount(), outputFile);
    }
}
