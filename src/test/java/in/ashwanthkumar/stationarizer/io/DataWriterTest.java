package in.ashwanthkumar.stationarizer.io;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import tech.tablesaw.api.DoubleColumn;
import tech.tablesaw.api.IntColumn;
import tech.tablesaw.api.StringColumn;
import tech.tablesaw.api.Table;

import java.io.File;
import java.io.IOException;
import java.util.List;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

public class DataWriterTest {
    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void testWriteAndReadBack() throws IOException {
        Table table = Table.create("series",
                DoubleColumn.create("price", 101.25, Double.NaN, 99.5),
                IntColumn.create("volume", 10, 20, 30));
        File output = folder.newFile("series.arrow");

        new DataWriter(table, output).write();
        Table read = new DataReader(output).read();

        assertThat(read.name(), is("series.arrow"));
        assertThat(read.columnNames(), is(List.of("price", "volume")));
        assertThat(read.rowCount(), is(3));
        assertThat(read.doubleColumn("price").get(0), is(101.25));
        assertThat(read.doubleColumn("price").isMissing(1), is(true));
        assertThat(read.doubleColumn("price").get(2), is(99.5));
        // volumes are widened to float64
        assertThat(read.doubleColumn("volume").get(1), is(20.0));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNonNumericColumnsCantBeWritten() throws IOException {
        Table table = Table.create("labels", StringColumn.create("label", "a", "b"));
        new DataWriter(table, folder.newFile("labels.arrow")).write();
    }
}
