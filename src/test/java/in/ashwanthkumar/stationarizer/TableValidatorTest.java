package in.ashwanthkumar.stationarizer;

import in.ashwanthkumar.stationarizer.exception.InputTypeException;
import in.ashwanthkumar.stationarizer.model.ShapeWarning;
import org.junit.Test;
import tech.tablesaw.api.DoubleColumn;
import tech.tablesaw.api.IntColumn;
import tech.tablesaw.api.StringColumn;
import tech.tablesaw.api.Table;

import java.util.List;
import java.util.Optional;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.fail;

public class TableValidatorTest {
    private final TableValidator validator = new TableValidator();

    @Test
    public void testLongTableIsValid() {
        Table table = Table.create("long",
                DoubleColumn.create("a", 1.0, 2.0, 3.0, 4.0),
                IntColumn.create("b", 4, 3, 2, 1));
        assertThat(validator.validate(table), is(Optional.empty()));
    }

    @Test
    public void testWideTableRaisesAWarning() {
        Table table = Table.create("wide",
                DoubleColumn.create("a", 1.0, 2.0),
                DoubleColumn.create("b", 1.0, 2.0),
                DoubleColumn.create("c", 1.0, 2.0));
        Optional<ShapeWarning> warning = validator.validate(table);
        assertThat(warning, is(Optional.of(ShapeWarning.of(2, 3))));
    }

    @Test
    public void testSquareTableRaisesAWarning() {
        Table table = Table.create("square",
                DoubleColumn.create("a", 1.0, 2.0),
                DoubleColumn.create("b", 1.0, 2.0));
        assertThat(validator.validate(table).isPresent(), is(true));
    }

    @Test
    public void testNonNumericColumnsAreRejected() {
        Table table = Table.create("mixed",
                StringColumn.create("name", "x", "y", "z"),
                DoubleColumn.create("a", 1.0, 2.0, 3.0),
                StringColumn.create("label", "p", "q", "r"));
        try {
            validator.validate(table);
            fail("Expected the string columns to be rejected");
        } catch (InputTypeException e) {
            assertThat(e.getOffendingColumnNames(), is(List.of("name", "label")));
        }
    }

    @Test(expected = InputTypeException.class)
    public void testEmptyTableIsRejected() {
        validator.validate(Table.create("empty"));
    }

    @Test(expected = InputTypeException.class)
    public void testTableWithoutRowsIsRejected() {
        validator.validate(Table.create("no rows", DoubleColumn.create("a")));
    }
}
