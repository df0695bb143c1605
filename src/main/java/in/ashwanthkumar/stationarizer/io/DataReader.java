package in.ashwanthkumar.stationarizer.io;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.ipc.ArrowFileReader;
import org.apache.arrow.vector.ipc.message.ArrowBlock;
import org.apache.arrow.vector.types.pojo.Field;
import tech.tablesaw.api.DoubleColumn;
import tech.tablesaw.api.LongColumn;
import tech.tablesaw.api.Table;
import tech.tablesaw.columns.Column;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

@RequiredArgsConstructor
@Slf4j
public class DataReader {
    private final File input;

    /**
     * Reads every record batch of an Arrow file into a single Table. Floating point vectors become
     * DoubleColumns and integer vectors LongColumns.
     */
    public Table read() {
        try (BufferAllocator allocator = new RootAllocator(); FileInputStream fileInputStream = new FileInputStream(input); ArrowFileReader reader = new ArrowFileReader(fileInputStream.getChannel(), allocator)) {
            // batches are appended to the columns of the previous ones
            Map<String, Column<?>> columns = new LinkedHashMap<>();

            for (ArrowBlock arrowBlock : reader.getRecordBlocks()) {
                reader.loadRecordBatch(arrowBlock);
                VectorSchemaRoot vectorSchemaRoot = reader.getVectorSchemaRoot();
                for (Field field : vectorSchemaRoot.getSchema().getFields()) {
                    FieldVector fieldVector = vectorSchemaRoot.getVector(field);
                    log.debug("{} has {} elements of type: {}", field.getName(), fieldVector.getValueCount(), field.getFieldType().getType().getTypeID());
                    switch (field.getFieldType().getType().getTypeID()) {
                        case FloatingPoint:
                            parseColumn(columns, fieldVector, field, DoubleColumn::create, value -> ((Number) value).doubleValue());
                            break;
                        case Int:
                            parseColumn(columns, fieldVector, field, LongColumn::create, value -> ((Number) value).longValue());
                            break;
                        default:
                            throw new IllegalArgumentException(String.format("Field %s of type %s is not numeric",
                                    field.getName(), field.getFieldType().getType().getTypeID()));
                    }
                }
            }

            return Table.create(input.getName(), columns.values().toArray(new Column<?>[0]));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + input, e);
        }
    }

    private void parseColumn(Map<String, Column<?>> columns, FieldVector fieldVector, Field field,
                             Function<String, Column<?>> createColumnFn, Function<Object, Object> parseValueFn) {
        Column<?> column = columns.computeIfAbsent(field.getName(), createColumnFn);
        for (int i = 0; i < fieldVector.getValueCount(); i++) {
            if (fieldVector.isNull(i)) {
                column.appendMissing();
            } else {
                column.appendObj(parseValueFn.apply(fieldVector.getObject(i)));
            }
        }
    }
}
