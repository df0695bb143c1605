package in.ashwanthkumar.stationarizer.io;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.Float8Vector;
import org.apache.arrow.vector.ValueVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.dictionary.DictionaryProvider;
import org.apache.arrow.vector.ipc.ArrowFileWriter;
import org.apache.arrow.vector.types.pojo.Field;
import tech.tablesaw.api.NumericColumn;
import tech.tablesaw.api.Table;
import tech.tablesaw.columns.Column;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.channels.Channels;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

@RequiredArgsConstructor
@Slf4j
public class DataWriter {
    private final Table table;
    private final File output;

    /**
     * Writes the underlying Table to the output as a single Arrow record batch. Every column is
     * persisted as a 64-bit float vector, missing values as nulls.
     *
     * @throws IllegalArgumentException when the table has a non-numeric column
     */
    public void write() {
        try (BufferAllocator allocator = new RootAllocator()) {
            List<FieldVector> valueVectors = new ArrayList<>();
            for (Column<?> column : table.columns()) {
                if (!(column instanceof NumericColumn)) {
                    valueVectors.forEach(ValueVector::close);
                    throw new IllegalArgumentException(String.format("Column %s of type %s can't be written, only numeric columns are supported",
                            column.name(), column.type().name()));
                }
                NumericColumn<?> numericColumn = (NumericColumn<?>) column;
                Float8Vector arrowColumn = new Float8Vector(column.name(), allocator);
                arrowColumn.allocateNew(column.size());
                for (int i = 0; i < column.size(); i++) {
                    if (numericColumn.isMissing(i)) {
                        arrowColumn.setNull(i);
                    } else {
                        arrowColumn.set(i, numericColumn.getDouble(i));
                    }
                }
                arrowColumn.setValueCount(column.size());
                valueVectors.add(arrowColumn);
            }

            List<Field> fields = valueVectors.stream().map(ValueVector::getField).collect(Collectors.toList());
            try (VectorSchemaRoot root = new VectorSchemaRoot(fields, valueVectors, table.rowCount());
                 FileOutputStream out = new FileOutputStream(output);
                 ArrowFileWriter writer = new ArrowFileWriter(root, new DictionaryProvider.MapDictionaryProvider(), Channels.newChannel(out))) {
                writer.start();
                writer.writeBatch();
                writer.end();
                log.debug("Bytes written: " + writer.bytesWritten());
                log.debug("Rows written: " + root.getRowCount());
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to write " + output, e);
            }
        }
    }
}
