package com.sparky.suppress.csv;

import io.vertx.core.json.JsonObject;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

import java.io.Closeable;
import java.io.Flushable;
import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes remote list entries as CSV rows with a fixed, configured column list. Fields the
 * remote returns that are not in the list are dropped; listed fields it omits are left blank.
 */
public class SuppressionCsvWriter implements Closeable, Flushable {
    private final List<String> properties;
    private final CSVPrinter printer;
    private long rowsWritten = 0;

    public SuppressionCsvWriter(Writer out, List<String> properties) throws IOException {
        this.properties = List.copyOf(properties);
        this.printer = CSVFormat.DEFAULT.builder()
            .setHeader(properties.toArray(new String[0]))
            .setRecordSeparator("\r\n")
            .build()
            .print(out);
    }

    public void write(JsonObject result) throws IOException {
        List<String> row = new ArrayList<>(properties.size());
        for (String property : properties) {
            Object value = result.getValue(property);
            row.add(value == null ? "" : value.toString());
        }
        printer.printRecord(row);
        rowsWritten++;
    }

    public long rowsWritten() {
        return rowsWritten;
    }

    public List<String> properties() {
        return properties;
    }

    @Override
    public void flush() throws IOException {
        printer.flush();
    }

    @Override
    public void close() throws IOException {
        printer.close(true);
    }
}
