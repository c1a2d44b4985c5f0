package com.sparky.suppress.csv;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;

/**
 * Lazily pulls rows from a file, establishes the header from the first one and normalizes the rest.
 */
public class SuppressionRecordSource {
    private static final Logger LOGGER = LoggerFactory.getLogger(SuppressionRecordSource.class);

    private final Iterator<CsvRow> rows;
    private final CsvRowNormalizer normalizer;
    private SuppressionCsvHeader header;
    private CsvRow pendingFirstRow;

    public SuppressionRecordSource(Iterable<CsvRow> rows, CsvRowNormalizer normalizer) {
        this.rows = rows.iterator();
        this.normalizer = normalizer;
    }

    /**
     * @return the next normalized record, or null at end of input
     * @throws InvalidSuppressionFileException on a bad header or a malformed row
     */
    public NormalizedRecord next() throws InvalidSuppressionFileException {
        if (header == null) {
            CsvRow first = nextNonBlank();
            if (first == null) {
                return null;
            }
            header = SuppressionCsvHeader.detect(first);
            if (header.isFirstRowData()) {
                pendingFirstRow = first;
            }
        }

        if (pendingFirstRow != null) {
            CsvRow row = pendingFirstRow;
            pendingFirstRow = null;
            return normalizer.normalize(header, row);
        }

        CsvRow row = nextNonBlank();
        return row == null ? null : normalizer.normalize(header, row);
    }

    private CsvRow nextNonBlank() {
        while (rows.hasNext()) {
            CsvRow row = rows.next();
            if (!isBlank(row)) {
                return row;
            }
            LOGGER.warn("Line {} : blank line skipped", row.lineNumber());
        }
        return null;
    }

    // an empty line, not a row of empty cells
    private static boolean isBlank(CsvRow row) {
        return row.cells().size() == 1 && (row.cells().get(0) == null || row.cells().get(0).trim().isEmpty());
    }

    public SuppressionCsvHeader header() {
        return header;
    }
}
