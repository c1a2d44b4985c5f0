package com.sparky.suppress.csv;

import com.sparky.suppress.Const;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Column layout of an input file, established from its first row.
 */
public class SuppressionCsvHeader {
    public static final Set<String> RECOGNIZED_FIELDS = Set.of(
        Const.Field.Recipient,
        Const.Field.Type,
        Const.Field.Source,
        Const.Field.Description,
        Const.Field.Created,
        Const.Field.Updated,
        Const.Field.SubaccountId,
        Const.Field.Transactional,
        Const.Field.NonTransactional);

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private final List<String> fields;
    private final boolean firstRowIsData;

    private SuppressionCsvHeader(List<String> fields, boolean firstRowIsData) {
        this.fields = Collections.unmodifiableList(fields);
        this.firstRowIsData = firstRowIsData;
    }

    /**
     * Decides whether the first row is a header naming the columns, or a single bare
     * address in a header-less file.
     *
     * @throws InvalidSuppressionFileException when the row is neither, or names an unknown field
     */
    public static SuppressionCsvHeader detect(CsvRow firstRow) throws InvalidSuppressionFileException {
        List<String> names = new ArrayList<>(firstRow.cells().size());
        for (String cell : firstRow.cells()) {
            names.add(stripByteOrderMark(cell).trim());
        }

        if (names.contains(Const.Field.Recipient)) {
            for (String name : names) {
                if (!RECOGNIZED_FIELDS.contains(name)) {
                    throw new InvalidSuppressionFileException("Unexpected .csv file field name found: " + name, firstRow.lineNumber());
                }
            }
            return new SuppressionCsvHeader(names, false);
        }

        if (names.size() == 1 && names.get(0).indexOf('@') >= 0) {
            return new SuppressionCsvHeader(List.of(Const.Field.Recipient), true);
        }

        throw new InvalidSuppressionFileException("Invalid .csv file header - must contain \"" + Const.Field.Recipient + "\" field", firstRow.lineNumber());
    }

    static SuppressionCsvHeader of(List<String> fields) {
        return new SuppressionCsvHeader(new ArrayList<>(fields), false);
    }

    public List<String> fields() {
        return fields;
    }

    public int size() {
        return fields.size();
    }

    public boolean isFirstRowData() {
        return firstRowIsData;
    }

    static String stripByteOrderMark(String cell) {
        if (!cell.isEmpty() && cell.charAt(0) == BYTE_ORDER_MARK) {
            return cell.substring(1);
        }
        return cell;
    }
}
