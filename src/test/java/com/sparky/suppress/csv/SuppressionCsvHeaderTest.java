package com.sparky.suppress.csv;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SuppressionCsvHeaderTest {

    private static CsvRow row(String... cells) {
        return new CsvRow(1, List.of(cells));
    }

    @Test
    void testDetect_namedHeader() throws InvalidSuppressionFileException {
        SuppressionCsvHeader header = SuppressionCsvHeader.detect(row("recipient", " type ", "description"));

        assertEquals(List.of("recipient", "type", "description"), header.fields());
        assertFalse(header.isFirstRowData());
    }

    @Test
    void testDetect_stripsByteOrderMark() throws InvalidSuppressionFileException {
        SuppressionCsvHeader header = SuppressionCsvHeader.detect(row("\uFEFFrecipient", "type"));

        assertEquals(List.of("recipient", "type"), header.fields());
    }

    @Test
    void testDetect_bareAddressIsData() throws InvalidSuppressionFileException {
        SuppressionCsvHeader header = SuppressionCsvHeader.detect(row("someone@example.com"));

        assertEquals(List.of("recipient"), header.fields());
        assertTrue(header.isFirstRowData());
    }

    @Test
    void testDetect_unknownFieldIsFatal() {
        InvalidSuppressionFileException e = assertThrows(InvalidSuppressionFileException.class,
            () -> SuppressionCsvHeader.detect(row("recipient", "colour")));

        assertEquals("Line 1 : Unexpected .csv file field name found: colour", e.getMessage());
        assertEquals(1, e.getLineNumber());
    }

    @Test
    void testDetect_noRecipientIsFatal() {
        assertThrows(InvalidSuppressionFileException.class, () -> SuppressionCsvHeader.detect(row("email", "type")));
        assertThrows(InvalidSuppressionFileException.class, () -> SuppressionCsvHeader.detect(row("not an address")));
    }

    @Test
    void testDetect_acceptsDeprecatedFlagColumns() throws InvalidSuppressionFileException {
        SuppressionCsvHeader header = SuppressionCsvHeader.detect(row("recipient", "transactional", "non_transactional"));

        assertEquals(3, header.size());
    }
}
