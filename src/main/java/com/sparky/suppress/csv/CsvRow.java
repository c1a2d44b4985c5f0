package com.sparky.suppress.csv;

import java.util.List;

/**
 * Raw cells of one CSV record and the file line it ended on.
 */
public record CsvRow(long lineNumber, List<String> cells) {}
