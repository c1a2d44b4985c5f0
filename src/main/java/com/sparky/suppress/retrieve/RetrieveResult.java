package com.sparky.suppress.retrieve;

/**
 * @param pages      pages fetched
 * @param rows       rows written to the output
 * @param totalCount entry count the remote reported on the first page
 */
public record RetrieveResult(int pages, long rows, long totalCount) {}
