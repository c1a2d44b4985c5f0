package com.sparky.suppress.csv;

/**
 * A problem with the input file that makes the whole run unusable.
 */
public class InvalidSuppressionFileException extends Exception {
    private final long lineNumber;

    public InvalidSuppressionFileException(String message) {
        this(message, 0);
    }

    public InvalidSuppressionFileException(String message, long lineNumber) {
        super(lineNumber > 0 ? "Line " + lineNumber + " : " + message : message);
        this.lineNumber = lineNumber;
    }

    public long getLineNumber() {
        return lineNumber;
    }
}
