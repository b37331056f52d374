package com.tagatlas.exception;

/**
 * Raised when the tag source cannot be read during bulk import.
 */
public class TagImportException extends RuntimeException {

    private final String source;

    public TagImportException(String source, String message, Throwable cause) {
        super(message + " (" + source + ")", cause);
        this.source = source;
    }

    public String getSource() {
        return source;
    }
}
