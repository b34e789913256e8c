package com.whereq.tally.exception;

/**
 * Exception thrown when an extractor fails to fetch or read source data.
 * The message starts with a category ({@code NETWORK_ERROR}, {@code TIMEOUT},
 * {@code HTTP_ERROR}) that retry rules match against.
 */
public class ExtractionException extends TallyException {

    public static final String CODE = "EXTRACTION_ERROR";

    public ExtractionException(String message) {
        super(message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getCode() {
        return CODE;
    }
}
