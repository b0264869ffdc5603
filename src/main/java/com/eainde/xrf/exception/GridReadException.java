package com.eainde.xrf.exception;

/**
 * The uploaded file could not be read as a spreadsheet or CSV grid.
 */
public class GridReadException extends XrfProcessingException {

    public GridReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
