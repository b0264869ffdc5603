package com.eainde.xrf.exception;

/**
 * Base for unexpected failures while ingesting or summarizing XRF data.
 * Expected outcomes (skipped rows, collaborator fallbacks) are never reported this way.
 */
public class XrfProcessingException extends RuntimeException {

    public XrfProcessingException(String message) {
        super(message);
    }

    public XrfProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
