package com.eainde.xrf.exception;

/**
 * A chat model answered, but not with the JSON shape the prompt asked for.
 */
public class AiResponseParseException extends XrfProcessingException {

    public AiResponseParseException(String message) {
        super(message);
    }

    public AiResponseParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
