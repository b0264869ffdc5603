package com.eainde.xrf.exception;

import com.eainde.xrf.model.CanonicalField;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Raised when required reading fields cannot be resolved to a column, neither from the
 * alias table nor from AI mapping.
 */
public class MissingRequiredColumnsException extends XrfProcessingException {

    private final List<CanonicalField> missingFields;
    private final List<String> availableHeaders;

    public MissingRequiredColumnsException(List<CanonicalField> missingFields, List<String> availableHeaders) {
        super("Required column(s) not found: "
                + missingFields.stream().map(CanonicalField::key).collect(Collectors.joining(", "))
                + ". Available columns: " + String.join(", ", availableHeaders));
        this.missingFields = List.copyOf(missingFields);
        this.availableHeaders = List.copyOf(availableHeaders);
    }

    public List<CanonicalField> getMissingFields() {
        return missingFields;
    }

    public List<String> getAvailableHeaders() {
        return availableHeaders;
    }
}
