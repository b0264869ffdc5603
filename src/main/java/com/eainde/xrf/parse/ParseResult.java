package com.eainde.xrf.parse;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of parsing one sheet: either a {@link ParsedBatch} or the reasons the whole sheet
 * was rejected.
 */
public final class ParseResult {

    private final ParsedBatch batch;
    private final List<ParseError> errors;
    private final List<String> warnings;
    private final ParseMetadata metadata;

    private ParseResult(ParsedBatch batch, List<ParseError> errors, List<String> warnings, ParseMetadata metadata) {
        this.batch = batch;
        this.errors = List.copyOf(errors);
        this.warnings = List.copyOf(warnings);
        this.metadata = metadata;
    }

    public static ParseResult success(ParsedBatch batch) {
        return new ParseResult(batch, batch.errors(), batch.warnings(), batch.metadata());
    }

    public static ParseResult failure(List<ParseError> errors, List<String> warnings, ParseMetadata metadata) {
        if (errors.isEmpty()) {
            throw new IllegalArgumentException("A failed parse needs at least one error");
        }
        return new ParseResult(null, errors, warnings, metadata);
    }

    public boolean isSuccess() {
        return batch != null;
    }

    public Optional<ParsedBatch> batch() {
        return Optional.ofNullable(batch);
    }

    /** Row errors on success, fatal reasons on failure. */
    public List<ParseError> errors() {
        return errors;
    }

    public List<String> warnings() {
        return warnings;
    }

    public ParseMetadata metadata() {
        return metadata;
    }
}
