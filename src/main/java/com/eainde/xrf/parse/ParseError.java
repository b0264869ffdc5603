package com.eainde.xrf.parse;

/**
 * @param row 1-based source row, 0 for errors that concern the whole sheet
 */
public record ParseError(int row, String message) {

    public static ParseError ofSheet(String message) {
        return new ParseError(0, message);
    }
}
