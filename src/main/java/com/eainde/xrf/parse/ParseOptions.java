package com.eainde.xrf.parse;

/**
 * Per-call switches for column mapping.
 *
 * @param useAiFallback ask the AI mapper when static matching leaves required columns missing
 * @param alwaysUseAi   skip static matching and map with the AI mapper only
 */
public record ParseOptions(boolean useAiFallback, boolean alwaysUseAi) {

    public static ParseOptions defaults() {
        return new ParseOptions(true, false);
    }

    public static ParseOptions staticOnly() {
        return new ParseOptions(false, false);
    }
}
