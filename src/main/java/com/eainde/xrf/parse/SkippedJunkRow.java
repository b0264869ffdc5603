package com.eainde.xrf.parse;

public record SkippedJunkRow(int row, JunkReason reason) {
}
