package com.eainde.xrf.normalize;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * "door-frame_trim" → "Door Frame Trim".
 */
public final class TitleCase {

    private TitleCase() {
    }

    public static String of(String text) {
        if (text == null) return "";
        return Arrays.stream(text.toLowerCase(Locale.ROOT).split("[\\s\\-_]+"))
                .filter(word -> !word.isEmpty())
                .map(word -> Character.toUpperCase(word.charAt(0)) + word.substring(1))
                .collect(Collectors.joining(" "));
    }
}
