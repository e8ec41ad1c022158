/*
 * Copyright © 2025 Door 10. All Rights Reserved.
 */
package com.door10.cvparser.core.extraction;

import java.util.regex.Pattern;

/**
 * Canonicalizes text produced by any extractor. Line breaks survive, as the candidate heuristics work line by
 * line; every other run of whitespace becomes a single space. {@code normalize(normalize(x))} equals
 * {@code normalize(x)}.
 */
public abstract class TextNormalizer {

    private static final Pattern LINE_ENDINGS = Pattern.compile("\\r\\n?");
    private static final Pattern CONTROL_CHARACTERS = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]");
    private static final Pattern HORIZONTAL_WHITESPACE = Pattern.compile("\\h+");
    private static final Pattern SPACE_AROUND_NEWLINE = Pattern.compile(" ?\\n ?");
    private static final Pattern EXCESS_NEWLINES = Pattern.compile("\\n{3,}");

    public static String normalize(String raw) {
        if (raw == null || raw.isEmpty()) {
            return "";
        }
        String text = LINE_ENDINGS.matcher(raw).replaceAll("\n");
        text = CONTROL_CHARACTERS.matcher(text).replaceAll("");
        text = HORIZONTAL_WHITESPACE.matcher(text).replaceAll(" ");
        text = SPACE_AROUND_NEWLINE.matcher(text).replaceAll("\n");
        text = EXCESS_NEWLINES.matcher(text).replaceAll("\n\n");
        return text.trim();
    }

    private TextNormalizer() {
    }
}
