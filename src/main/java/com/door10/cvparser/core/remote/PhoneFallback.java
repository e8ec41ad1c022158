/*
 * Copyright © 2025 Door 10. All Rights Reserved.
 */
package com.door10.cvparser.core.remote;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Conservative phone lookup for when the remote service finds no phone number. Stricter than the local
 * heuristic: digits may be separated by at most one character, and the match must carry 9 to 15 digits.
 */
public abstract class PhoneFallback {

    private static final Pattern CANDIDATE = Pattern.compile("(?:\\+?\\d[\\s().-]?){9,15}");

    public static String find(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        Matcher matcher = CANDIDATE.matcher(text);
        if (!matcher.find()) {
            return "";
        }
        String match = matcher.group();
        int digits = match.replaceAll("\\D", "").length();
        return digits >= 9 && digits <= 15 ? match.trim() : "";
    }

    private PhoneFallback() {
    }
}
