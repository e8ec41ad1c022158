/*
 * Copyright © 2025 Door 10. All Rights Reserved.
 */
package com.door10.cvparser.core.candidate;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Derives candidate details from normalized CV text using nothing but pattern matching. Each field has its own
 * method so that its heuristic can be exercised on its own. The heuristics have known failure modes, noted on each
 * method; downstream scoring depends on the current behavior, so they are documented rather than patched.
 */
public abstract class CandidateFieldExtractor {

    private static final Pattern EMAIL = Pattern.compile("[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}");
    private static final Pattern PHONE = Pattern.compile("\\+?[\\d\\s\\-()]{10,}");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern FOUR_DIGITS = Pattern.compile("\\d{4}");

    // Order matters; the first pattern that matches a line wins. \u2014 is an em dash, \u2013 an en dash.
    private static final List<Pattern> EXPERIENCE_PATTERNS = Arrays.asList(
        experiencePattern("^(.+?)\\s*\u2014\\s*(.+?)\\s*\\((\\d{4})\\s*[\u2013-]\\s*(\\d{4}|present)\\)"),
        experiencePattern("^(.+?)\\s*at\\s*(.+?),\\s*(\\d{4})\\s*[\u2013-]\\s*(\\d{4}|present)"),
        experiencePattern("^(.+?)\\s*at\\s*(.+?),\\s*(\\d{4})\\s*[\u2013-]\\s*present"),
        experiencePattern("^(.+?)\\s*\u2014\\s*(.+?)\\s*\\((\\d{4})\\s*[\u2013-]\\s*present\\)")
    );

    private static final int NOTES_CANDIDATE_LINES = 5;
    private static final int NOTES_MIN_LINE_LENGTH = 20;
    private static final int NOTES_MAX_LENGTH = 200;

    static final int LOW_TEXT_YIELD_LENGTH = 300;
    static final double LOW_TEXT_YIELD_CAP = 0.3;

    public static CandidateInfo extract(String text) {
        final String source = text != null ? text : "";
        final List<String> lines = nonBlankLines(source);

        String[] names = extractNames(lines);
        String email = extractEmail(source);
        String phone = extractPhone(source);
        Map<String, Boolean> skills = extractSkills(source);
        List<ExperienceEntry> experience = extractExperience(lines);
        String notes = extractNotes(lines);
        double confidence = computeConfidence(source.length(), names[0], names[1], email, phone, experience, skills);
        return new CandidateInfo(names[0], names[1], email, phone, skills, experience, notes, confidence);
    }

    public static String extractEmail(String text) {
        Matcher matcher = EMAIL.matcher(text);
        return matcher.find() ? matcher.group() : "";
    }

    /**
     * Deliberately loose: any run of 10 or more digits, spaces, dashes and parentheses counts. Date ranges such as
     * "2019 - 2021" and long reference numbers are picked up as phone numbers when they come first.
     */
    public static String extractPhone(String text) {
        Matcher matcher = PHONE.matcher(text);
        return matcher.find() ? matcher.group().trim() : "";
    }

    /**
     * Assumes the candidate's full name is the first line of the CV. Letterheads, "Curriculum Vitae" titles and
     * the like become the name when they come first.
     *
     * @return two elements, first name and last name; either may be empty
     */
    public static String[] extractNames(List<String> lines) {
        if (lines.isEmpty()) {
            return new String[]{"", ""};
        }
        String[] words = WHITESPACE.split(lines.get(0).trim());
        if (words.length >= 2) {
            return new String[]{words[0], String.join(" ", Arrays.copyOfRange(words, 1, words.length))};
        }
        return new String[]{words[0], ""};
    }

    public static Map<String, Boolean> extractSkills(String text) {
        Map<String, Boolean> skills = new LinkedHashMap<>();
        for (SkillTag tag : SkillTag.values()) {
            skills.put(tag.getKey(), tag.matches(text));
        }
        return skills;
    }

    /**
     * Only recognizes one role per line, in the forms "Title {@literal <em dash>} Company (2019-2022)" and
     * "Title at Company, 2021-present", with either a hyphen or an en dash between the years. Roles spread over
     * several lines are not found. The "at" is not matched as a whole word, so a title containing "at", such as
     * "Data Analyst at ONS, 2019-2021", is split at the first occurrence, giving the title "D".
     */
    public static List<ExperienceEntry> extractExperience(List<String> lines) {
        List<ExperienceEntry> entries = new ArrayList<>();
        for (String line : lines) {
            for (Pattern pattern : EXPERIENCE_PATTERNS) {
                Matcher matcher = pattern.matcher(line);
                if (matcher.find()) {
                    String endDate = matcher.groupCount() >= 4 ? matcher.group(4) : "present";
                    entries.add(new ExperienceEntry(matcher.group(2).trim(), matcher.group(1).trim(), matcher.group(3), endDate));
                    break;
                }
            }
        }
        return entries;
    }

    /**
     * Looks for prose among the first five lines by skipping short lines and anything that looks like contact
     * details or dates. CVs that open with a long address block yield no notes.
     */
    public static String extractNotes(List<String> lines) {
        String joined = lines.stream()
            .limit(NOTES_CANDIDATE_LINES)
            .filter(CandidateFieldExtractor::isNotesLine)
            .collect(Collectors.joining(" "));
        return joined.length() > NOTES_MAX_LENGTH ? joined.substring(0, NOTES_MAX_LENGTH) + "..." : joined;
    }

    public static double computeConfidence(int textLength, String firstName, String lastName, String email,
                                           String phone, List<ExperienceEntry> experience, Map<String, Boolean> skills) {
        double confidence = Math.min(1, textLength / 8000.0);
        if (!firstName.isEmpty() && !lastName.isEmpty()) {
            confidence += 0.1;
        }
        if (!email.isEmpty()) {
            confidence += 0.1;
        }
        if (!phone.isEmpty()) {
            confidence += 0.05;
        }
        if (!experience.isEmpty()) {
            confidence += 0.1;
        }
        long skillCount = skills.values().stream().filter(Boolean.TRUE::equals).count();
        confidence += skillCount * 0.05;
        confidence = Math.max(0, Math.min(confidence, 1.0));

        // Little text is a strong signal on its own that the extraction went wrong.
        if (textLength < LOW_TEXT_YIELD_LENGTH) {
            confidence = Math.min(confidence, LOW_TEXT_YIELD_CAP);
        }
        return confidence;
    }

    public static List<String> nonBlankLines(String text) {
        return Arrays.stream(text.split("\n"))
            .filter(line -> !line.trim().isEmpty())
            .collect(Collectors.toList());
    }

    private static boolean isNotesLine(String line) {
        String lowerCase = line.toLowerCase(Locale.ROOT);
        return line.length() > NOTES_MIN_LINE_LENGTH &&
            !line.contains("@") &&
            !FOUR_DIGITS.matcher(line).find() &&
            !lowerCase.contains("phone") &&
            !lowerCase.contains("email");
    }

    private static Pattern experiencePattern(String regex) {
        return Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    private CandidateFieldExtractor() {
    }
}
