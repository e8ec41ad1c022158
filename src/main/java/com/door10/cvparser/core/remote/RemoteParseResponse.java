/*
 * Copyright © 2025 Door 10. All Rights Reserved.
 */
package com.door10.cvparser.core.remote;

import com.door10.cvparser.Util;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Read-only view over the JSON returned by the remote CV parsing service. The service has been seen to emit both
 * camelCase and PascalCase property names, so every lookup ignores case.
 */
public class RemoteParseResponse {

    private static final Pattern YEAR = Pattern.compile("\\d{4}");

    private final JsonNode root;
    private final JsonNode data;

    private RemoteParseResponse(JsonNode root) {
        this.root = root;
        this.data = field(root, "data");
    }

    /**
     * @param root
     * @return the response, if the service reported success
     * @throws RemoteParserException if the service reported a failure
     */
    public static RemoteParseResponse fromSuccessfulJson(JsonNode root) {
        RemoteParseResponse response = new RemoteParseResponse(root);
        if (!response.isSuccess()) {
            String message = response.getMessage();
            throw new RemoteParserException(message.isEmpty() ? "CV parsing failed" : message);
        }
        return response;
    }

    public boolean isSuccess() {
        return field(root, "success").asBoolean(false);
    }

    public String getMessage() {
        return text(root, "message");
    }

    public String getFirstName() {
        return text(personalInfo(), "firstName");
    }

    public String getLastName() {
        return text(personalInfo(), "lastName");
    }

    public String getFullName() {
        String name = text(personalInfo(), "name");
        return !name.isEmpty() ? name : (getFirstName() + " " + getLastName()).trim();
    }

    public String getEmail() {
        return text(personalInfo(), "email");
    }

    /**
     * @return the phone reported by the service or, failing that, one found in the raw text of the response
     */
    public String getPhone() {
        String phone = text(personalInfo(), "phone");
        if (!phone.isEmpty()) {
            return phone;
        }
        String rawText = getRawText();
        return PhoneFallback.find(!rawText.isEmpty() ? rawText : data.toString());
    }

    public String getSummary() {
        return text(data, "summary");
    }

    public String getRawText() {
        return text(data, "rawText");
    }

    public String getParsedAt() {
        return text(data, "parsedAt");
    }

    public List<Role> getWorkExperience() {
        List<Role> roles = new ArrayList<>();
        for (JsonNode node : field(data, "workExperience")) {
            roles.add(new Role(text(node, "jobTitle"), text(node, "company"), text(node, "startDate"), text(node, "endDate")));
        }
        return roles;
    }

    public List<Map<String, String>> getEducation() {
        List<Map<String, String>> education = new ArrayList<>();
        for (JsonNode node : field(data, "education")) {
            Map<String, String> entry = new LinkedHashMap<>();
            for (String name : new String[]{"degree", "field", "institution", "startDate", "endDate"}) {
                entry.put(name, text(node, name));
            }
            education.add(entry);
        }
        return education;
    }

    public List<String> getSkills() {
        return textList(data, "skills");
    }

    public List<String> getLanguages() {
        return textList(data, "languages");
    }

    public List<String> getCertifications() {
        return textList(data, "certifications");
    }

    /**
     * The service returns structured data rather than text. When it does not echo the raw text, an equivalent
     * text is assembled so that the result can be scored and mined like the output of any local extractor; roles
     * are written in the "Title at Company, 2020-present" form that the experience heuristic recognizes.
     */
    public String buildText() {
        String rawText = getRawText();
        if (!rawText.isEmpty()) {
            return rawText;
        }
        List<String> lines = new ArrayList<>();
        addIfPresent(lines, getFullName());
        addIfPresent(lines, getEmail());
        addIfPresent(lines, text(personalInfo(), "phone"));
        for (Role role : getWorkExperience()) {
            addIfPresent(lines, role.describe());
        }
        addIfPresent(lines, getSummary());
        List<String> skills = getSkills();
        if (!skills.isEmpty()) {
            lines.add("Skills: " + String.join(", ", skills));
        }
        return String.join("\n", lines);
    }

    /**
     * Completeness of the structured data, as a hint for callers. Not used to rank results; every result,
     * remote or local, is ranked on the confidence of its text.
     */
    public double getStructuredConfidence() {
        double confidence = 0.5;
        if (!getFirstName().isEmpty() && !getLastName().isEmpty()) {
            confidence += 0.2;
        }
        if (!getEmail().isEmpty()) {
            confidence += 0.2;
        }
        if (!text(personalInfo(), "phone").isEmpty()) {
            confidence += 0.1;
        }
        if (!getWorkExperience().isEmpty()) {
            confidence += 0.2;
        }
        if (!getSkills().isEmpty()) {
            confidence += 0.1;
        }
        return Math.min(confidence, 1.0);
    }

    public Map<String, Object> buildMetadata() {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("source", "remote");
        if (!getParsedAt().isEmpty()) {
            metadata.put("parsedAt", getParsedAt());
        }
        metadata.put("structuredConfidence", getStructuredConfidence());
        metadata.put("skills", getSkills());
        metadata.put("languages", getLanguages());
        metadata.put("certifications", getCertifications());
        metadata.put("education", getEducation());
        String phone = getPhone();
        if (!phone.isEmpty()) {
            metadata.put("phone", phone);
        }
        return metadata;
    }

    private JsonNode personalInfo() {
        return field(data, "personalInfo");
    }

    private static void addIfPresent(List<String> lines, String value) {
        if (Util.hasText(value)) {
            lines.add(value.trim());
        }
    }

    static JsonNode field(JsonNode node, String name) {
        if (node == null || !node.isObject()) {
            return MissingNode.getInstance();
        }
        JsonNode exact = node.get(name);
        if (exact != null) {
            return exact;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            if (entry.getKey().equalsIgnoreCase(name)) {
                return entry.getValue();
            }
        }
        return MissingNode.getInstance();
    }

    private static String text(JsonNode node, String name) {
        JsonNode value = field(node, name);
        return value.isValueNode() && !value.isNull() ? value.asText().trim() : "";
    }

    private static List<String> textList(JsonNode node, String name) {
        List<String> values = new ArrayList<>();
        for (JsonNode value : field(node, name)) {
            if (value.isValueNode() && !value.isNull() && !value.asText().trim().isEmpty()) {
                values.add(value.asText().trim());
            }
        }
        return values;
    }

    public static class Role {

        private final String jobTitle;
        private final String company;
        private final String startDate;
        private final String endDate;

        Role(String jobTitle, String company, String startDate, String endDate) {
            this.jobTitle = jobTitle;
            this.company = company;
            this.startDate = startDate;
            this.endDate = endDate;
        }

        public String getJobTitle() {
            return jobTitle;
        }

        public String getCompany() {
            return company;
        }

        public String getStartDate() {
            return startDate;
        }

        public String getEndDate() {
            return endDate;
        }

        String describe() {
            if (jobTitle.isEmpty() && company.isEmpty()) {
                return "";
            }
            if (jobTitle.isEmpty() || company.isEmpty()) {
                return jobTitle.isEmpty() ? company : jobTitle;
            }
            String line = jobTitle + " at " + company;
            String startYear = year(startDate);
            if (startYear.isEmpty()) {
                return line;
            }
            // A missing end date means the role is ongoing.
            String endYear = endDate.isEmpty() ? "present" : year(endDate);
            return endYear.isEmpty() ? line : line + ", " + startYear + "\u2013" + endYear;
        }

        private static String year(String date) {
            if ("present".equalsIgnoreCase(date)) {
                return "present";
            }
            Matcher matcher = YEAR.matcher(date);
            return matcher.find() ? matcher.group() : "";
        }
    }
}
