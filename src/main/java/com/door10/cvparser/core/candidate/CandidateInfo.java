/*
 * Copyright © 2025 Door 10. All Rights Reserved.
 */
package com.door10.cvparser.core.candidate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Candidate details derived from extracted text. The confidence here describes the structured fields and is
 * independent of the confidence of the text extraction.
 */
public class CandidateInfo {

    private final String firstName;
    private final String lastName;
    private final String email;
    private final String phone;
    private final Map<String, Boolean> skills;
    private final List<ExperienceEntry> experience;
    private final String notes;
    private final double confidence;

    public CandidateInfo(String firstName, String lastName, String email, String phone, Map<String, Boolean> skills,
                         List<ExperienceEntry> experience, String notes, double confidence) {
        this.firstName = firstName;
        this.lastName = lastName;
        this.email = email;
        this.phone = phone;
        this.skills = Collections.unmodifiableMap(new LinkedHashMap<>(skills));
        this.experience = Collections.unmodifiableList(new ArrayList<>(experience));
        this.notes = notes;
        this.confidence = confidence;
    }

    public String getFirstName() {
        return firstName;
    }

    public String getLastName() {
        return lastName;
    }

    public String getEmail() {
        return email;
    }

    public String getPhone() {
        return phone;
    }

    /**
     * @return one entry per {@link SkillTag}, keyed by {@link SkillTag#getKey()}, in declaration order
     */
    public Map<String, Boolean> getSkills() {
        return skills;
    }

    public boolean hasSkill(SkillTag tag) {
        return Boolean.TRUE.equals(skills.get(tag.getKey()));
    }

    public List<ExperienceEntry> getExperience() {
        return experience;
    }

    public String getNotes() {
        return notes;
    }

    public double getConfidence() {
        return confidence;
    }
}
