/*
 * Copyright © 2025 Door 10. All Rights Reserved.
 */
package com.door10.cvparser.core.candidate;

import java.util.Objects;

/**
 * A single role as written in the CV. Dates are kept as the strings found in the text; an open-ended role has an
 * end date of "present".
 */
public class ExperienceEntry {

    private final String employer;
    private final String title;
    private final String startDate;
    private final String endDate;

    public ExperienceEntry(String employer, String title, String startDate, String endDate) {
        this.employer = employer;
        this.title = title;
        this.startDate = startDate;
        this.endDate = endDate;
    }

    public String getEmployer() {
        return employer;
    }

    public String getTitle() {
        return title;
    }

    public String getStartDate() {
        return startDate;
    }

    public String getEndDate() {
        return endDate;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ExperienceEntry that = (ExperienceEntry) o;
        return Objects.equals(employer, that.employer) && Objects.equals(title, that.title) &&
            Objects.equals(startDate, that.startDate) && Objects.equals(endDate, that.endDate);
    }

    @Override
    public int hashCode() {
        return Objects.hash(employer, title, startDate, endDate);
    }

    @Override
    public String toString() {
        return String.format("%s at %s (%s-%s)", title, employer, startDate, endDate);
    }
}
