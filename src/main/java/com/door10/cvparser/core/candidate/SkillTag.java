/*
 * Copyright © 2025 Door 10. All Rights Reserved.
 */
package com.door10.cvparser.core.candidate;

import java.util.regex.Pattern;

/**
 * The skill areas a candidate is tagged with. Each tag is set independently when any of its keywords occurs
 * anywhere in the text. Keywords match as substrings, so short ones such as "pr" also fire inside unrelated words.
 */
public enum SkillTag {

    COMMUNICATIONS("communications",
        "communications?|comms?|media|press|pr|public relations|marketing|social media|content|writing|editorial"),
    CAMPAIGNS("campaigns",
        "campaigns?|advocacy|engagement|grassroots|activism|outreach|community|organizing|mobilization"),
    POLICY("policy",
        "policy|policies|briefing|consultation|legislative|regulatory|government|public policy|research|analysis"),
    PUBLIC_AFFAIRS("publicAffairs",
        "public affairs|government affairs|parliamentary|stakeholder relations|lobbying|government relations|political|advocacy");

    private final String key;
    private final Pattern pattern;

    SkillTag(String key, String keywords) {
        this.key = key;
        this.pattern = Pattern.compile(keywords, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    /**
     * @return the name under which the tag appears in {@link CandidateInfo#getSkills()}
     */
    public String getKey() {
        return key;
    }

    public boolean matches(String text) {
        return pattern.matcher(text).find();
    }
}
