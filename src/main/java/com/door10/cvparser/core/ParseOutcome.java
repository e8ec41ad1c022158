/*
 * Copyright © 2025 Door 10. All Rights Reserved.
 */
package com.door10.cvparser.core;

import com.door10.cvparser.core.candidate.CandidateInfo;
import com.door10.cvparser.core.extraction.ExtractionResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * What a successful parse returns: the winning extraction, the candidate details derived from its text, and every
 * result and error collected along the way, in the order the attempts were made.
 */
public class ParseOutcome {

    private final ExtractionResult bestResult;
    private final CandidateInfo candidate;
    private final List<ExtractionResult> allResults;
    private final List<AdapterAttemptError> errors;

    public ParseOutcome(ExtractionResult bestResult, CandidateInfo candidate, List<ExtractionResult> allResults,
                        List<AdapterAttemptError> errors) {
        this.bestResult = bestResult;
        this.candidate = candidate;
        this.allResults = Collections.unmodifiableList(new ArrayList<>(allResults));
        this.errors = Collections.unmodifiableList(new ArrayList<>(errors));
    }

    public ExtractionResult getBestResult() {
        return bestResult;
    }

    public String getText() {
        return bestResult.getText();
    }

    /**
     * @return the confidence of the text extraction; see {@link CandidateInfo#getConfidence()} for the confidence of
     * the candidate details
     */
    public double getConfidence() {
        return bestResult.getConfidence();
    }

    public Map<String, Object> getMetadata() {
        return bestResult.getMetadata();
    }

    public String getAdapterName() {
        return bestResult.getAdapterName();
    }

    public long getDurationMs() {
        return bestResult.getDurationMs();
    }

    public CandidateInfo getCandidate() {
        return candidate;
    }

    public List<ExtractionResult> getAllResults() {
        return allResults;
    }

    public List<AdapterAttemptError> getErrors() {
        return errors;
    }
}
