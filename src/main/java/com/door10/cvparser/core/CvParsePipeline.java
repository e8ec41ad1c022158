/*
 * Copyright © 2025 Door 10. All Rights Reserved.
 */
package com.door10.cvparser.core;

import com.door10.cvparser.LogLevel;
import com.door10.cvparser.Util;
import com.door10.cvparser.core.candidate.CandidateFieldExtractor;
import com.door10.cvparser.core.candidate.CandidateInfo;
import com.door10.cvparser.core.extraction.BestResultSelector;
import com.door10.cvparser.core.extraction.ExtractionResult;
import com.door10.cvparser.core.extraction.TextExtractor;
import com.door10.cvparser.core.remote.RemoteDelegation;

import java.io.Closeable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Handles parsing a single uploaded file: optionally delegates to the remote service, then tries each local
 * extractor in priority order, picks the best result, and derives candidate details from its text.
 * <p>
 * Any one extractor failing is expected and only recorded; the parse fails only when nothing produced a result.
 * Extractors run one at a time because whether a later, slower one runs at all depends on what the earlier ones
 * returned. All state of a parse is local to the call, so one pipeline can serve concurrent calls.
 */
public class CvParsePipeline implements Closeable {

    /**
     * A result better than this, with more text than {@link #EARLY_STOP_LENGTH}, ends the local chain.
     */
    static final double EARLY_STOP_CONFIDENCE = 0.7;
    static final int EARLY_STOP_LENGTH = 500;

    enum State {
        DELEGATING, LOCAL_PROBING, SELECTING, EXTRACTING, DONE, FAILED
    }

    private final List<TextExtractor> extractors;
    private final RemoteDelegation remoteDelegation;
    private final LogLevel logLevel;

    /**
     * @param extractors       tried in ascending priority; equal priorities keep the given order
     * @param remoteDelegation null to never call the remote service
     * @param logLevel
     */
    public CvParsePipeline(List<TextExtractor> extractors, RemoteDelegation remoteDelegation, LogLevel logLevel) {
        List<TextExtractor> sorted = new ArrayList<>(extractors);
        sorted.sort(Comparator.comparingInt(TextExtractor::getPriority));
        this.extractors = Collections.unmodifiableList(sorted);
        this.remoteDelegation = remoteDelegation;
        this.logLevel = logLevel != null ? logLevel : LogLevel.INFO;
    }

    /**
     * @param inputs
     * @return the best result and the candidate details derived from it
     * @throws AllAdaptersFailedException if neither the remote service nor any local extractor produced a result
     */
    public ParseOutcome parse(DocumentInputs inputs) {
        if (logLevel.isInfoEnabled(Util.MAIN_LOGGER)) {
            Util.MAIN_LOGGER.info("Starting file parsing: {} ({})", inputs.getDisplayName(), inputs.getMimeType());
        }
        final List<ExtractionResult> results = new ArrayList<>();
        final List<AdapterAttemptError> errors = new ArrayList<>();

        transition(State.DELEGATING, inputs);
        if (remoteDelegation != null && remoteDelegation.supports(inputs)) {
            ExtractionResult remoteResult = delegate(inputs, errors);
            if (remoteResult != null) {
                results.add(remoteResult);
                if (RemoteDelegation.isConclusive(remoteResult)) {
                    if (logLevel.isInfoEnabled(Util.MAIN_LOGGER)) {
                        Util.MAIN_LOGGER.info("High confidence result from remote service, skipping local extractors");
                    }
                    return extractCandidate(inputs, remoteResult, results, errors);
                }
            }
        }

        transition(State.LOCAL_PROBING, inputs);
        for (TextExtractor extractor : extractors) {
            if (!extractor.canHandle(inputs)) {
                continue;
            }
            ExtractionResult result = attempt(extractor, inputs, errors);
            if (result != null) {
                results.add(result);
                if (result.getConfidence() > EARLY_STOP_CONFIDENCE && result.getTextLength() > EARLY_STOP_LENGTH) {
                    if (logLevel.isInfoEnabled(Util.MAIN_LOGGER)) {
                        Util.MAIN_LOGGER.info("High confidence result from {}, stopping pipeline", extractor.getName());
                    }
                    break;
                }
            }
        }

        transition(State.SELECTING, inputs);
        if (results.isEmpty()) {
            transition(State.FAILED, inputs);
            AllAdaptersFailedException ex = new AllAdaptersFailedException(errors);
            if (logLevel.isWarnEnabled(Util.MAIN_LOGGER)) {
                Util.MAIN_LOGGER.warn("Unable to parse {}; {}", inputs.getDisplayName(), ex.getMessage());
            }
            throw ex;
        }
        ExtractionResult best = BestResultSelector.selectBest(withTextIfAny(results));
        if (logLevel.isInfoEnabled(Util.MAIN_LOGGER)) {
            Util.MAIN_LOGGER.info("Selected best result: {} (confidence: {})", best.getAdapterName(),
                String.format("%.2f", best.getConfidence()));
        }
        return extractCandidate(inputs, best, results, errors);
    }

    private ExtractionResult delegate(DocumentInputs inputs, List<AdapterAttemptError> errors) {
        try {
            ExtractionResult result = remoteDelegation.delegate(inputs);
            if (logLevel.isInfoEnabled(Util.MAIN_LOGGER)) {
                Util.MAIN_LOGGER.info("Remote service succeeded: {} chars, confidence: {}, duration: {}ms",
                    result.getTextLength(), String.format("%.2f", result.getConfidence()), result.getDurationMs());
            }
            return result;
        } catch (RuntimeException ex) {
            // Not only RemoteParserException; a broken client must not end the parse either.
            String message = describe(ex);
            errors.add(new AdapterAttemptError(RemoteDelegation.ADAPTER_NAME, message));
            if (logLevel.isWarnEnabled(Util.MAIN_LOGGER)) {
                Util.MAIN_LOGGER.warn("Remote service failed, falling back to local extractors: {}", message);
            }
            return null;
        }
    }

    // Any exception from an extractor, including an unexpected one from a library, only fails that attempt.
    private ExtractionResult attempt(TextExtractor extractor, DocumentInputs inputs, List<AdapterAttemptError> errors) {
        if (logLevel.isDebugEnabled(Util.MAIN_LOGGER)) {
            Util.MAIN_LOGGER.debug("Trying extractor: {}", extractor.getName());
        }
        long start = System.currentTimeMillis();
        try {
            ExtractionResult result = extractor.extract(inputs).withDuration(System.currentTimeMillis() - start);
            if (logLevel.isInfoEnabled(Util.MAIN_LOGGER)) {
                Util.MAIN_LOGGER.info("Extractor {} succeeded: {} chars, confidence: {}, duration: {}ms", extractor.getName(),
                    result.getTextLength(), String.format("%.2f", result.getConfidence()), result.getDurationMs());
            }
            return result;
        } catch (RuntimeException ex) {
            String message = describe(ex);
            errors.add(new AdapterAttemptError(extractor.getName(), message));
            if (logLevel.isDebugEnabled(Util.MAIN_LOGGER)) {
                Util.MAIN_LOGGER.debug("Extractor {} failed: {}", extractor.getName(), message, ex);
            }
            return null;
        }
    }

    /**
     * An empty result, e.g. from PDFBox on a scanned PDF, only competes when every result is empty.
     */
    private static List<ExtractionResult> withTextIfAny(List<ExtractionResult> results) {
        List<ExtractionResult> withText = new ArrayList<>();
        for (ExtractionResult result : results) {
            if (result.getTextLength() > 0) {
                withText.add(result);
            }
        }
        return withText.isEmpty() ? results : withText;
    }

    private static String describe(RuntimeException ex) {
        return ex.getMessage() != null ? ex.getMessage() : ex.getClass().getName();
    }

    private ParseOutcome extractCandidate(DocumentInputs inputs, ExtractionResult best, List<ExtractionResult> results,
                                          List<AdapterAttemptError> errors) {
        transition(State.EXTRACTING, inputs);
        CandidateInfo candidate = CandidateFieldExtractor.extract(best.getText());
        if (logLevel.isDebugEnabled(Util.MAIN_LOGGER)) {
            Util.MAIN_LOGGER.debug("Parsed candidate: {} {}, email: {}, experience: {} entries, confidence: {}",
                candidate.getFirstName(), candidate.getLastName(), candidate.getEmail(),
                candidate.getExperience().size(), String.format("%.2f", candidate.getConfidence()));
        }
        transition(State.DONE, inputs);
        return new ParseOutcome(best, candidate, results, errors);
    }

    private void transition(State state, DocumentInputs inputs) {
        if (logLevel.isDebugEnabled(Util.MAIN_LOGGER)) {
            Util.MAIN_LOGGER.debug("{}: {}", inputs.getDisplayName(), state);
        }
    }

    public List<TextExtractor> getExtractors() {
        return extractors;
    }

    public RemoteDelegation getRemoteDelegation() {
        return remoteDelegation;
    }

    @Override
    public void close() {
        if (remoteDelegation != null) {
            remoteDelegation.close();
        }
    }
}
