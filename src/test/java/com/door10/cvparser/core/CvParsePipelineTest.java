/*
 * Copyright © 2025 Door 10. All Rights Reserved.
 */
package com.door10.cvparser.core;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.door10.cvparser.LogLevel;
import com.door10.cvparser.core.candidate.CandidateInfo;
import com.door10.cvparser.core.extraction.ExtractionResult;
import com.door10.cvparser.core.extraction.ExtractionUtil;
import com.door10.cvparser.core.extraction.PlainTextExtractor;
import com.door10.cvparser.core.extraction.TextExtractor;
import com.door10.cvparser.core.remote.RemoteDelegation;
import com.door10.cvparser.core.remote.RemoteParseResponse;
import com.door10.cvparser.core.remote.RemoteParser;
import com.door10.cvparser.core.remote.RemoteParserFactory;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class CvParsePipelineTest {

    private static final DocumentInputs PDF = new DocumentInputs("%PDF-1.4".getBytes(StandardCharsets.UTF_8),
        ExtractionUtil.MIME_PDF, "cv.pdf");

    private static final String CV = "Adam Pritchard\n" +
        "adam@door10.co.uk\n" +
        "+44 20 7123 4567\n" +
        "Director at Door 10, 2020\u2013present\n" +
        "Worked on public affairs and policy campaigns for clients.";

    private final List<String> calls = new ArrayList<>();

    @Test
    void runsInPriorityOrder() {
        CvParsePipeline pipeline = newPipeline(
            FakeTextExtractor.succeeding("fallback", 10, 0.3, 200, calls),
            FakeTextExtractor.succeeding("first", 1, 0.1, 50, calls),
            FakeTextExtractor.succeeding("second", 1, 0.1, 60, calls),
            FakeTextExtractor.succeeding("ocr", 2, 0.1, 70, calls)
        );

        assertEquals(Arrays.asList("first", "second", "ocr", "fallback"),
            pipeline.getExtractors().stream().map(TextExtractor::getName).collect(Collectors.toList()),
            "Extractors with the same priority keep the order they were registered in.");

        ParseOutcome outcome = pipeline.parse(PDF);
        assertEquals(Arrays.asList("first", "second", "ocr", "fallback"), calls);
        assertEquals(4, outcome.getAllResults().size());
        assertEquals("fallback", outcome.getAdapterName(), "Highest confidence wins.");
        assertTrue(outcome.getErrors().isEmpty());
    }

    @Test
    void earlyStop() {
        CvParsePipeline pipeline = newPipeline(
            FakeTextExtractor.succeeding("pdfbox", 1, 0.8, 1500, calls),
            FakeTextExtractor.succeeding("ocr", 2, 0.9, 3000, calls),
            FakeTextExtractor.succeeding("tika", 10, 0.9, 3000, calls)
        );

        ParseOutcome outcome = pipeline.parse(PDF);
        assertEquals(Collections.singletonList("pdfbox"), calls,
            "A result with confidence over 0.7 and over 500 characters ends the chain.");
        assertEquals("pdfbox", outcome.getAdapterName());
        assertEquals(1, outcome.getAllResults().size());
    }

    @Test
    void noEarlyStopForShortText() {
        CvParsePipeline pipeline = newPipeline(
            FakeTextExtractor.succeeding("pdfbox", 1, 0.8, 500, calls),
            FakeTextExtractor.succeeding("tika", 10, 0.3, 300, calls)
        );
        pipeline.parse(PDF);
        assertEquals(Arrays.asList("pdfbox", "tika"), calls, "500 characters is not more than 500.");
    }

    @Test
    void noEarlyStopAtThreshold() {
        CvParsePipeline pipeline = newPipeline(
            FakeTextExtractor.succeeding("pdfbox", 1, 0.7, 5000, calls),
            FakeTextExtractor.succeeding("tika", 10, 0.3, 300, calls)
        );
        pipeline.parse(PDF);
        assertEquals(Arrays.asList("pdfbox", "tika"), calls, "A confidence of exactly 0.7 is not enough.");
    }

    @Test
    void skipsExtractorsThatCannotHandleInput() {
        CvParsePipeline pipeline = newPipeline(
            FakeTextExtractor.declining("word", 1, calls),
            FakeTextExtractor.succeeding("tika", 10, CV, 0.3, calls)
        );
        ParseOutcome outcome = pipeline.parse(PDF);
        assertEquals(Collections.singletonList("tika"), calls);
        assertTrue(outcome.getErrors().isEmpty(), "Declining a file is not an error.");
    }

    @Test
    void failuresAreRecordedAndNotFatal() {
        CvParsePipeline pipeline = newPipeline(
            FakeTextExtractor.failing("pdfbox", 1, "Unable to extract text; file: cv.pdf; cause: bad xref", calls),
            FakeTextExtractor.failing("ocr", 2, new IllegalStateException("native library missing"), calls),
            FakeTextExtractor.succeeding("tika", 10, CV, 0.3, calls)
        );

        ParseOutcome outcome = pipeline.parse(PDF);
        assertEquals("tika", outcome.getAdapterName());
        assertEquals(CV, outcome.getText());
        assertEquals(2, outcome.getErrors().size());
        assertEquals("pdfbox: Unable to extract text; file: cv.pdf; cause: bad xref", outcome.getErrors().get(0).toString());
        assertEquals("ocr", outcome.getErrors().get(1).getAdapterName(),
            "An unexpected exception from an extractor is recorded like any other failure.");
        assertEquals("native library missing", outcome.getErrors().get(1).getMessage());

        assertEquals("Adam", outcome.getCandidate().getFirstName());
        assertEquals("Pritchard", outcome.getCandidate().getLastName());
        assertEquals(1, outcome.getCandidate().getExperience().size());
    }

    @Test
    void allFail() {
        CvParsePipeline pipeline = newPipeline(
            FakeTextExtractor.failing("pdfbox", 1, "broken", calls),
            FakeTextExtractor.declining("word", 1, calls),
            FakeTextExtractor.failing("tika", 10, "also broken", calls)
        );

        AllAdaptersFailedException ex = assertThrows(AllAdaptersFailedException.class, () -> pipeline.parse(PDF));
        assertEquals("All parsing methods failed. Errors: pdfbox: broken, tika: also broken", ex.getMessage());
        assertEquals(2, ex.getErrors().size());
    }

    @Test
    void nothingCanHandleInput() {
        CvParsePipeline pipeline = newPipeline(FakeTextExtractor.declining("word", 1, calls));
        AllAdaptersFailedException ex = assertThrows(AllAdaptersFailedException.class, () -> pipeline.parse(PDF));
        assertEquals("All parsing methods failed. Errors: ", ex.getMessage());
        assertTrue(ex.getErrors().isEmpty());
    }

    @Test
    void durationIsStamped() {
        CvParsePipeline pipeline = newPipeline(FakeTextExtractor.succeeding("tika", 10, 0.1, 10, calls));
        ParseOutcome outcome = pipeline.parse(PDF);
        assertTrue(outcome.getDurationMs() >= 0);
        assertSame(outcome.getBestResult(), outcome.getAllResults().get(0));
    }

    @Test
    void conclusiveRemoteResultSkipsLocalExtractors() {
        RemoteParserFactory.MockRemoteParser remote = newMockRemote("Adam Pritchard\nadam@door10.co.uk\n" +
            "Director at Door 10, 2020\u2013present\n".repeat(60));
        CvParsePipeline pipeline = newPipeline(remote, FakeTextExtractor.succeeding("pdfbox", 1, 0.9, 3000, calls));

        ParseOutcome outcome = pipeline.parse(PDF);
        assertEquals("remote", outcome.getAdapterName());
        assertTrue(calls.isEmpty(), "No local extractor runs once the remote service returns a strong result.");
        assertEquals(1, remote.getTimesInvoked());
        assertEquals("adam@door10.co.uk", outcome.getCandidate().getEmail());
        assertEquals(60, outcome.getCandidate().getExperience().size());
    }

    @Test
    void weakRemoteResultCompetesWithLocalResults() {
        RemoteParserFactory.MockRemoteParser remote = newMockRemote("Adam Pritchard\n" + "x".repeat(200));
        CvParsePipeline pipeline = newPipeline(remote, FakeTextExtractor.succeeding("pdfbox", 1, 0.8, 1500, calls));

        ParseOutcome outcome = pipeline.parse(PDF);
        assertEquals(Collections.singletonList("pdfbox"), calls);
        assertEquals(Arrays.asList("remote", "pdfbox"),
            outcome.getAllResults().stream().map(ExtractionResult::getAdapterName).collect(Collectors.toList()));
        assertEquals("pdfbox", outcome.getAdapterName());
    }

    @Test
    void remoteFailureFallsBackToLocal() {
        RemoteParserFactory.MockRemoteParser remote =
            new RemoteParserFactory.MockRemoteParser("{\"success\": false, \"message\": \"CV parsing service is unavailable\"}");
        CvParsePipeline pipeline = newPipeline(remote, FakeTextExtractor.succeeding("tika", 10, CV, 0.3, calls));

        ParseOutcome outcome = pipeline.parse(PDF);
        assertEquals("tika", outcome.getAdapterName());
        assertEquals(1, outcome.getErrors().size());
        assertEquals("remote: CV parsing service is unavailable", outcome.getErrors().get(0).toString());
    }

    @Test
    void remoteNotCalledForUnsupportedType() {
        RemoteParserFactory.MockRemoteParser remote = newMockRemote("text");
        CvParsePipeline pipeline = newPipeline(remote, FakeTextExtractor.succeeding("text", 1, CV, 0.3, calls));

        pipeline.parse(new DocumentInputs(CV.getBytes(StandardCharsets.UTF_8), ExtractionUtil.MIME_TEXT, "cv.txt"));
        assertEquals(0, remote.getTimesInvoked());
    }

    @Test
    void remoteAndLocalBothFail() {
        RemoteParserFactory.MockRemoteParser remote = new RemoteParserFactory.MockRemoteParser("{\"success\": false}");
        CvParsePipeline pipeline = newPipeline(remote, FakeTextExtractor.failing("pdfbox", 1, "broken", calls));

        AllAdaptersFailedException ex = assertThrows(AllAdaptersFailedException.class, () -> pipeline.parse(PDF));
        assertEquals("All parsing methods failed. Errors: remote: CV parsing failed, pdfbox: broken", ex.getMessage());
    }

    @Test
    void closeClosesRemoteParser() {
        RemoteParserFactory.MockRemoteParser remote = newMockRemote("text");
        newPipeline(remote).close();
        assertTrue(remote.isClosed());
    }

    @Test
    void quietLogLevel() {
        Logger logger = (Logger) LoggerFactory.getLogger("com.door10.cvparser");
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        try {
            CvParsePipeline pipeline = new CvParsePipeline(
                Collections.singletonList(FakeTextExtractor.succeeding("tika", 10, CV, 0.3, calls)), null, LogLevel.ERROR);
            assertEquals("tika", pipeline.parse(PDF).getAdapterName());
        } finally {
            logger.detachAppender(appender);
        }
        assertEquals(Collections.emptyList(), appender.list,
            "At the error level, neither the pipeline nor candidate extraction writes progress messages.");
    }

    @Test
    void emptyResultDoesNotBeatResultWithText() {
        CvParsePipeline pipeline = newPipeline(
            FakeTextExtractor.succeeding("pdfbox", 1, "", 0.1, calls),
            FakeTextExtractor.succeeding("tika", 10, "Jane Smith\nPolicy advisor with experience", 0.1, calls)
        );

        ParseOutcome outcome = pipeline.parse(PDF);
        assertEquals(2, outcome.getAllResults().size());
        assertEquals("tika", outcome.getAdapterName(),
            "Confidence and length are within tolerance and durations tie, but an empty result is never preferred " +
                "over one with text.");
        assertFalse(outcome.getText().isEmpty());
        assertEquals("Jane", outcome.getCandidate().getFirstName());
    }

    @Test
    void onlyEmptyResults() {
        CvParsePipeline pipeline = newPipeline(
            FakeTextExtractor.succeeding("pdfbox", 1, "", 0.1, calls),
            FakeTextExtractor.succeeding("tika", 10, "", 0.1, calls)
        );

        ParseOutcome outcome = pipeline.parse(PDF);
        assertEquals("pdfbox", outcome.getAdapterName(), "When every result is empty, the usual ordering applies.");
        assertEquals("", outcome.getText());
    }

    @Test
    void unexpectedRemoteErrorFallsBackToLocal() {
        RemoteParser brokenClient = new RemoteParser() {
            @Override
            public RemoteParseResponse parse(DocumentInputs inputs) {
                throw new IllegalStateException("pool shut down");
            }

            @Override
            public boolean healthCheck() {
                return false;
            }

            @Override
            public List<String> getSupportedFormats() {
                return Collections.emptyList();
            }

            @Override
            public void close() {
            }
        };
        CvParsePipeline pipeline = new CvParsePipeline(
            Collections.singletonList(FakeTextExtractor.succeeding("tika", 10, CV, 0.3, calls)),
            new RemoteDelegation(brokenClient), LogLevel.DEBUG);

        ParseOutcome outcome = pipeline.parse(PDF);
        assertEquals("tika", outcome.getAdapterName(),
            "Any failure of the remote call, not just a service error, falls back to the local extractors.");
        assertEquals(1, outcome.getErrors().size());
        assertEquals("remote: pool shut down", outcome.getErrors().get(0).toString());
    }

    @Test
    void fullLengthCvThroughPlainTextExtractor() {
        String cv = "Adam Pritchard\n" +
            "adam@door10.co.uk\n" +
            "+44 20 7123 4567\n" +
            "Director at Door 10, 2020\u2013present\n" +
            "Worked on public affairs and policy campaigns for clients.\n" +
            "Led stakeholder engagement programmes for charities, trade bodies and local government.\n" +
            "Prepared briefings for ministers and select committees on housing and transport.\n" +
            "Comfortable working with journalists, policy researchers and campaign teams under tight deadlines.";
        assertTrue(cv.length() > 300);

        CvParsePipeline pipeline = newPipeline(new PlainTextExtractor());
        ParseOutcome outcome = pipeline.parse(
            new DocumentInputs(cv.getBytes(StandardCharsets.UTF_8), ExtractionUtil.MIME_TEXT, "cv.txt"));

        assertEquals("text", outcome.getAdapterName());
        CandidateInfo candidate = outcome.getCandidate();
        assertEquals("Adam", candidate.getFirstName());
        assertEquals("Pritchard", candidate.getLastName());
        assertEquals("adam@door10.co.uk", candidate.getEmail());
        assertEquals(1, candidate.getExperience().size());
        assertTrue(candidate.getConfidence() > 0.3,
            "Past 300 characters the low-yield cap no longer applies; was: " + candidate.getConfidence());
    }

    private CvParsePipeline newPipeline(TextExtractor... extractors) {
        return new CvParsePipeline(Arrays.asList(extractors), null, LogLevel.DEBUG);
    }

    private CvParsePipeline newPipeline(RemoteParserFactory.MockRemoteParser remote, TextExtractor... extractors) {
        return new CvParsePipeline(Arrays.asList(extractors), new RemoteDelegation(remote), LogLevel.DEBUG);
    }

    private static RemoteParserFactory.MockRemoteParser newMockRemote(String rawText) {
        String json = String.format("{\"success\": true, \"data\": {\"rawText\": \"%s\"}}", rawText.replace("\n", "\\n"));
        return new RemoteParserFactory.MockRemoteParser(json);
    }
}
