/*
 * Copyright © 2025 Door 10. All Rights Reserved.
 */
package com.door10.cvparser.core.remote;

import com.door10.cvparser.core.DocumentInputs;
import com.door10.cvparser.core.extraction.ExtractionResult;
import com.door10.cvparser.core.extraction.ExtractionUtil;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RemoteDelegationTest {

    @Test
    void supports() {
        RemoteDelegation delegation = new RemoteDelegation(new RemoteParserFactory.MockRemoteParser("{}"));
        assertTrue(delegation.supports(new DocumentInputs(new byte[1], ExtractionUtil.MIME_PDF, null)));
        assertTrue(delegation.supports(new DocumentInputs(new byte[1], ExtractionUtil.MIME_DOCX, null)));
        assertTrue(delegation.supports(new DocumentInputs(new byte[1], ExtractionUtil.MIME_DOC, null)));
        assertFalse(delegation.supports(new DocumentInputs(new byte[1], ExtractionUtil.MIME_TEXT, "cv.txt")));
        assertFalse(delegation.supports(new DocumentInputs(new byte[1], null, "cv.pdf")),
            "Only the declared MIME type is considered when deciding whether to call the service.");
    }

    @Test
    void delegateWithRawText() {
        RemoteParserFactory.MockRemoteParser mock =
            new RemoteParserFactory.MockRemoteParser(RemoteParseResponseTest.newResponse(true).toString());
        RemoteDelegation delegation = new RemoteDelegation(mock);

        ExtractionResult result = delegation.delegate(new DocumentInputs(new byte[1], ExtractionUtil.MIME_PDF, "cv.pdf"));
        assertEquals("remote", result.getAdapterName());
        assertTrue(result.getText().startsWith("Adam Pritchard\nadam@door10.co.uk\nDirector at Door 10"));
        assertTrue(result.getTextLength() > 2000);
        assertEquals(0.9, result.getConfidence(), "Remote text is scored by length like any other result.");
        assertTrue(RemoteDelegation.isConclusive(result));
        assertEquals("remote", result.getMetadata().get("source"));
        assertEquals(1, mock.getTimesInvoked());
    }

    @Test
    void delegateWithStructuredDataOnly() {
        RemoteDelegation delegation = new RemoteDelegation(
            new RemoteParserFactory.MockRemoteParser(RemoteParseResponseTest.newResponse(false).toString()));
        ExtractionResult result = delegation.delegate(new DocumentInputs(new byte[1], ExtractionUtil.MIME_PDF, "cv.pdf"));
        assertEquals(0.3, result.getConfidence(),
            "The assembled text is short, so the result is not trusted enough to skip the local extractors.");
        assertFalse(RemoteDelegation.isConclusive(result));
        assertEquals(1.0, result.getMetadata().get("structuredConfidence"));
    }

    @Test
    void failure() {
        RemoteDelegation delegation = new RemoteDelegation(
            new RemoteParserFactory.MockRemoteParser("{\"success\": false, \"message\": \"Service busy\"}"));
        RemoteParserException ex = assertThrows(RemoteParserException.class,
            () -> delegation.delegate(new DocumentInputs(new byte[1], ExtractionUtil.MIME_PDF, "cv.pdf")));
        assertEquals("Service busy", ex.getMessage());
    }

    @Test
    void isConclusive() {
        assertFalse(RemoteDelegation.isConclusive(new ExtractionResult("text", 0.6, null, "remote")),
            "The threshold itself is not enough.");
        assertTrue(RemoteDelegation.isConclusive(new ExtractionResult("text", 0.8, null, "remote")));
    }

    @Test
    void close() {
        RemoteParserFactory.MockRemoteParser mock = new RemoteParserFactory.MockRemoteParser("{}");
        new RemoteDelegation(mock).close();
        assertTrue(mock.isClosed());
    }
}
