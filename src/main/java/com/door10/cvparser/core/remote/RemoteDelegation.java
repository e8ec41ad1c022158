/*
 * Copyright © 2025 Door 10. All Rights Reserved.
 */
package com.door10.cvparser.core.remote;

import com.door10.cvparser.core.DocumentInputs;
import com.door10.cvparser.core.extraction.ExtractionResult;
import com.door10.cvparser.core.extraction.ExtractionUtil;
import org.apache.commons.io.IOUtils;

import java.io.Closeable;

/**
 * Optional first pass that hands the file to the remote parsing service before any local extractor runs. A single
 * attempt is made; the caller decides what to do with a failure or a weak result.
 */
public class RemoteDelegation implements Closeable {

    public static final String ADAPTER_NAME = "remote";

    /**
     * A remote result scoring above this ends the parse without running any local extractor.
     */
    public static final double SHORT_CIRCUIT_CONFIDENCE = 0.6;

    private final RemoteParser remoteParser;

    public RemoteDelegation(RemoteParser remoteParser) {
        this.remoteParser = remoteParser;
    }

    /**
     * The service only accepts PDF and Word documents, so other types are never sent.
     */
    public boolean supports(DocumentInputs inputs) {
        return inputs.isMimeType(ExtractionUtil.MIME_PDF, ExtractionUtil.MIME_DOCX, ExtractionUtil.MIME_DOC);
    }

    /**
     * @param inputs
     * @return the service's result, tagged "remote" and carrying the wall-clock duration of the call
     * @throws RemoteParserException if the call fails for any reason
     */
    public ExtractionResult delegate(DocumentInputs inputs) {
        long start = System.currentTimeMillis();
        RemoteParseResponse response = remoteParser.parse(inputs);
        ExtractionResult result = ExtractionUtil.newResult(ADAPTER_NAME, response.buildText(), response.buildMetadata());
        return result.withDuration(System.currentTimeMillis() - start);
    }

    public static boolean isConclusive(ExtractionResult result) {
        return result.getConfidence() > SHORT_CIRCUIT_CONFIDENCE;
    }

    @Override
    public void close() {
        IOUtils.closeQuietly(remoteParser);
    }
}
