/*
 * Copyright © 2025 Door 10. All Rights Reserved.
 */
package com.door10.cvparser.core;

import com.door10.cvparser.Context;
import com.door10.cvparser.LogLevel;
import com.door10.cvparser.Options;
import com.door10.cvparser.Util;
import com.door10.cvparser.core.extraction.OcrTextExtractor;
import com.door10.cvparser.core.extraction.PdfBoxTextExtractor;
import com.door10.cvparser.core.extraction.PlainTextExtractor;
import com.door10.cvparser.core.extraction.TextExtractor;
import com.door10.cvparser.core.extraction.TikaTextExtractor;
import com.door10.cvparser.core.extraction.WordTextExtractor;
import com.door10.cvparser.core.remote.RemoteDelegation;
import com.door10.cvparser.core.remote.RemoteParser;
import com.door10.cvparser.core.remote.RemoteParserFactory;

import java.util.ArrayList;
import java.util.List;

public abstract class CvParsePipelineFactory {

    public static CvParsePipeline newPipeline(Context context) {
        final LogLevel logLevel = context.getLogLevel();
        final boolean ocrEnabled = context.getBooleanOption(Options.OCR_ENABLED, false);

        List<TextExtractor> extractors = new ArrayList<>();
        extractors.add(new PdfBoxTextExtractor());
        extractors.add(new WordTextExtractor());
        extractors.add(new PlainTextExtractor());
        // Always registered; it declines every file unless OCR is enabled.
        extractors.add(new OcrTextExtractor(ocrEnabled, context.getStringOption(Options.OCR_LANGUAGE, "eng")));
        extractors.add(new TikaTextExtractor());

        final RemoteParser remoteParser = RemoteParserFactory.newRemoteParser(context);
        final RemoteDelegation remoteDelegation = remoteParser != null ? new RemoteDelegation(remoteParser) : null;

        if (logLevel.isDebugEnabled(Util.MAIN_LOGGER)) {
            Util.MAIN_LOGGER.debug("OCR enabled: {}; remote delegation enabled: {}", ocrEnabled, remoteDelegation != null);
        }
        return new CvParsePipeline(extractors, remoteDelegation, logLevel);
    }

    private CvParsePipelineFactory() {
    }
}
