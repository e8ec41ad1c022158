/*
 * Copyright © 2025 Door 10. All Rights Reserved.
 */
package com.door10.cvparser.core.extraction;

import com.door10.cvparser.core.DocumentInputs;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Decodes plain text as UTF-8. Invalid byte sequences become replacement characters rather than failing.
 */
public class PlainTextExtractor implements TextExtractor {

    static final String NAME = "text";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public int getPriority() {
        return 1;
    }

    @Override
    public boolean canHandle(DocumentInputs inputs) {
        return inputs.isMimeType(ExtractionUtil.MIME_TEXT) || inputs.hasExtension("txt");
    }

    @Override
    public ExtractionResult extract(DocumentInputs inputs) {
        final byte[] content = ExtractionUtil.requireContent(NAME, inputs);
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("encoding", "utf8");
        return ExtractionUtil.newResult(NAME, new String(content, StandardCharsets.UTF_8), metadata);
    }
}
