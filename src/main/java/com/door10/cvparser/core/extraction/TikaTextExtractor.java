/*
 * Copyright © 2025 Door 10. All Rights Reserved.
 */
package com.door10.cvparser.core.extraction;

import com.door10.cvparser.core.DocumentInputs;
import org.apache.tika.Tika;
import org.apache.tika.exception.TikaException;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.TikaCoreProperties;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Last resort: lets Tika detect the format and extract whatever text it can. Slow compared to the format-specific
 * extractors, so it is registered with the lowest priority and accepts every input.
 */
public class TikaTextExtractor implements TextExtractor {

    static final String NAME = "tika";

    // Tika can be configured via environment variables, so we may not need to offer any dedicated configuration support.
    // See https://tika.apache.org/3.1.0/configuring.html .
    private final Tika tika = new Tika();

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public int getPriority() {
        return 10;
    }

    @Override
    public boolean canHandle(DocumentInputs inputs) {
        return true;
    }

    @Override
    public ExtractionResult extract(DocumentInputs inputs) {
        final byte[] content = ExtractionUtil.requireContent(NAME, inputs);
        try (ByteArrayInputStream stream = new ByteArrayInputStream(content)) {
            Metadata metadata = new Metadata();
            if (inputs.getFilename() != null) {
                metadata.set(TikaCoreProperties.RESOURCE_NAME_KEY, inputs.getFilename());
            }
            if (inputs.getMimeType() != null) {
                metadata.set(Metadata.CONTENT_TYPE, inputs.getMimeType());
            }
            String extractedText = tika.parseToString(stream, metadata);
            // Retain the order of these while dropping known keys that we know are just noise.
            Map<String, Object> map = new LinkedHashMap<>();
            for (String name : metadata.names()) {
                if (!name.equals("pdf:unmappedUnicodeCharsPerPage") && !name.equals("X-TIKA:Parsed-By")) {
                    map.put(name, metadata.get(name));
                }
            }
            map.put("method", NAME);
            return ExtractionUtil.newResult(NAME, extractedText, map);
        } catch (IOException | TikaException e) {
            throw new ExtractionException(NAME, inputs, e);
        }
    }
}
