/*
 * Copyright © 2025 Door 10. All Rights Reserved.
 */
package com.door10.cvparser.core.extraction;

import com.door10.cvparser.core.DocumentInputs;
import org.apache.poi.UnsupportedFileFormatException;
import org.apache.poi.ooxml.POIXMLException;
import org.apache.poi.xwpf.extractor.XWPFWordExtractor;
import org.apache.poi.xwpf.usermodel.XWPFDocument;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Extracts the raw text of a DOCX file via Apache POI. Legacy .doc files are left to the Tika extractor.
 */
public class WordTextExtractor implements TextExtractor {

    static final String NAME = "word";

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
        return inputs.isMimeType(ExtractionUtil.MIME_DOCX) || inputs.hasExtension("docx");
    }

    @Override
    public ExtractionResult extract(DocumentInputs inputs) {
        final byte[] content = ExtractionUtil.requireContent(NAME, inputs);
        // Closing the extractor closes the underlying document as well.
        try (XWPFWordExtractor extractor = new XWPFWordExtractor(new XWPFDocument(new ByteArrayInputStream(content)))) {
            String text = extractor.getText();
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("paragraphs", extractor.getDocument().getParagraphs().size());
            metadata.put("tables", extractor.getDocument().getTables().size());
            return ExtractionUtil.newResult(NAME, text, metadata);
        } catch (IOException | POIXMLException | UnsupportedFileFormatException e) {
            throw new ExtractionException(NAME, inputs, e);
        }
    }
}
