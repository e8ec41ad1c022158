/*
 * Copyright © 2025 Door 10. All Rights Reserved.
 */
package com.door10.cvparser.core.extraction;

import com.door10.cvparser.core.DocumentInputs;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.text.PDFTextStripper;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads the text layer of a PDF. Returns little or no text for scanned PDFs, which is what the OCR extractor is
 * for.
 */
public class PdfBoxTextExtractor implements TextExtractor {

    static final String NAME = "pdfbox";

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
        return ExtractionUtil.isPdf(inputs);
    }

    @Override
    public ExtractionResult extract(DocumentInputs inputs) {
        final byte[] content = ExtractionUtil.requireContent(NAME, inputs);
        try (PDDocument document = Loader.loadPDF(content)) {
            String text = new PDFTextStripper().getText(document);
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("pages", document.getNumberOfPages());
            PDDocumentInformation info = document.getDocumentInformation();
            if (info != null) {
                ExtractionUtil.putIfPresent(metadata, "title", info.getTitle());
                ExtractionUtil.putIfPresent(metadata, "author", info.getAuthor());
                ExtractionUtil.putIfPresent(metadata, "producer", info.getProducer());
            }
            return ExtractionUtil.newResult(NAME, text, metadata);
        } catch (IOException e) {
            throw new ExtractionException(NAME, inputs, e);
        }
    }
}
