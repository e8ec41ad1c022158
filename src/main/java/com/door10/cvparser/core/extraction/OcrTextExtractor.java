/*
 * Copyright © 2025 Door 10. All Rights Reserved.
 */
package com.door10.cvparser.core.extraction;

import com.door10.cvparser.core.DocumentInputs;
import org.apache.tika.exception.TikaException;
import org.apache.tika.io.TikaInputStream;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.TikaCoreProperties;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.parser.Parser;
import org.apache.tika.parser.ocr.TesseractOCRConfig;
import org.apache.tika.parser.pdf.PDFParserConfig;
import org.apache.tika.sax.BodyContentHandler;
import org.xml.sax.SAXException;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Runs Tesseract, via Tika, over scanned PDFs and images. Requires the tesseract binary on the path, and is
 * slow, so it only takes part when OCR has been enabled in the configuration. If Tesseract is missing, Tika
 * typically yields empty text, which surfaces as a low-confidence result rather than an error.
 */
public class OcrTextExtractor implements TextExtractor {

    static final String NAME = "tesseract-ocr";

    private final boolean enabled;
    private final String language;
    private final Parser parser = new AutoDetectParser();

    public OcrTextExtractor(boolean enabled, String language) {
        this.enabled = enabled;
        this.language = language;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public int getPriority() {
        return 2;
    }

    @Override
    public boolean canHandle(DocumentInputs inputs) {
        if (!enabled) {
            return false;
        }
        return ExtractionUtil.isPdf(inputs) || isImage(inputs);
    }

    @Override
    public ExtractionResult extract(DocumentInputs inputs) {
        final byte[] content = ExtractionUtil.requireContent(NAME, inputs);
        Metadata tikaMetadata = new Metadata();
        if (inputs.getFilename() != null) {
            tikaMetadata.set(TikaCoreProperties.RESOURCE_NAME_KEY, inputs.getFilename());
        }
        BodyContentHandler handler = new BodyContentHandler(-1);
        try (InputStream stream = TikaInputStream.get(content)) {
            parser.parse(stream, handler, tikaMetadata, newParseContext());
        } catch (IOException | SAXException | TikaException e) {
            throw new ExtractionException(NAME, inputs, e);
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("method", "ocr");
        metadata.put("language", language);
        return ExtractionUtil.newResult(NAME, handler.toString(), metadata);
    }

    private ParseContext newParseContext() {
        TesseractOCRConfig ocrConfig = new TesseractOCRConfig();
        ocrConfig.setLanguage(language);

        // Ignore any text layer; the format-specific extractor has already had its chance at that.
        PDFParserConfig pdfConfig = new PDFParserConfig();
        pdfConfig.setOcrStrategy(PDFParserConfig.OCR_STRATEGY.OCR_ONLY);

        ParseContext context = new ParseContext();
        context.set(TesseractOCRConfig.class, ocrConfig);
        context.set(PDFParserConfig.class, pdfConfig);
        context.set(Parser.class, parser);
        return context;
    }

    private static boolean isImage(DocumentInputs inputs) {
        return (inputs.getMimeType() != null && inputs.getMimeType().toLowerCase(Locale.ROOT).startsWith("image/")) ||
            inputs.hasExtension("png", "jpg", "jpeg", "tif", "tiff");
    }
}
