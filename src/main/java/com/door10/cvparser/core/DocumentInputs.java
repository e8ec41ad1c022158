/*
 * Copyright © 2025 Door 10. All Rights Reserved.
 */
package com.door10.cvparser.core;

import java.util.Locale;

/**
 * Captures what a caller hands to the pipeline for a single file: the raw bytes, the MIME type declared by the
 * uploader, and the original filename. Either of the latter two may be null; adapters fall back to whichever one
 * is present.
 */
public class DocumentInputs {

    private final byte[] content;
    private final String mimeType;
    private final String filename;

    public DocumentInputs(byte[] content, String mimeType, String filename) {
        this.content = content;
        this.mimeType = mimeType;
        this.filename = filename;
    }

    public byte[] getContent() {
        return content;
    }

    public boolean hasContent() {
        return content != null && content.length > 0;
    }

    public String getMimeType() {
        return mimeType;
    }

    public String getFilename() {
        return filename;
    }

    public boolean isMimeType(String... candidates) {
        if (mimeType == null) {
            return false;
        }
        final String normalized = normalizeMimeType(mimeType);
        for (String candidate : candidates) {
            if (normalized.equals(candidate)) {
                return true;
            }
        }
        return false;
    }

    public boolean hasExtension(String... extensions) {
        if (filename == null) {
            return false;
        }
        final String lowerCaseName = filename.toLowerCase(Locale.ROOT);
        for (String extension : extensions) {
            if (lowerCaseName.endsWith("." + extension)) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return the filename, or a placeholder suitable for log and error messages when none was given
     */
    public String getDisplayName() {
        return filename != null ? filename : "(unnamed)";
    }

    // Drops parameters such as "; charset=UTF-8" that some clients append.
    private static String normalizeMimeType(String value) {
        int index = value.indexOf(';');
        String base = index > -1 ? value.substring(0, index) : value;
        return base.trim().toLowerCase(Locale.ROOT);
    }
}
