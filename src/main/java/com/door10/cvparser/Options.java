/*
 * Copyright © 2025 Door 10. All Rights Reserved.
 */
package com.door10.cvparser;

public abstract class Options {

    public static final String OCR_ENABLED = "cvparser.ocr.enabled";

    // Passed to Tesseract as-is, e.g. "eng" or "eng+fra".
    public static final String OCR_LANGUAGE = "cvparser.ocr.language";

    public static final String REMOTE_ENABLED = "cvparser.remote.enabled";
    public static final String REMOTE_URL = "cvparser.remote.url";
    public static final String REMOTE_TIMEOUT_SECONDS = "cvparser.remote.timeoutSeconds";
    public static final String REMOTE_CONNECT_TIMEOUT_SECONDS = "cvparser.remote.connectTimeoutSeconds";

    /**
     * One of "error", "warn", "info", or "debug". Only affects how much the pipeline logs.
     */
    public static final String LOG_LEVEL = "cvparser.logLevel";

    private Options() {
    }
}
