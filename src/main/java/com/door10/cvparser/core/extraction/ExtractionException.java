/*
 * Copyright © 2025 Door 10. All Rights Reserved.
 */
package com.door10.cvparser.core.extraction;

import com.door10.cvparser.ParserException;
import com.door10.cvparser.core.DocumentInputs;

public class ExtractionException extends ParserException {

    private final String adapterName;

    public ExtractionException(String adapterName, String message) {
        super(message);
        this.adapterName = adapterName;
    }

    public ExtractionException(String adapterName, DocumentInputs inputs, Throwable cause) {
        super(String.format("Unable to extract text; file: %s; cause: %s", inputs.getDisplayName(), cause.getMessage()), cause);
        this.adapterName = adapterName;
    }

    public String getAdapterName() {
        return adapterName;
    }
}
