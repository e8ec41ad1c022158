/*
 * Copyright © 2025 Door 10. All Rights Reserved.
 */
package com.door10.cvparser.core.remote;

import com.door10.cvparser.ParserException;

public class RemoteParserException extends ParserException {

    public RemoteParserException(String message) {
        super(message);
    }

    public RemoteParserException(String message, Throwable cause) {
        super(message, cause);
    }
}
