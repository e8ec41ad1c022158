/*
 * Copyright © 2025 Door 10. All Rights Reserved.
 */
package com.door10.cvparser.core;

public class AdapterAttemptError {

    private final String adapterName;
    private final String message;

    public AdapterAttemptError(String adapterName, String message) {
        this.adapterName = adapterName;
        this.message = message;
    }

    public String getAdapterName() {
        return adapterName;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return adapterName + ": " + message;
    }
}
