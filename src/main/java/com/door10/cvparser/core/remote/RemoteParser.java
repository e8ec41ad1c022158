/*
 * Copyright © 2025 Door 10. All Rights Reserved.
 */
package com.door10.cvparser.core.remote;

import com.door10.cvparser.core.DocumentInputs;

import java.io.Closeable;
import java.util.List;

/**
 * Provides an abstraction over the call to the remote CV parsing service. Main use case is to enable easy mocking
 * of the service for testing purposes.
 */
public interface RemoteParser extends Closeable {

    /**
     * @param inputs
     * @return the service's response; never one that reports failure
     * @throws RemoteParserException if the service cannot be reached, rejects the file, or reports a failure
     */
    RemoteParseResponse parse(DocumentInputs inputs);

    /**
     * @return true if the service reports itself healthy; false on any failure
     */
    boolean healthCheck();

    /**
     * @return the formats the service reports it supports; empty on any failure
     */
    List<String> getSupportedFormats();
}
