/*
 * Copyright © 2025 Door 10. All Rights Reserved.
 */
package com.door10.cvparser.core.remote;

import com.door10.cvparser.Context;
import com.door10.cvparser.Options;
import com.door10.cvparser.ParserException;
import com.door10.cvparser.Util;
import com.door10.cvparser.core.DocumentInputs;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

public abstract class RemoteParserFactory {

    public static final String MOCK_REMOTE_RESPONSE_OPTION = "cvparser.testing.mockRemoteResponse";

    /**
     * @param context
     * @return null when remote delegation is not enabled
     */
    public static RemoteParser newRemoteParser(Context context) {
        if (!context.getBooleanOption(Options.REMOTE_ENABLED, false)) {
            return null;
        }
        if (context.hasOption(MOCK_REMOTE_RESPONSE_OPTION)) {
            String mockResponse = context.getStringOption(MOCK_REMOTE_RESPONSE_OPTION);
            Objects.requireNonNull(mockResponse);
            return new MockRemoteParser(mockResponse);
        }
        ConfigHelper configHelper = new ConfigHelper(context);
        return new RemoteParserImpl(configHelper.getBaseUrl(), configHelper.buildHttpClient(), context.getLogLevel());
    }

    public static class ConfigHelper {
        private final String baseUrl;
        private final long callTimeoutSeconds;
        private final long connectTimeoutSeconds;

        public ConfigHelper(Context context) {
            String url = context.getStringOption(Options.REMOTE_URL);
            if (url == null) {
                throw new ParserException(String.format("Must specify '%s' when '%s' is true.",
                    Options.REMOTE_URL, Options.REMOTE_ENABLED));
            }
            if (HttpUrl.parse(url) == null) {
                throw new ParserException(String.format("The value of '%s' must be an http or https URL; was: %s",
                    Options.REMOTE_URL, url));
            }
            this.baseUrl = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
            this.callTimeoutSeconds = context.getNumericOption(Options.REMOTE_TIMEOUT_SECONDS, 30, 1);
            this.connectTimeoutSeconds = context.getNumericOption(Options.REMOTE_CONNECT_TIMEOUT_SECONDS, 10, 1);

            if (context.getLogLevel().isInfoEnabled(Util.MAIN_LOGGER)) {
                Util.MAIN_LOGGER.info("Will delegate CV parsing to {}", this.baseUrl);
            }
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public long getCallTimeoutSeconds() {
            return callTimeoutSeconds;
        }

        public long getConnectTimeoutSeconds() {
            return connectTimeoutSeconds;
        }

        public OkHttpClient buildHttpClient() {
            return new OkHttpClient.Builder()
                .connectTimeout(connectTimeoutSeconds, TimeUnit.SECONDS)
                .callTimeout(callTimeoutSeconds, TimeUnit.SECONDS)
                .build();
        }
    }

    private RemoteParserFactory() {
    }

    /**
     * Returns a canned JSON response instead of calling the service. A canned response reporting failure makes
     * every parse fail the way the real service would.
     */
    public static class MockRemoteParser implements RemoteParser {

        private final JsonNode mockResponse;
        private int timesInvoked;
        private boolean closed;

        public MockRemoteParser(String mockResponse) {
            try {
                this.mockResponse = new ObjectMapper().readTree(mockResponse);
            } catch (JsonProcessingException e) {
                throw new ParserException(String.format("Unable to parse mock remote response; cause: %s", e.getMessage()), e);
            }
        }

        @Override
        public synchronized RemoteParseResponse parse(DocumentInputs inputs) {
            timesInvoked++;
            return RemoteParseResponse.fromSuccessfulJson(mockResponse);
        }

        @Override
        public boolean healthCheck() {
            return true;
        }

        @Override
        public List<String> getSupportedFormats() {
            return Collections.emptyList();
        }

        @Override
        public synchronized void close() {
            closed = true;
        }

        public synchronized int getTimesInvoked() {
            return timesInvoked;
        }

        public synchronized boolean isClosed() {
            return closed;
        }
    }
}
