/*
 * Copyright © 2025 Door 10. All Rights Reserved.
 */
package com.door10.cvparser.core.remote;

import com.door10.cvparser.LogLevel;
import com.door10.cvparser.core.DocumentInputs;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.MediaType;
import okhttp3.MultipartBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.ConnectException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Talks to the remote CV parsing service over HTTP. Thread-safe; the underlying {@code OkHttpClient} shares one
 * connection pool across calls.
 */
class RemoteParserImpl implements RemoteParser {

    static final Logger REMOTE_LOGGER = LoggerFactory.getLogger("com.door10.cvparser.remote");

    static final String PARSE_PATH = "/api/documentparser/parse";
    static final String HEALTH_PATH = "/api/documentparser/health";
    static final String SUPPORTED_FORMATS_PATH = "/api/documentparser/supported-formats";

    private final String baseUrl;
    private final OkHttpClient httpClient;
    private final LogLevel logLevel;
    private final ObjectMapper objectMapper = new ObjectMapper();

    RemoteParserImpl(String baseUrl, OkHttpClient httpClient, LogLevel logLevel) {
        this.baseUrl = baseUrl;
        this.httpClient = httpClient;
        this.logLevel = logLevel;
    }

    @Override
    public RemoteParseResponse parse(DocumentInputs inputs) {
        final String filename = inputs.getFilename() != null ? inputs.getFilename() : "cv";
        final MediaType mediaType = inputs.getMimeType() != null ? MediaType.parse(inputs.getMimeType()) : null;
        final byte[] content = inputs.getContent() != null ? inputs.getContent() : new byte[0];

        RequestBody body = new MultipartBody.Builder()
            .setType(MultipartBody.FORM)
            .addFormDataPart("file", filename, RequestBody.create(content, mediaType))
            .build();
        Request request = new Request.Builder().url(baseUrl + PARSE_PATH).post(body).build();

        if (logLevel.isDebugEnabled(REMOTE_LOGGER)) {
            REMOTE_LOGGER.debug("Sending {} ({} bytes) to {}", filename, content.length, request.url());
        }
        long start = System.currentTimeMillis();
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new RemoteParserException(describeStatus(response.code()));
            }
            JsonNode json = readJson(response);
            if (logLevel.allows(LogLevel.DEBUG) && REMOTE_LOGGER.isTraceEnabled()) {
                REMOTE_LOGGER.trace("Response for {}: {}", filename, json);
            }
            return RemoteParseResponse.fromSuccessfulJson(json);
        } catch (ConnectException e) {
            throw new RemoteParserException("CV parsing service is unavailable", e);
        } catch (InterruptedIOException e) {
            throw new RemoteParserException("CV parsing request timed out", e);
        } catch (JsonProcessingException e) {
            throw new RemoteParserException(String.format("Unable to read response from CV parsing service; cause: %s", e.getMessage()), e);
        } catch (IOException e) {
            throw new RemoteParserException(String.format("Unable to call CV parsing service; cause: %s", e.getMessage()), e);
        } finally {
            if (logLevel.isDebugEnabled(REMOTE_LOGGER)) {
                REMOTE_LOGGER.debug("Time: {}ms; file: {}", System.currentTimeMillis() - start, filename);
            }
        }
    }

    @Override
    public boolean healthCheck() {
        Request request = new Request.Builder().url(baseUrl + HEALTH_PATH).get().build();
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                return false;
            }
            return "Healthy".equals(RemoteParseResponse.field(readJson(response), "status").asText());
        } catch (IOException e) {
            if (logLevel.isWarnEnabled(REMOTE_LOGGER)) {
                REMOTE_LOGGER.warn("Health check of CV parsing service failed: {}", e.getMessage());
            }
            return false;
        }
    }

    @Override
    public List<String> getSupportedFormats() {
        Request request = new Request.Builder().url(baseUrl + SUPPORTED_FORMATS_PATH).get().build();
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                return Collections.emptyList();
            }
            List<String> formats = new ArrayList<>();
            for (JsonNode format : RemoteParseResponse.field(readJson(response), "supportedFormats")) {
                formats.add(format.asText());
            }
            return formats;
        } catch (IOException e) {
            if (logLevel.isWarnEnabled(REMOTE_LOGGER)) {
                REMOTE_LOGGER.warn("Unable to retrieve formats supported by CV parsing service: {}", e.getMessage());
            }
            return Collections.emptyList();
        }
    }

    @Override
    public void close() {
        httpClient.dispatcher().executorService().shutdown();
        httpClient.connectionPool().evictAll();
    }

    static String describeStatus(int code) {
        switch (code) {
            case 413:
                return "File too large for CV parsing service";
            case 415:
                return "Unsupported file type for CV parsing service";
            default:
                return String.format("CV parsing service returned HTTP %d", code);
        }
    }

    private JsonNode readJson(Response response) throws IOException {
        ResponseBody body = response.body();
        String json = body != null ? body.string() : "";
        return json.isEmpty() ? objectMapper.createObjectNode() : objectMapper.readTree(json);
    }
}
