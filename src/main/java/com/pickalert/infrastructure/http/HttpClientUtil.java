package com.pickalert.infrastructure.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.classic.methods.HttpPost;
import org.apache.hc.client5.http.classic.methods.HttpUriRequestBase;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.CloseableHttpResponse;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.ParseException;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.http.io.entity.StringEntity;
import org.apache.hc.core5.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Map;

/**
 * Utility for JSON requests to the draft host and chat APIs.
 */
public class HttpClientUtil {

    private static final Logger logger = LoggerFactory.getLogger(HttpClientUtil.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static final int MAX_LOG_BODY_LENGTH = 500;
    private static final Timeout CONNECT_TIMEOUT = Timeout.ofSeconds(5);
    private static final Timeout RESPONSE_TIMEOUT = Timeout.ofSeconds(10);

    private HttpClientUtil() {
    }

    /**
     * Helper method to log response body preview for debugging.
     */
    private static void logResponseBodyPreview(String responseBody) {
        String preview = responseBody.length() > MAX_LOG_BODY_LENGTH
            ? responseBody.substring(0, MAX_LOG_BODY_LENGTH) + "..."
            : responseBody;
        logger.error("Response body preview: {}", preview);
    }

    private static CloseableHttpClient createClient() {
        return HttpClients.custom()
            .setConnectionManager(PoolingHttpClientConnectionManagerBuilder.create()
                .setDefaultConnectionConfig(ConnectionConfig.custom()
                    .setConnectTimeout(CONNECT_TIMEOUT)
                    .build())
                .build())
            .setDefaultRequestConfig(RequestConfig.custom()
                .setResponseTimeout(RESPONSE_TIMEOUT)
                .build())
            .build();
    }

    /**
     * Makes a GET request and returns the response as JsonNode.
     * A literal {@code null} body is returned as a null node.
     *
     * @throws HttpStatusException for non-2xx responses
     * @throws IOException on transport failures or unparseable bodies
     */
    public static JsonNode getJson(String url, Map<String, String> headers) throws IOException {
        return execute(new HttpGet(url), url, headers);
    }

    /**
     * Makes a POST request with a JSON body and returns the response as JsonNode.
     */
    public static JsonNode postJson(String url, JsonNode body, Map<String, String> headers) throws IOException {
        HttpPost request = new HttpPost(url);
        request.setEntity(new StringEntity(objectMapper.writeValueAsString(body), ContentType.APPLICATION_JSON));
        return execute(request, url, headers);
    }

    private static JsonNode execute(HttpUriRequestBase request, String url, Map<String, String> headers)
            throws IOException {
        if (headers != null) {
            headers.forEach(request::addHeader);
        }

        try (CloseableHttpClient httpClient = createClient();
             CloseableHttpResponse response = httpClient.execute(request)) {
            int statusCode = response.getCode();
            String contentType = null;

            // Get content type from entity before consuming it
            HttpEntity entity = response.getEntity();
            if (entity != null && entity.getContentType() != null) {
                contentType = entity.getContentType();
            }

            String responseBody;
            try {
                responseBody = entity != null ? EntityUtils.toString(entity) : "";
            } catch (ParseException e) {
                throw new IOException("Failed to parse response", e);
            }

            if (statusCode < 200 || statusCode >= 300) {
                logger.error("HTTP request to {} failed with status {}", url, statusCode);
                logResponseBodyPreview(responseBody);
                throw new HttpStatusException(statusCode, url);
            }

            if (contentType != null && !contentType.isEmpty()
                && !contentType.toLowerCase().startsWith("application/json")) {
                logger.error("Expected JSON but received content-type: {}. URL: {}", contentType, url);
                logResponseBodyPreview(responseBody);
                throw new IOException("Expected JSON response but received: " + contentType);
            }

            try {
                return objectMapper.readTree(responseBody.isEmpty() ? "null" : responseBody);
            } catch (JsonProcessingException e) {
                logger.error("Failed to parse JSON. URL: {}", url);
                logResponseBodyPreview(responseBody);
                throw new IOException("Failed to parse JSON response: " + e.getOriginalMessage(), e);
            }
        }
    }
}
