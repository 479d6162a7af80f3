package com.williamcallahan.kbingest.support;

import java.util.regex.Pattern;

/**
 * Normalizes base URLs for the OpenAI Java SDK.
 *
 * <p>The SDK appends operation paths (e.g. {@code /embeddings}) to the base URL, so the base must end at
 * the API version prefix. Endpoints that already carry a version segment, such as the Gemini
 * OpenAI-compatible endpoint ({@code /v1beta/openai}), are kept as configured.</p>
 */
public final class OpenAiSdkUrlNormalizer {

    private static final Pattern VERSIONED_PATH = Pattern.compile(".*/v\\d+[a-z0-9]*(/openai)?$");
    private static final String[] OPERATION_SUFFIXES = {"/embeddings", "/chat/completions"};

    private OpenAiSdkUrlNormalizer() {}

    /**
     * Normalizes a base URL for the OpenAI Java SDK.
     *
     * @param baseUrl raw base URL from configuration
     * @return normalized URL suitable for OpenAIOkHttpClient.builder().baseUrl()
     * @throws IllegalStateException if baseUrl is null or blank
     */
    public static String normalize(String baseUrl) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalStateException("OpenAI SDK base URL is not configured");
        }
        String trimmed = baseUrl.trim();
        if (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        for (String suffix : OPERATION_SUFFIXES) {
            if (trimmed.endsWith(suffix)) {
                trimmed = trimmed.substring(0, trimmed.length() - suffix.length());
                break;
            }
        }
        if (VERSIONED_PATH.matcher(trimmed).matches()) {
            return trimmed;
        }
        return trimmed + "/v1";
    }
}
