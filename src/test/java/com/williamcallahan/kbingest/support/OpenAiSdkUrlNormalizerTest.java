package com.williamcallahan.kbingest.support;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class OpenAiSdkUrlNormalizerTest {

    @Test
    void keepsGeminiCompatibleEndpoint() {
        assertEquals("https://generativelanguage.googleapis.com/v1beta/openai",
                OpenAiSdkUrlNormalizer.normalize("https://generativelanguage.googleapis.com/v1beta/openai/"));
    }

    @Test
    void stripsOperationSuffix() {
        assertEquals("https://api.openai.com/v1", OpenAiSdkUrlNormalizer.normalize("https://api.openai.com/v1/embeddings"));
        assertEquals("https://api.openai.com/v1",
                OpenAiSdkUrlNormalizer.normalize("https://api.openai.com/v1/chat/completions"));
    }

    @Test
    void appendsVersionWhenMissing() {
        assertEquals("http://localhost:8080/v1", OpenAiSdkUrlNormalizer.normalize(" http://localhost:8080 "));
    }

    @Test
    void rejectsBlankUrl() {
        assertThrows(IllegalStateException.class, () -> OpenAiSdkUrlNormalizer.normalize(""));
    }
}
