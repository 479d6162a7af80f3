package com.williamcallahan.kbingest.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

/**
 * Validates that the remote model credential is present at startup.
 *
 * <p>Fails fast with a clear error message instead of letting a run start and then fail every
 * embedding and caption request.</p>
 */
@Configuration
public class RequiredCredentialValidation {
    private static final Logger log = LoggerFactory.getLogger(RequiredCredentialValidation.class);
    private static final String REMOTE_API_KEY_PROPERTY = "${app.remote.api-key:}";
    private static final String MISSING_API_KEY_MESSAGE =
            "No remote model API key configured. Set the GENAI_API_KEY environment variable or app.remote.api-key.";

    private final String remoteApiKey;

    RequiredCredentialValidation(@Value(REMOTE_API_KEY_PROPERTY) String remoteApiKey) {
        this.remoteApiKey = remoteApiKey;
    }

    /**
     * Halts startup when the API key is missing.
     *
     * @throws IllegalStateException if no API key is configured
     */
    @PostConstruct
    public void validateRequiredCredentials() {
        if (remoteApiKey == null || remoteApiKey.isBlank()) {
            throw new IllegalStateException(MISSING_API_KEY_MESSAGE);
        }
        log.info("Required credential validation passed");
    }
}
