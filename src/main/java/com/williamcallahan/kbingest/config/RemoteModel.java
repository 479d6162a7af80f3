package com.williamcallahan.kbingest.config;

import java.util.Locale;

/**
 * Remote model service configuration shared by the embedding and captioning operations.
 */
public class RemoteModel {

    private static final String URL_DEF = "https://generativelanguage.googleapis.com/v1beta/openai";
    private static final String EMBED_MODEL_DEF = "text-embedding-004";
    private static final String CAPTION_MODEL_DEF = "gemini-1.5-flash";
    private static final String TASK_TYPE_DEF = "retrieval_document";
    private static final String CAPTION_PROMPT_DEF =
            "Provide a detailed factual description of the image. List all visible text, diagrams, "
            + "charts, labels, and objects, including their spatial layout and relationships. Focus only "
            + "on what can be directly seen, avoiding interpretation or assumptions. Describe every "
            + "element as if preparing the image for a blind person to understand its structure and content.";
    private static final String URL_KEY = "app.remote.server-url";
    private static final String EMBED_MODEL_KEY = "app.remote.embedding-model";
    private static final String CAPTION_MODEL_KEY = "app.remote.caption-model";
    private static final String PROMPT_KEY = "app.remote.caption-prompt";
    private static final String BLANK_TEXT_FMT = "%s must not be blank.";

    private String serverUrl = URL_DEF;
    private String apiKey = "";
    private String embeddingModel = EMBED_MODEL_DEF;
    private String embeddingTaskType = TASK_TYPE_DEF;
    private String captionModel = CAPTION_MODEL_DEF;
    private String captionPrompt = CAPTION_PROMPT_DEF;

    public RemoteModel() {}

    /**
     * Validates remote model settings. The API key is checked separately at startup.
     */
    public void validateConfiguration() {
        requireText(URL_KEY, serverUrl);
        requireText(EMBED_MODEL_KEY, embeddingModel);
        requireText(CAPTION_MODEL_KEY, captionModel);
        requireText(PROMPT_KEY, captionPrompt);
    }

    public String getServerUrl() {
        return serverUrl;
    }

    public void setServerUrl(String serverUrl) {
        this.serverUrl = serverUrl;
    }

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey == null ? "" : apiKey;
    }

    public String getEmbeddingModel() {
        return embeddingModel;
    }

    public void setEmbeddingModel(String embeddingModel) {
        this.embeddingModel = embeddingModel;
    }

    /**
     * Returns the task hint sent with embedding requests; blank disables the hint.
     */
    public String getEmbeddingTaskType() {
        return embeddingTaskType;
    }

    public void setEmbeddingTaskType(String embeddingTaskType) {
        this.embeddingTaskType = embeddingTaskType == null ? "" : embeddingTaskType;
    }

    public String getCaptionModel() {
        return captionModel;
    }

    public void setCaptionModel(String captionModel) {
        this.captionModel = captionModel;
    }

    public String getCaptionPrompt() {
        return captionPrompt;
    }

    public void setCaptionPrompt(String captionPrompt) {
        this.captionPrompt = captionPrompt;
    }

    private static void requireText(String propertyKey, String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, BLANK_TEXT_FMT, propertyKey));
        }
    }
}
