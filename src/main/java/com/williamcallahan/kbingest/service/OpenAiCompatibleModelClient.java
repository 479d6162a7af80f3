package com.williamcallahan.kbingest.service;

import com.openai.client.OpenAIClient;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import com.openai.core.JsonValue;
import com.openai.core.RequestOptions;
import com.openai.core.Timeout;
import com.openai.errors.OpenAIServiceException;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionContentPart;
import com.openai.models.chat.completions.ChatCompletionContentPartImage;
import com.openai.models.chat.completions.ChatCompletionContentPartText;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import com.openai.models.embeddings.CreateEmbeddingResponse;
import com.openai.models.embeddings.Embedding;
import com.openai.models.embeddings.EmbeddingCreateParams;
import com.williamcallahan.kbingest.domain.EmbeddingVector;
import com.williamcallahan.kbingest.domain.ImagePayload;
import com.williamcallahan.kbingest.support.OpenAiSdkUrlNormalizer;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * OpenAI-compatible client for embeddings and image captions.
 *
 * <p>Uses the OpenAI Java SDK against the configured base URL. Every call makes exactly one request:
 * SDK-level retries are disabled and provider errors come back as {@link RemoteCallResult.Failure} so the
 * caller owns the retry budget.</p>
 */
public class OpenAiCompatibleModelClient implements RemoteModelClient, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(OpenAiCompatibleModelClient.class);

    private static final int CONNECT_TIMEOUT_SECONDS = 10;
    private static final int READ_TIMEOUT_SECONDS = 60;
    private static final int MAX_ERROR_SNIPPET = 512;
    private static final String TASK_TYPE_PROPERTY = "task_type";

    private final OpenAIClient client;
    private final String embeddingModel;
    private final String embeddingTaskType;
    private final String captionModel;

    /**
     * Creates a client backed by a remote OpenAI-compatible REST endpoint.
     *
     * @param baseUrl base URL for the provider
     * @param apiKey API key for the provider
     * @param embeddingModel model identifier for embeddings
     * @param embeddingTaskType provider task hint sent with embedding requests; blank to omit
     * @param captionModel multimodal model identifier for captions
     * @return configured client
     */
    public static OpenAiCompatibleModelClient create(
            String baseUrl, String apiKey, String embeddingModel, String embeddingTaskType, String captionModel) {
        OpenAIClient client = OpenAIOkHttpClient.builder()
                .apiKey(requireConfiguredApiKey(apiKey))
                .baseUrl(OpenAiSdkUrlNormalizer.normalize(baseUrl))
                .maxRetries(0)
                .build();
        return create(client, embeddingModel, embeddingTaskType, captionModel);
    }

    static OpenAiCompatibleModelClient create(
            OpenAIClient client, String embeddingModel, String embeddingTaskType, String captionModel) {
        return new OpenAiCompatibleModelClient(
                Objects.requireNonNull(client, "client"),
                requireConfiguredModel(embeddingModel, "embedding"),
                embeddingTaskType == null ? "" : embeddingTaskType.trim(),
                requireConfiguredModel(captionModel, "caption"));
    }

    private OpenAiCompatibleModelClient(
            OpenAIClient client, String embeddingModel, String embeddingTaskType, String captionModel) {
        this.client = client;
        this.embeddingModel = embeddingModel;
        this.embeddingTaskType = embeddingTaskType;
        this.captionModel = captionModel;
    }

    @Override
    public RemoteCallResult<EmbeddingVector> embed(String text) {
        try {
            CreateEmbeddingResponse response = client.embeddings().create(embeddingParams(text), requestOptions());
            return RemoteCallResult.success(parseEmbedding(response));
        } catch (RuntimeException exception) {
            return toFailure("embedding", exception);
        }
    }

    @Override
    public RemoteCallResult<String> caption(ImagePayload image, String prompt) {
        Objects.requireNonNull(image, "image");
        try {
            ChatCompletion completion = client.chat().completions().create(captionParams(image, prompt), requestOptions());
            return RemoteCallResult.success(parseCaption(completion));
        } catch (RuntimeException exception) {
            return toFailure("caption", exception);
        }
    }

    private EmbeddingCreateParams embeddingParams(String text) {
        EmbeddingCreateParams.Builder builder = EmbeddingCreateParams.builder()
                .model(embeddingModel)
                .inputOfArrayOfStrings(List.of(text == null ? "" : text));
        if (!embeddingTaskType.isEmpty()) {
            builder.putAdditionalBodyProperty(TASK_TYPE_PROPERTY, JsonValue.from(embeddingTaskType));
        }
        return builder.build();
    }

    private ChatCompletionCreateParams captionParams(ImagePayload image, String prompt) {
        ChatCompletionContentPart imagePart = ChatCompletionContentPart.ofImageUrl(
                ChatCompletionContentPartImage.builder()
                        .imageUrl(ChatCompletionContentPartImage.ImageUrl.builder()
                                .url(image.toDataUri())
                                .build())
                        .build());
        ChatCompletionContentPart promptPart = ChatCompletionContentPart.ofText(
                ChatCompletionContentPartText.builder()
                        .text(prompt == null ? "" : prompt)
                        .build());
        return ChatCompletionCreateParams.builder()
                .model(captionModel)
                .addUserMessageOfArrayOfContentParts(List.of(imagePart, promptPart))
                .build();
    }

    private static RequestOptions requestOptions() {
        Duration requestTimeout = Duration.ofSeconds(READ_TIMEOUT_SECONDS);
        Timeout timeout = Timeout.builder()
                .connect(Duration.ofSeconds(CONNECT_TIMEOUT_SECONDS))
                .request(requestTimeout)
                .read(requestTimeout)
                .build();
        return RequestOptions.builder().timeout(timeout).build();
    }

    private static EmbeddingVector parseEmbedding(CreateEmbeddingResponse response) {
        if (response == null) {
            throw new RemoteServiceException("Remote embedding response was null");
        }
        List<Embedding> entries = response.data();
        if (entries.isEmpty() || entries.get(0) == null) {
            throw new RemoteServiceException("Remote embedding response missing embedding entries");
        }
        List<Float> values = entries.get(0).embedding();
        if (values == null || values.isEmpty()) {
            throw new RemoteServiceException("Remote embedding response missing embedding values");
        }
        float[] vector = new float[values.size()];
        for (int index = 0; index < values.size(); index++) {
            Number value = values.get(index);
            if (value == null) {
                throw new RemoteServiceException("Remote embedding payload has null value at index " + index);
            }
            vector[index] = value.floatValue();
        }
        return new EmbeddingVector(vector);
    }

    private static String parseCaption(ChatCompletion completion) {
        if (completion == null || completion.choices().isEmpty()) {
            throw new RemoteServiceException("Caption response contained no choices");
        }
        String caption = completion.choices().get(0).message().content().map(String::strip).orElse("");
        if (caption.isEmpty()) {
            throw new RemoteServiceException("Caption response was empty");
        }
        return caption;
    }

    private static <T> RemoteCallResult<T> toFailure(String operation, RuntimeException exception) {
        String details = sanitizeMessage(exception.getMessage());
        String reason;
        if (exception instanceof OpenAIServiceException serviceException) {
            reason = "HTTP " + serviceException.statusCode() + (details.isEmpty() ? "" : ": " + details);
        } else {
            reason = exception.getClass().getSimpleName() + (details.isEmpty() ? "" : ": " + details);
        }
        log.debug("[REMOTE] {} request failed: {}", operation, reason, exception);
        return RemoteCallResult.failure(reason, exception);
    }

    private static String sanitizeMessage(String message) {
        if (message == null || message.isBlank()) {
            return "";
        }
        String sanitized = message.replace("\r", " ").replace("\n", " ").trim();
        if (sanitized.length() > MAX_ERROR_SNIPPET) {
            return sanitized.substring(0, MAX_ERROR_SNIPPET) + "...";
        }
        return sanitized;
    }

    /**
     * Closes the underlying OpenAI client and releases its resources.
     */
    @Override
    public void close() {
        client.close();
    }

    private static String requireConfiguredApiKey(String apiKey) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalStateException("Remote model API key is not configured");
        }
        return apiKey;
    }

    private static String requireConfiguredModel(String modelName, String role) {
        if (modelName == null || modelName.isBlank()) {
            throw new IllegalStateException("Remote " + role + " model is not configured");
        }
        return modelName;
    }
}
