package fr.lapetina.orchestrator.queue;

import java.util.Locale;

/**
 * What a task asks a provider to do.
 */
public enum TaskKind {
    CHAT("chat", "/api/ai/chat", "gpt-4", true),
    IMAGE_GENERATION("image_generation", "/api/ai/image", "dall-e-3", false),
    TRANSCRIPTION("transcription", "/api/ai/transcription", "whisper-1", true),
    EMBEDDINGS("embeddings", "/api/ai/embeddings", "text-embedding-ada-002", true),
    ANALYSIS("analysis", "/api/ai/analysis", "gpt-4", true),
    CUSTOM("custom", "/api/ai/custom", null, false);

    private final String contentType;
    private final String defaultEndpoint;
    private final String defaultModel;
    private final boolean cacheableByDefault;

    TaskKind(String contentType, String defaultEndpoint, String defaultModel, boolean cacheableByDefault) {
        this.contentType = contentType;
        this.defaultEndpoint = defaultEndpoint;
        this.defaultModel = defaultModel;
        this.cacheableByDefault = cacheableByDefault;
    }

    /**
     * Key into the cache TTL table.
     */
    public String getContentType() {
        return contentType;
    }

    /**
     * Endpoint checked by admission control when the caller does not name one.
     */
    public String getDefaultEndpoint() {
        return defaultEndpoint;
    }

    /**
     * Model used when the task does not require one, or null when a model must be given.
     */
    public String getDefaultModel() {
        return defaultModel;
    }

    public boolean isCacheableByDefault() {
        return cacheableByDefault;
    }

    /**
     * Resolves a kind from {@code image_generation}, {@code image-generation} or {@code IMAGE_GENERATION}.
     */
    public static TaskKind fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Task kind is required");
        }
        return valueOf(name.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }
}
