package clipqueue.coordinator.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.Locale;

/**
 * Type-specific configuration carried by a task. Immutable once the task exists.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = TaskConfig.DownloadConfig.class, name = "download"),
        @JsonSubTypes.Type(value = TaskConfig.AspectRatioConfig.class, name = "aspect-ratio"),
        @JsonSubTypes.Type(value = TaskConfig.AudioNormalizationConfig.class, name = "audio"),
        @JsonSubTypes.Type(value = TaskConfig.TranscriptionConfig.class, name = "transcription"),
        @JsonSubTypes.Type(value = TaskConfig.AnalysisConfig.class, name = "analysis")
})
public interface TaskConfig {

    /** Check the payload is usable for the given task type. */
    void validateFor(TaskType type);

    /**
     * Download source and output options.
     */
    record DownloadConfig(
            @JsonProperty("url") String url,
            @JsonProperty("outputDir") String outputDir,
            @JsonProperty("quality") String quality) implements TaskConfig {

        public static final String DEFAULT_QUALITY = "best";

        public String qualityOrDefault() {
            return quality == null || quality.isBlank() ? DEFAULT_QUALITY : quality;
        }

        @Override
        public void validateFor(TaskType type) {
            if (type != TaskType.DOWNLOAD) {
                throw new IllegalArgumentException("download config does not apply to " + type.wireName());
            }
            if (url == null || url.isBlank()) {
                throw new IllegalArgumentException("download url is required");
            }
        }
    }

    record AspectRatioConfig(@JsonProperty("targetRatio") String targetRatio) implements TaskConfig {

        public static final String DEFAULT_RATIO = "16:9";

        public String targetRatioOrDefault() {
            return targetRatio == null || targetRatio.isBlank() ? DEFAULT_RATIO : targetRatio;
        }

        @Override
        public void validateFor(TaskType type) {
            if (type != TaskType.FIX_ASPECT_RATIO) {
                throw new IllegalArgumentException("aspect ratio config does not apply to " + type.wireName());
            }
        }
    }

    record AudioNormalizationConfig(@JsonProperty("targetLevel") Double targetLevel) implements TaskConfig {

        public static final double DEFAULT_LEVEL = -16.0;

        public double targetLevelOrDefault() {
            return targetLevel == null ? DEFAULT_LEVEL : targetLevel;
        }

        @Override
        public void validateFor(TaskType type) {
            if (type != TaskType.NORMALIZE_AUDIO) {
                throw new IllegalArgumentException("audio config does not apply to " + type.wireName());
            }
            if (targetLevel != null && (targetLevel > 0 || targetLevel < -70)) {
                throw new IllegalArgumentException("targetLevel must be between -70 and 0 dB");
            }
        }
    }

    record TranscriptionConfig(
            @JsonProperty("model") String model,
            @JsonProperty("language") String language) implements TaskConfig {

        public static final String DEFAULT_MODEL = "base";
        public static final String DEFAULT_LANGUAGE = "en";

        public String modelOrDefault() {
            return model == null || model.isBlank() ? DEFAULT_MODEL : model;
        }

        public String languageOrDefault() {
            return language == null || language.isBlank() ? DEFAULT_LANGUAGE : language;
        }

        @Override
        public void validateFor(TaskType type) {
            if (type != TaskType.TRANSCRIBE) {
                throw new IllegalArgumentException("transcription config does not apply to " + type.wireName());
            }
        }
    }

    /**
     * AI analysis options. {@code aiModel} may carry a provider prefix,
     * e.g. {@code claude:claude-3-sonnet}; without one the provider is ollama.
     */
    record AnalysisConfig(
            @JsonProperty("aiModel") String aiModel,
            @JsonProperty("apiKey") String apiKey,
            @JsonProperty("endpoint") String endpoint,
            @JsonProperty("customInstructions") String customInstructions) implements TaskConfig {

        static final String[] PROVIDERS = { "ollama", "claude", "openai", "local" };
        public static final String DEFAULT_PROVIDER = "ollama";

        @JsonIgnore
        public String provider() {
            String prefix = prefix();
            return prefix != null ? prefix : DEFAULT_PROVIDER;
        }

        /** Model name with any provider prefix removed. */
        @JsonIgnore
        public String modelName() {
            String prefix = prefix();
            return prefix != null ? aiModel.substring(prefix.length() + 1) : aiModel;
        }

        private String prefix() {
            if (aiModel == null) {
                return null;
            }
            int colon = aiModel.indexOf(':');
            if (colon <= 0) {
                return null;
            }
            String candidate = aiModel.substring(0, colon).toLowerCase(Locale.ROOT);
            for (String provider : PROVIDERS) {
                if (provider.equals(candidate)) {
                    return provider;
                }
            }
            return null;
        }

        @Override
        public void validateFor(TaskType type) {
            if (type != TaskType.ANALYZE) {
                throw new IllegalArgumentException("analysis config does not apply to " + type.wireName());
            }
            if (aiModel == null || aiModel.isBlank()) {
                throw new IllegalArgumentException("AI analysis requires an AI model to be selected");
            }
        }

        @Override
        public String toString() {
            // apiKey stays out of logs
            return "AnalysisConfig{aiModel='" + aiModel + "', provider=" + provider() + "}";
        }
    }
}
