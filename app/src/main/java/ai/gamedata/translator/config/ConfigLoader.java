package ai.gamedata.translator.config;

import ai.gamedata.translator.batch.BatchOrchestrator;
import ai.gamedata.translator.batch.BatchOrdering;
import ai.gamedata.translator.batch.BatchScope;
import ai.gamedata.translator.cli.CliArguments;
import ai.gamedata.translator.project.UnitId;
import ai.gamedata.translator.translate.PassMode;
import ai.gamedata.translator.translate.RetryPolicy;
import ai.gamedata.translator.translate.TranslationMode;
import ai.gamedata.translator.wordwrap.WordWrapOverrides;
import ai.gamedata.translator.writer.SegmentOverflowPolicy;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_LLM_PROVIDER = "LLM_PROVIDER";
    static final String ENV_LLM_MODEL = "LLM_MODEL";
    static final String ENV_OLLAMA_BASE_URL = "OLLAMA_BASE_URL";
    static final String ENV_GEMINI_API_KEY = "GEMINI_API_KEY";
    static final String ENV_LLM_TIMEOUT_SECONDS = "LLM_TIMEOUT_SECONDS";
    static final String ENV_LLM_MAX_RETRY_ATTEMPTS = "LLM_MAX_RETRY_ATTEMPTS";
    static final String ENV_LLM_INITIAL_BACKOFF_SECONDS = "LLM_INITIAL_BACKOFF_SECONDS";
    static final String ENV_LLM_MAX_BACKOFF_SECONDS = "LLM_MAX_BACKOFF_SECONDS";
    static final String ENV_LLM_RETRY_JITTER_FACTOR = "LLM_RETRY_JITTER_FACTOR";
    static final String ENV_TRANSLATION_MODE = "TRANSLATION_MODE";
    static final String ENV_TRANSLATION_WORKERS = "TRANSLATION_WORKERS";
    static final String ENV_HISTORY_WINDOW_SIZE = "HISTORY_WINDOW_SIZE";
    static final String ENV_CHECKPOINT_INTERVAL = "CHECKPOINT_INTERVAL";
    static final String ENV_TARGET_LANGUAGE = "TARGET_LANGUAGE";
    static final String ENV_GENERAL_GLOSSARY_PATH = "GENERAL_GLOSSARY_PATH";
    static final String ENV_SEGMENT_OVERFLOW = "SEGMENT_OVERFLOW";
    static final String ENV_WORDWRAP_CHARS_PER_LINE = "WORDWRAP_CHARS_PER_LINE";
    static final String ENV_WORDWRAP_TAG = "WORDWRAP_TAG";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";

    static final String DEFAULT_STATE_FILE = "translation_project.json";
    static final String DEFAULT_GENERAL_GLOSSARY = "general_glossary.json";
    private static final String DEFAULT_OLLAMA_BASE_URL = "http://localhost:11434";
    private static final String DEFAULT_TARGET_LANGUAGE = "English";
    private static final int DEFAULT_WORKERS = 2;
    private static final int DEFAULT_HISTORY_WINDOW_SIZE = 3;
    private static final int DEFAULT_LLM_TIMEOUT_SECONDS = 120;

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        Path gameDirectory = Objects.requireNonNull(arguments.gameDirectory(), "--game-dir must be provided");
        Path statePath = arguments.statePath() != null
                ? arguments.statePath()
                : gameDirectory.resolve(DEFAULT_STATE_FILE);
        Path glossaryPath = env(ENV_GENERAL_GLOSSARY_PATH).map(Path::of).orElse(Path.of(DEFAULT_GENERAL_GLOSSARY));

        PassMode passMode = arguments.passMode() != null ? arguments.passMode() : PassMode.TRANSLATE;
        BatchOrdering ordering = arguments.ordering() != null ? arguments.ordering() : BatchOrdering.DOCUMENT;
        BatchScope scope = arguments.scope() != null ? arguments.scope() : BatchScope.ALL;
        int workers = arguments.workers() != null
                ? arguments.workers()
                : env(ENV_TRANSLATION_WORKERS).map(value -> parseInteger(value, ENV_TRANSLATION_WORKERS)).orElse(DEFAULT_WORKERS);
        int limit = resolveLimit(arguments);

        TranslationMode translationMode = arguments.translationMode() != null
                ? arguments.translationMode()
                : env(ENV_TRANSLATION_MODE).map(TranslationMode::from).orElse(TranslationMode.PRODUCTION);
        LogFormat logFormat = arguments.logFormat() != null
                ? arguments.logFormat()
                : env(ENV_LOG_FORMAT).map(LogFormat::from).orElse(LogFormat.TEXT);

        LlmProvider provider = env(ENV_LLM_PROVIDER).map(LlmProvider::from).orElse(LlmProvider.OLLAMA);
        String modelName = env(ENV_LLM_MODEL).orElse(defaultModelFor(provider));
        Optional<String> baseUrl = provider == LlmProvider.OLLAMA
                ? Optional.of(env(ENV_OLLAMA_BASE_URL).orElse(DEFAULT_OLLAMA_BASE_URL))
                : Optional.empty();
        Duration timeout = Duration.ofSeconds(intEnv(ENV_LLM_TIMEOUT_SECONDS, DEFAULT_LLM_TIMEOUT_SECONDS));
        String targetLanguage = env(ENV_TARGET_LANGUAGE).orElse(DEFAULT_TARGET_LANGUAGE);
        TranslatorConfig translatorConfig = new TranslatorConfig(provider, modelName, baseUrl, timeout, targetLanguage);
        Secrets secrets = new Secrets(env(ENV_GEMINI_API_KEY));

        RetryPolicy retryPolicy = new RetryPolicy(
                intEnv(ENV_LLM_MAX_RETRY_ATTEMPTS, RetryPolicy.DEFAULT.maxAttempts()),
                intEnv(ENV_LLM_INITIAL_BACKOFF_SECONDS, RetryPolicy.DEFAULT.initialBackoffSeconds()),
                intEnv(ENV_LLM_MAX_BACKOFF_SECONDS, RetryPolicy.DEFAULT.maxBackoffSeconds()),
                env(ENV_LLM_RETRY_JITTER_FACTOR).map(ConfigLoader::parseDouble).orElse(RetryPolicy.DEFAULT.jitterFactor()));

        int historyWindowSize = intEnv(ENV_HISTORY_WINDOW_SIZE, DEFAULT_HISTORY_WINDOW_SIZE);
        int checkpointInterval = intEnv(ENV_CHECKPOINT_INTERVAL, BatchOrchestrator.DEFAULT_CHECKPOINT_INTERVAL);
        SegmentOverflowPolicy segmentOverflow = env(ENV_SEGMENT_OVERFLOW)
                .map(SegmentOverflowPolicy::from)
                .orElse(SegmentOverflowPolicy.MERGE_INTO_LAST);
        WordWrapOverrides wordWrapOverrides = new WordWrapOverrides(
                env(ENV_WORDWRAP_CHARS_PER_LINE).map(value -> parseInteger(value, ENV_WORDWRAP_CHARS_PER_LINE)),
                env(ENV_WORDWRAP_TAG));

        return new Config(gameDirectory, statePath, glossaryPath, passMode, ordering, scope, workers, limit,
                !arguments.noTranslate(), arguments.wordWrap(), arguments.export(), translationMode, logFormat,
                translatorConfig, secrets, retryPolicy, historyWindowSize, checkpointInterval, segmentOverflow,
                wordWrapOverrides, Optional.ofNullable(arguments.retranslate()).map(String::strip).map(UnitId::parse),
                Optional.ofNullable(arguments.hint()));
    }

    private String defaultModelFor(LlmProvider provider) {
        return switch (provider) {
            case GEMINI -> "models/gemini-1.5-pro-latest";
            case OLLAMA -> "qwen2.5:14b";
        };
    }

    private int resolveLimit(CliArguments arguments) {
        Integer limit = arguments.limit();
        if (limit == null) {
            return 0;
        }
        if (limit < 0) {
            throw new IllegalArgumentException("--limit must be zero or greater");
        }
        return limit;
    }

    private Optional<String> env(String key) {
        return environmentReader.nonBlank(key);
    }

    private int intEnv(String key, int defaultValue) {
        return env(key).map(value -> parseInteger(value, key)).orElse(defaultValue);
    }

    private static int parseInteger(String raw, String key) {
        try {
            int value = Integer.parseInt(raw.trim());
            if (value < 0) {
                throw new IllegalArgumentException(key + " must be zero or greater");
            }
            return value;
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(key + " must be an integer", ex);
        }
    }

    private static double parseDouble(String raw) {
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid double value: " + raw, ex);
        }
    }
}
