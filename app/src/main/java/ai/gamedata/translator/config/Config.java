package ai.gamedata.translator.config;

import ai.gamedata.translator.batch.BatchOrdering;
import ai.gamedata.translator.batch.BatchScope;
import ai.gamedata.translator.project.UnitId;
import ai.gamedata.translator.translate.PassMode;
import ai.gamedata.translator.translate.RetryPolicy;
import ai.gamedata.translator.translate.TranslationMode;
import ai.gamedata.translator.wordwrap.WordWrapOverrides;
import ai.gamedata.translator.writer.SegmentOverflowPolicy;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable representation of the runtime configuration assembled from CLI arguments and environment values.
 */
public record Config(
        Path gameDirectory,
        Path statePath,
        Path generalGlossaryPath,
        PassMode passMode,
        BatchOrdering ordering,
        BatchScope scope,
        int workers,
        int limit,
        boolean translate,
        boolean wordWrap,
        boolean export,
        TranslationMode translationMode,
        LogFormat logFormat,
        TranslatorConfig translatorConfig,
        Secrets secrets,
        RetryPolicy retryPolicy,
        int historyWindowSize,
        int checkpointInterval,
        SegmentOverflowPolicy segmentOverflow,
        WordWrapOverrides wordWrapOverrides,
        Optional<UnitId> retranslateUnit,
        Optional<String> retranslateHint
) {

    public static final int MAX_WORKERS = 32;

    public Config {
        Objects.requireNonNull(gameDirectory, "gameDirectory");
        Objects.requireNonNull(statePath, "statePath");
        Objects.requireNonNull(generalGlossaryPath, "generalGlossaryPath");
        Objects.requireNonNull(passMode, "passMode");
        Objects.requireNonNull(ordering, "ordering");
        Objects.requireNonNull(scope, "scope");
        if (workers < 1 || workers > MAX_WORKERS) {
            throw new IllegalArgumentException("workers must be between 1 and " + MAX_WORKERS);
        }
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be zero or greater");
        }
        Objects.requireNonNull(translationMode, "translationMode");
        Objects.requireNonNull(logFormat, "logFormat");
        Objects.requireNonNull(translatorConfig, "translatorConfig");
        secrets = secrets == null ? Secrets.none() : secrets;
        Objects.requireNonNull(retryPolicy, "retryPolicy");
        if (historyWindowSize < 0) {
            throw new IllegalArgumentException("historyWindowSize must be zero or greater");
        }
        if (checkpointInterval < 1) {
            throw new IllegalArgumentException("checkpointInterval must be at least 1");
        }
        Objects.requireNonNull(segmentOverflow, "segmentOverflow");
        wordWrapOverrides = wordWrapOverrides == null ? WordWrapOverrides.none() : wordWrapOverrides;
        retranslateUnit = retranslateUnit == null ? Optional.empty() : retranslateUnit;
        retranslateHint = retranslateHint == null ? Optional.empty() : retranslateHint.filter(hint -> !hint.isBlank());
        if (retranslateHint.isPresent() && retranslateUnit.isEmpty()) {
            throw new IllegalArgumentException("--hint requires --retranslate");
        }
    }

    public boolean hasLimit() {
        return limit > 0;
    }
}
