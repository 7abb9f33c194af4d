package ai.gamedata.translator.project;

import java.util.Objects;
import java.util.Optional;

/**
 * One addressable piece of game text. Identity and source are fixed; translation state is guarded by the unit's monitor.
 */
public final class TranslatableUnit {

    private final UnitId id;
    private final String sourceText;
    private final ContentCategory category;
    private final int orderingKey;
    private final String speaker;
    private final int segmentCount;

    private String translation;
    private UnitStatus status;
    private String lastError;
    private boolean wrapped;

    public TranslatableUnit(UnitId id,
                            String sourceText,
                            ContentCategory category,
                            int orderingKey,
                            String speaker,
                            int segmentCount) {
        this(id, sourceText, category, orderingKey, speaker, segmentCount, UnitStatus.UNTRANSLATED, "", null);
    }

    public TranslatableUnit(UnitId id,
                            String sourceText,
                            ContentCategory category,
                            int orderingKey,
                            String speaker,
                            int segmentCount,
                            UnitStatus status,
                            String translation,
                            String lastError) {
        this(id, sourceText, category, orderingKey, speaker, segmentCount, status, translation, lastError, false);
    }

    public TranslatableUnit(UnitId id,
                            String sourceText,
                            ContentCategory category,
                            int orderingKey,
                            String speaker,
                            int segmentCount,
                            UnitStatus status,
                            String translation,
                            String lastError,
                            boolean wrapped) {
        this.id = Objects.requireNonNull(id, "id");
        this.sourceText = Objects.requireNonNull(sourceText, "sourceText");
        this.category = Objects.requireNonNull(category, "category");
        this.orderingKey = orderingKey;
        this.speaker = speaker == null || speaker.isBlank() ? null : speaker;
        if (segmentCount < 1) {
            throw new IllegalArgumentException("segmentCount must be positive");
        }
        this.segmentCount = segmentCount;
        this.status = Objects.requireNonNull(status, "status");
        this.translation = translation == null ? "" : translation;
        this.lastError = lastError;
        this.wrapped = wrapped;
    }

    public UnitId id() {
        return id;
    }

    public String sourceText() {
        return sourceText;
    }

    public ContentCategory category() {
        return category;
    }

    public int orderingKey() {
        return orderingKey;
    }

    /**
     * Speaker reference: {@code actor:<id>} for actor codes, otherwise the raw name as written in the data.
     */
    public Optional<String> speaker() {
        return Optional.ofNullable(speaker);
    }

    public int segmentCount() {
        return segmentCount;
    }

    public synchronized String translation() {
        return translation;
    }

    public synchronized UnitStatus status() {
        return status;
    }

    public synchronized Optional<String> lastError() {
        return Optional.ofNullable(lastError);
    }

    /**
     * Whether the translation's line breaks come from a manual word wrap and must each get their own command.
     */
    public synchronized boolean wrapped() {
        return wrapped;
    }

    public synchronized void markTranslated(String text) {
        this.translation = Objects.requireNonNull(text, "text");
        this.status = UnitStatus.TRANSLATED;
        this.lastError = null;
        this.wrapped = false;
    }

    public synchronized void markReviewed() {
        if (!status.carriesTranslation()) {
            throw new IllegalStateException("Unit " + id + " has no translation to review");
        }
        this.status = UnitStatus.REVIEWED;
    }

    public synchronized void markSkipped() {
        this.status = UnitStatus.SKIPPED;
        this.lastError = null;
    }

    public synchronized void markFailed(String error) {
        this.status = UnitStatus.FAILED;
        this.lastError = error;
    }

    /**
     * Rewrites the stored translation without touching the status, used by post-processing passes.
     */
    public synchronized void replaceTranslation(String text) {
        this.translation = Objects.requireNonNull(text, "text");
    }

    /**
     * Stores a manually wrapped translation whose lines map one-to-one onto message lines.
     */
    public synchronized void applyWrap(String text) {
        this.translation = Objects.requireNonNull(text, "text");
        this.wrapped = true;
    }

    synchronized void restoreFrom(TranslatableUnit previous) {
        TranslatableUnit copy = previous.snapshot();
        this.translation = copy.translation;
        this.status = copy.status;
        this.lastError = copy.lastError;
        this.wrapped = copy.wrapped;
    }

    /**
     * Consistent copy of this unit taken under its monitor.
     */
    public synchronized TranslatableUnit snapshot() {
        return new TranslatableUnit(id, sourceText, category, orderingKey, speaker, segmentCount,
                status, translation, lastError, wrapped);
    }

    @Override
    public String toString() {
        return "TranslatableUnit{" + id + ", " + category + ", " + status() + "}";
    }
}
