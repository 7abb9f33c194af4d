package ai.gamedata.translator.batch;

public enum ErrorKind {
    /** Translator failure after back-off; the unit is marked failed. */
    TRANSIENT,
    /** Source script left in the output; retried once, then accepted. */
    LEAKAGE,
    /** Placeholders dropped by the model and reinserted. */
    PLACEHOLDER_DRIFT,
    /** Identity no longer resolves against the document. */
    STRUCTURAL
}
