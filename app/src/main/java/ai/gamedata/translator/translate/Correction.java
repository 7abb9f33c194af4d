package ai.gamedata.translator.translate;

/**
 * Operator feedback attached to a retranslation.
 */
public record Correction(String hint, String rejectedTranslation) {

    public Correction {
        hint = hint == null ? "" : hint.strip();
        rejectedTranslation = rejectedTranslation == null ? "" : rejectedTranslation;
    }
}
