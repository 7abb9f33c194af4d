package ai.gamedata.translator.consistency;

import java.util.Objects;

/**
 * Source term to target term mapping in one glossary layer.
 */
public record GlossaryEntry(String sourceTerm, String targetTerm, GlossaryLayer layer) {

    public GlossaryEntry {
        Objects.requireNonNull(sourceTerm, "sourceTerm");
        Objects.requireNonNull(targetTerm, "targetTerm");
        Objects.requireNonNull(layer, "layer");
    }
}
