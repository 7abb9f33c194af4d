package ai.gamedata.translator.codec;

import java.util.Objects;

public record WriteResult(DocumentSet documents, WriteReport report) {

    public WriteResult {
        Objects.requireNonNull(documents, "documents");
        Objects.requireNonNull(report, "report");
    }
}
