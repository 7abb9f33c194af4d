package ai.gamedata.translator.codec;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;

/**
 * One parsed data file. {@code raw} holds the bytes it was read from while the tree is unmodified.
 */
public record GameDocument(String fileId, JsonNode root, byte[] raw) {

    public GameDocument {
        Objects.requireNonNull(fileId, "fileId");
        Objects.requireNonNull(root, "root");
    }

    public static GameDocument modified(String fileId, JsonNode root) {
        return new GameDocument(fileId, root, null);
    }

    public boolean unmodified() {
        return raw != null;
    }

    /**
     * Bytes to write: the original bytes for untouched documents, the serialized tree otherwise.
     */
    public byte[] content() {
        return raw != null ? raw.clone() : GameDataJson.toBytes(root);
    }
}
