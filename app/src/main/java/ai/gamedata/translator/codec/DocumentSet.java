package ai.gamedata.translator.codec;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered collection of the game's data documents.
 */
public final class DocumentSet {

    private final Map<String, GameDocument> documents = new LinkedHashMap<>();

    public DocumentSet(Collection<GameDocument> documents) {
        for (GameDocument document : documents) {
            if (this.documents.putIfAbsent(document.fileId(), document) != null) {
                throw new IllegalArgumentException("Duplicate document " + document.fileId());
            }
        }
    }

    public List<GameDocument> documents() {
        return new ArrayList<>(documents.values());
    }

    public Optional<GameDocument> document(String fileId) {
        return Optional.ofNullable(documents.get(fileId));
    }

    public List<String> fileIds() {
        return List.copyOf(documents.keySet());
    }

    public int size() {
        return documents.size();
    }
}
