package ai.gamedata.translator.codec;

import com.fasterxml.jackson.core.JsonPointer;

/**
 * A unit's field path split into the JSON pointer and the optional key inside an embedded JSON string.
 */
record FieldPath(String pointer, String embeddedKey) {

    private static final char EMBEDDED_SEPARATOR = '#';

    static FieldPath parse(String fieldPath) {
        int hash = fieldPath.lastIndexOf(EMBEDDED_SEPARATOR);
        if (hash < 0 || hash < fieldPath.lastIndexOf('/')) {
            return new FieldPath(fieldPath, null);
        }
        return new FieldPath(fieldPath.substring(0, hash), fieldPath.substring(hash + 1));
    }

    static String child(String base, String key) {
        return base + "/" + key.replace("~", "~0").replace("/", "~1");
    }

    static String child(String base, int index) {
        return base + "/" + index;
    }

    static String embedded(String pointer, String key) {
        return pointer + EMBEDDED_SEPARATOR + key;
    }

    boolean hasEmbeddedKey() {
        return embeddedKey != null;
    }

    JsonPointer jsonPointer() {
        return JsonPointer.compile(pointer);
    }

    String parentPointer() {
        int slash = pointer.lastIndexOf('/');
        return slash <= 0 ? "" : pointer.substring(0, slash);
    }

    String lastSegment() {
        int slash = pointer.lastIndexOf('/');
        return pointer.substring(slash + 1).replace("~1", "/").replace("~0", "~");
    }
}
