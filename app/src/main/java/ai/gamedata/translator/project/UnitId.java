package ai.gamedata.translator.project;

import java.util.Objects;

/**
 * Stable identity of a unit: the data file plus a JSON pointer into it.
 * The pointer may carry a {@code #key} suffix addressing a key inside a JSON-encoded string value.
 */
public record UnitId(String fileId, String fieldPath) implements Comparable<UnitId> {

    public UnitId {
        fileId = requireNonBlank(fileId, "fileId");
        fieldPath = Objects.requireNonNull(fieldPath, "fieldPath");
        if (!fieldPath.isEmpty() && !fieldPath.startsWith("/")) {
            throw new IllegalArgumentException("fieldPath must be a JSON pointer: " + fieldPath);
        }
    }

    public static UnitId parse(String raw) {
        Objects.requireNonNull(raw, "raw");
        int slash = raw.indexOf('/');
        if (slash <= 0) {
            throw new IllegalArgumentException("Invalid unit id: " + raw);
        }
        return new UnitId(raw.substring(0, slash), raw.substring(slash));
    }

    @Override
    public int compareTo(UnitId other) {
        int byFile = fileId.compareTo(other.fileId);
        return byFile != 0 ? byFile : fieldPath.compareTo(other.fieldPath);
    }

    @Override
    public String toString() {
        return fileId + fieldPath;
    }

    private static String requireNonBlank(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return value;
    }
}
