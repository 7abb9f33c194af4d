package ai.gamedata.translator.codec;

import java.util.List;

/**
 * Unit identities that no longer resolve against the documents they are written into.
 */
public class StructuralMismatchException extends RuntimeException {

    private final List<String> mismatches;

    public StructuralMismatchException(List<String> mismatches) {
        super(buildMessage(mismatches));
        this.mismatches = List.copyOf(mismatches);
    }

    public List<String> mismatches() {
        return mismatches;
    }

    private static String buildMessage(List<String> mismatches) {
        StringBuilder message = new StringBuilder()
                .append(mismatches.size()).append(" unit(s) do not match the document structure");
        mismatches.stream().limit(10).forEach(detail -> message.append(System.lineSeparator()).append("  ").append(detail));
        if (mismatches.size() > 10) {
            message.append(System.lineSeparator()).append("  ...");
        }
        return message.toString();
    }
}
