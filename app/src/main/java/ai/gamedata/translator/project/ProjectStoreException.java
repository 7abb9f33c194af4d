package ai.gamedata.translator.project;

/**
 * Raised when project state cannot be persisted or restored.
 */
public class ProjectStoreException extends RuntimeException {

    public ProjectStoreException(String message) {
        super(message);
    }

    public ProjectStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
