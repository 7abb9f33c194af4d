package ai.gamedata.translator.project;

import java.nio.file.Path;

/**
 * Persistence boundary for {@link ProjectState}.
 */
public interface ProjectStore {

    ProjectState load(Path path);

    /**
     * Saves all-or-nothing: a crash during save leaves the previous file intact.
     */
    void save(ProjectState state, Path path);
}
