package ai.gamedata.translator.project;

import ai.gamedata.translator.consistency.ActorRecord;
import ai.gamedata.translator.consistency.ActorRegistry;
import ai.gamedata.translator.consistency.Glossary;
import ai.gamedata.translator.consistency.GlossaryLayer;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Root aggregate of a translation project: ordered units, glossary and actor registry for one game directory.
 */
public final class ProjectState {

    private final Path gameDirectory;
    private final List<TranslatableUnit> units;
    private final Map<UnitId, TranslatableUnit> unitsById;
    private final Glossary glossary;
    private final ActorRegistry actors;

    public ProjectState(Path gameDirectory, List<TranslatableUnit> units, Glossary glossary, ActorRegistry actors) {
        this.gameDirectory = Objects.requireNonNull(gameDirectory, "gameDirectory");
        this.glossary = Objects.requireNonNull(glossary, "glossary");
        this.actors = Objects.requireNonNull(actors, "actors");
        List<TranslatableUnit> ordered = new ArrayList<>(Objects.requireNonNull(units, "units"));
        ordered.sort(Comparator.comparingInt(TranslatableUnit::orderingKey));
        Map<UnitId, TranslatableUnit> index = new LinkedHashMap<>();
        for (TranslatableUnit unit : ordered) {
            if (index.putIfAbsent(unit.id(), unit) != null) {
                throw new IllegalArgumentException("Duplicate unit id: " + unit.id());
            }
        }
        this.units = List.copyOf(ordered);
        this.unitsById = index;
    }

    public Path gameDirectory() {
        return gameDirectory;
    }

    public List<TranslatableUnit> units() {
        return units;
    }

    public Optional<TranslatableUnit> unit(UnitId id) {
        return Optional.ofNullable(unitsById.get(id));
    }

    public Glossary glossary() {
        return glossary;
    }

    public ActorRegistry actors() {
        return actors;
    }

    /**
     * File ids in document order of their first unit.
     */
    public List<String> files() {
        Set<String> files = new LinkedHashSet<>();
        for (TranslatableUnit unit : units) {
            files.add(unit.id().fileId());
        }
        return List.copyOf(files);
    }

    public List<TranslatableUnit> unitsForFile(String fileId) {
        return units.stream()
                .filter(unit -> unit.id().fileId().equals(fileId))
                .toList();
    }

    public int translatedCount() {
        return (int) units.stream().filter(unit -> unit.status().carriesTranslation()).count();
    }

    public int countByStatus(UnitStatus status) {
        return (int) units.stream().filter(unit -> unit.status() == status).count();
    }

    public FileStats statsForFile(String fileId) {
        int total = 0;
        int translated = 0;
        int reviewed = 0;
        int skipped = 0;
        int failed = 0;
        for (TranslatableUnit unit : unitsForFile(fileId)) {
            total++;
            switch (unit.status()) {
                case TRANSLATED -> translated++;
                case REVIEWED -> reviewed++;
                case SKIPPED -> skipped++;
                case FAILED -> failed++;
                default -> {
                }
            }
        }
        return new FileStats(fileId, total, translated, reviewed, skipped, failed);
    }

    /**
     * Copies every unit under its own monitor together with the glossary and actor tables.
     */
    public ProjectState snapshot() {
        List<TranslatableUnit> copies = units.stream().map(TranslatableUnit::snapshot).toList();
        return new ProjectState(gameDirectory, copies, glossary.copy(), actors.copy());
    }

    /**
     * Carries translations, the project glossary and actor overrides over from a previously saved state.
     * Units are matched by identity and only when their source text is unchanged.
     *
     * @return number of units whose translation state was restored
     */
    public int mergeFrom(ProjectState previous) {
        Objects.requireNonNull(previous, "previous");
        int merged = 0;
        for (TranslatableUnit unit : units) {
            Optional<TranslatableUnit> prior = previous.unit(unit.id());
            if (prior.isPresent() && prior.get().sourceText().equals(unit.sourceText())) {
                unit.restoreFrom(prior.get());
                merged++;
            }
        }
        previous.glossary().layer(GlossaryLayer.PROJECT)
                .forEach((source, target) -> glossary.upsert(GlossaryLayer.PROJECT, source, target));
        for (ActorRecord prior : previous.actors().actors()) {
            if (prior.genderOverridden() && actors.find(prior.id()).isPresent()) {
                actors.overrideGender(prior.id(), prior.gender());
            }
        }
        return merged;
    }
}
