package ai.gamedata.translator.consistency;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Two-layer glossary. Each layer is an immutable map replaced wholesale under a lock, so readers
 * always see a complete snapshot. The project layer wins on lookup.
 */
public final class Glossary {

    private final Object writeLock = new Object();
    private volatile Map<String, String> general;
    private volatile Map<String, String> project;

    public Glossary() {
        this(Map.of(), Map.of());
    }

    public Glossary(Map<String, String> general, Map<String, String> project) {
        this.general = freeze(Objects.requireNonNull(general, "general"));
        this.project = freeze(Objects.requireNonNull(project, "project"));
    }

    public Optional<String> lookup(String term) {
        if (term == null) {
            return Optional.empty();
        }
        String projectHit = project.get(term);
        if (projectHit != null) {
            return Optional.of(projectHit);
        }
        return Optional.ofNullable(general.get(term));
    }

    public boolean contains(String term) {
        return lookup(term).isPresent();
    }

    public Map<String, String> layer(GlossaryLayer layer) {
        return layer == GlossaryLayer.PROJECT ? project : general;
    }

    /**
     * Merged view where project entries override general ones.
     */
    public List<GlossaryEntry> entries() {
        Map<String, String> generalView = general;
        Map<String, String> projectView = project;
        Map<String, GlossaryEntry> merged = new TreeMap<>();
        generalView.forEach((source, target) -> merged.put(source, new GlossaryEntry(source, target, GlossaryLayer.GENERAL)));
        projectView.forEach((source, target) -> merged.put(source, new GlossaryEntry(source, target, GlossaryLayer.PROJECT)));
        return List.copyOf(merged.values());
    }

    /**
     * Entries whose source term occurs in any of the given texts, longest term first.
     */
    public List<GlossaryEntry> entriesOccurringIn(String... texts) {
        List<GlossaryEntry> matches = new ArrayList<>();
        for (GlossaryEntry entry : entries()) {
            for (String text : texts) {
                if (text != null && !entry.sourceTerm().isEmpty() && text.contains(entry.sourceTerm())) {
                    matches.add(entry);
                    break;
                }
            }
        }
        matches.sort(Comparator.comparingInt((GlossaryEntry entry) -> entry.sourceTerm().length()).reversed()
                .thenComparing(GlossaryEntry::sourceTerm));
        return List.copyOf(matches);
    }

    public void upsert(GlossaryLayer layer, String sourceTerm, String targetTerm) {
        requireTerm(sourceTerm, "sourceTerm");
        requireTerm(targetTerm, "targetTerm");
        synchronized (writeLock) {
            Map<String, String> next = new TreeMap<>(layer(layer));
            next.put(sourceTerm, targetTerm);
            replace(layer, next);
        }
    }

    /**
     * Adds a project entry only when no layer knows the term yet.
     *
     * @return {@code true} when the entry was added
     */
    public boolean addIfAbsent(String sourceTerm, String targetTerm) {
        requireTerm(sourceTerm, "sourceTerm");
        requireTerm(targetTerm, "targetTerm");
        synchronized (writeLock) {
            if (contains(sourceTerm)) {
                return false;
            }
            Map<String, String> next = new TreeMap<>(project);
            next.put(sourceTerm, targetTerm);
            replace(GlossaryLayer.PROJECT, next);
            return true;
        }
    }

    public boolean remove(GlossaryLayer layer, String sourceTerm) {
        synchronized (writeLock) {
            Map<String, String> current = layer(layer);
            if (!current.containsKey(sourceTerm)) {
                return false;
            }
            Map<String, String> next = new TreeMap<>(current);
            next.remove(sourceTerm);
            replace(layer, next);
            return true;
        }
    }

    public int size() {
        return entries().size();
    }

    public Glossary copy() {
        return new Glossary(general, project);
    }

    private void replace(GlossaryLayer layer, Map<String, String> next) {
        if (layer == GlossaryLayer.PROJECT) {
            project = freeze(next);
        } else {
            general = freeze(next);
        }
    }

    private static Map<String, String> freeze(Map<String, String> source) {
        return Collections.unmodifiableMap(new TreeMap<>(source));
    }

    private static void requireTerm(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
    }
}
