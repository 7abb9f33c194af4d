package ai.gamedata.translator.batch;

import ai.gamedata.translator.consistency.ActorRegistry;
import ai.gamedata.translator.consistency.Gender;
import ai.gamedata.translator.project.TranslatableUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Queue order for a batch.
 */
final class UnitOrdering {

    private UnitOrdering() {
    }

    static List<TranslatableUnit> order(List<TranslatableUnit> units, BatchOrdering ordering, ActorRegistry actors) {
        List<TranslatableUnit> byDocument = new ArrayList<>(units);
        byDocument.sort(Comparator.comparingInt(TranslatableUnit::orderingKey));
        if (ordering == BatchOrdering.DOCUMENT) {
            return byDocument;
        }
        List<TranslatableUnit> female = new ArrayList<>();
        List<TranslatableUnit> male = new ArrayList<>();
        List<TranslatableUnit> otherDialogue = new ArrayList<>();
        List<TranslatableUnit> rest = new ArrayList<>();
        for (TranslatableUnit unit : byDocument) {
            if (!unit.category().isDialogue()) {
                rest.add(unit);
                continue;
            }
            Gender gender = unit.speaker().map(actors::genderOf).orElse(Gender.UNKNOWN);
            switch (gender) {
                case FEMALE -> female.add(unit);
                case MALE -> male.add(unit);
                default -> otherDialogue.add(unit);
            }
        }
        List<TranslatableUnit> ordered = new ArrayList<>(units.size());
        ordered.addAll(memoryPriority(female));
        ordered.addAll(memoryPriority(male));
        ordered.addAll(memoryPriority(otherDialogue));
        ordered.addAll(memoryPriority(rest));
        return ordered;
    }

    /**
     * First copies of repeated texts go first, shortest first, so their translations are in memory before
     * the repeats come up. Unique texts follow in order, then the remaining repeats.
     */
    static List<TranslatableUnit> memoryPriority(List<TranslatableUnit> units) {
        Map<String, List<TranslatableUnit>> bySource = new LinkedHashMap<>();
        for (TranslatableUnit unit : units) {
            bySource.computeIfAbsent(unit.sourceText(), key -> new ArrayList<>()).add(unit);
        }
        List<TranslatableUnit> seeds = new ArrayList<>();
        List<TranslatableUnit> uniques = new ArrayList<>();
        List<TranslatableUnit> repeats = new ArrayList<>();
        for (List<TranslatableUnit> group : bySource.values()) {
            if (group.size() == 1) {
                uniques.add(group.get(0));
            } else {
                seeds.add(group.get(0));
                repeats.addAll(group.subList(1, group.size()));
            }
        }
        seeds.sort(Comparator.comparingInt((TranslatableUnit unit) -> unit.sourceText().length()));
        repeats.sort(Comparator.comparingInt(TranslatableUnit::orderingKey));
        List<TranslatableUnit> ordered = new ArrayList<>(units.size());
        ordered.addAll(seeds);
        ordered.addAll(uniques);
        ordered.addAll(repeats);
        return ordered;
    }
}
