package ai.gamedata.translator.placeholder;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Replaces control sequences with numbered tokens before translation and restores them afterwards.
 */
public class PlaceholderTransformer {

    private static final Pattern STRAY_TOKEN = Pattern.compile("⟦/?\\d+⟧");

    private final ControlCodeCatalogue catalogue;
    private final PlaceholderRepair repair;

    public PlaceholderTransformer() {
        this(ControlCodeCatalogue.defaultCatalogue(), new PlaceholderRepair());
    }

    public PlaceholderTransformer(ControlCodeCatalogue catalogue, PlaceholderRepair repair) {
        this.catalogue = Objects.requireNonNull(catalogue, "catalogue");
        this.repair = Objects.requireNonNull(repair, "repair");
    }

    public MaskedText mask(String text) {
        Objects.requireNonNull(text, "text");
        List<CodeMatch> matches = catalogue.scan(text);
        if (matches.isEmpty()) {
            return new MaskedText(text, PlaceholderMap.EMPTY);
        }
        List<Replacement> replacements = new ArrayList<>();
        List<Placeholder> placeholders = new ArrayList<>();
        boolean[] usedAsCloser = new boolean[matches.size()];
        int nextIndex = 1;
        for (int i = 0; i < matches.size(); i++) {
            if (usedAsCloser[i]) {
                continue;
            }
            CodeMatch match = matches.get(i);
            int index = nextIndex++;
            if (match.kind() == CodeKind.NAMEBOX_OPEN) {
                int close = findNameboxClose(text, match.end(), matches);
                if (close >= 0) {
                    Placeholder span = Placeholder.span(index, match.text(), ">");
                    placeholders.add(span);
                    replacements.add(new Replacement(match.start(), match.end(), span.token()));
                    replacements.add(new Replacement(close, close + 1, span.closingToken()));
                    continue;
                }
            } else if (match.kind() == CodeKind.COLOR && match.argument() != 0) {
                int closer = findColorClose(matches, i);
                if (closer >= 0) {
                    usedAsCloser[closer] = true;
                    CodeMatch closing = matches.get(closer);
                    Placeholder span = Placeholder.span(index, match.text(), closing.text());
                    placeholders.add(span);
                    replacements.add(new Replacement(match.start(), match.end(), span.token()));
                    replacements.add(new Replacement(closing.start(), closing.end(), span.closingToken()));
                    continue;
                }
            }
            Placeholder single = Placeholder.single(index, match.text());
            placeholders.add(single);
            replacements.add(new Replacement(match.start(), match.end(), single.token()));
        }
        replacements.sort(Comparator.comparingInt(Replacement::start));
        StringBuilder masked = new StringBuilder(text.length());
        int cursor = 0;
        for (Replacement replacement : replacements) {
            masked.append(text, cursor, replacement.start());
            masked.append(replacement.token());
            cursor = replacement.end();
        }
        masked.append(text, cursor, text.length());
        return new MaskedText(masked.toString(), new PlaceholderMap(placeholders));
    }

    /**
     * Substitutes every token occurrence back. Tokens that do not occur are reported, not repaired.
     */
    public UnmaskResult unmask(String translated, PlaceholderMap map) {
        Objects.requireNonNull(translated, "translated");
        Objects.requireNonNull(map, "map");
        String result = translated;
        List<String> missing = new ArrayList<>();
        for (String token : map.tokens()) {
            if (!result.contains(token)) {
                missing.add(token);
                continue;
            }
            result = result.replace(token, map.originalFor(token));
        }
        return new UnmaskResult(result, missing);
    }

    /**
     * Reinserts dropped tokens next to their surviving neighbours, removes tokens the map does not
     * know, then unmasks. The returned result lists the tokens that had to be repaired.
     */
    public UnmaskResult restore(String translated, MaskedText source) {
        Objects.requireNonNull(source, "source");
        PlaceholderMap map = source.placeholders();
        List<String> missing = new ArrayList<>();
        for (String token : map.tokens()) {
            if (!translated.contains(token)) {
                missing.add(token);
            }
        }
        String repaired = missing.isEmpty() ? translated : repair.reinsert(translated, source.text(), map.tokens());
        UnmaskResult unmasked = unmask(repaired, map);
        String cleaned = STRAY_TOKEN.matcher(unmasked.text()).replaceAll("");
        return new UnmaskResult(cleaned, missing);
    }

    private static int findNameboxClose(String text, int from, List<CodeMatch> matches) {
        int position = text.indexOf('>', from);
        while (position >= 0) {
            if (!insideAny(position, matches)) {
                return position;
            }
            position = text.indexOf('>', position + 1);
        }
        return -1;
    }

    private static boolean insideAny(int position, List<CodeMatch> matches) {
        for (CodeMatch match : matches) {
            if (match.covers(position)) {
                return true;
            }
        }
        return false;
    }

    private static int findColorClose(List<CodeMatch> matches, int openerIndex) {
        for (int j = openerIndex + 1; j < matches.size(); j++) {
            CodeMatch candidate = matches.get(j);
            if (candidate.kind() == CodeKind.COLOR) {
                return candidate.argument() == 0 ? j : -1;
            }
        }
        return -1;
    }

    private record Replacement(int start, int end, String token) {
    }
}
