package ai.gamedata.translator.project;

/**
 * Per-file progress summary.
 */
public record FileStats(String fileId, int total, int translated, int reviewed, int skipped, int failed) {

    public int untranslated() {
        return total - translated - reviewed - skipped - failed;
    }

    public double completionRatio() {
        if (total == 0) {
            return 1.0;
        }
        return (double) (translated + reviewed + skipped) / total;
    }
}
