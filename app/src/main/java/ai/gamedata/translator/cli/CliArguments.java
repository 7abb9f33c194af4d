package ai.gamedata.translator.cli;

import ai.gamedata.translator.batch.BatchOrdering;
import ai.gamedata.translator.batch.BatchScope;
import ai.gamedata.translator.config.LogFormat;
import ai.gamedata.translator.translate.PassMode;
import ai.gamedata.translator.translate.TranslationMode;
import java.nio.file.Path;
import picocli.CommandLine;

@CommandLine.Command(name = "rpgmaker-translator", mixinStandardHelpOptions = true,
        description = "Translates RPG Maker MV/MZ game data with a language model")
public class CliArguments {

    @CommandLine.Option(names = "--game-dir", required = true, description = "Game directory containing the data folder", paramLabel = "DIR")
    private Path gameDirectory;

    @CommandLine.Option(names = "--state", description = "Project state file (default: <game-dir>/translation_project.json)", paramLabel = "FILE")
    private Path statePath;

    @CommandLine.Option(names = "--batch-mode", converter = PassModeConverter.class, description = "Batch pass: translate or polish")
    private PassMode passMode;

    @CommandLine.Option(names = "--order", converter = BatchOrderingConverter.class, description = "Unit order: document or actor")
    private BatchOrdering ordering;

    @CommandLine.Option(names = "--scope", converter = BatchScopeConverter.class, description = "Units to process: all, database or dialogue")
    private BatchScope scope;

    @CommandLine.Option(names = "--workers", description = "Number of concurrent translation workers", paramLabel = "COUNT")
    private Integer workers;

    @CommandLine.Option(names = "--translation-mode", description = "Translation execution mode: production, dry-run, or mock", converter = TranslationModeConverter.class)
    private TranslationMode translationMode;

    @CommandLine.Option(names = "--limit", description = "Maximum number of units to submit in this run", paramLabel = "COUNT")
    private Integer limit;

    @CommandLine.Option(names = "--word-wrap", description = "Re-wrap translations to the message window after the batch")
    private boolean wordWrap;

    @CommandLine.Option(names = "--export", description = "Write translations back into the game data after the batch")
    private boolean export;

    @CommandLine.Option(names = "--no-translate", description = "Skip the batch; only load, wrap or export")
    private boolean noTranslate;

    @CommandLine.Option(names = "--retranslate", description = "Translate one unit again instead of running the batch", paramLabel = "UNIT_ID")
    private String retranslate;

    @CommandLine.Option(names = "--hint", description = "Reviewer note sent with --retranslate", paramLabel = "TEXT")
    private String hint;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    public Path gameDirectory() {
        return gameDirectory;
    }

    public Path statePath() {
        return statePath;
    }

    public PassMode passMode() {
        return passMode;
    }

    public BatchOrdering ordering() {
        return ordering;
    }

    public BatchScope scope() {
        return scope;
    }

    public Integer workers() {
        return workers;
    }

    public TranslationMode translationMode() {
        return translationMode;
    }

    public Integer limit() {
        return limit;
    }

    public boolean wordWrap() {
        return wordWrap;
    }

    public boolean export() {
        return export;
    }

    public boolean noTranslate() {
        return noTranslate;
    }

    public String retranslate() {
        return retranslate;
    }

    public String hint() {
        return hint;
    }

    public LogFormat logFormat() {
        return logFormat;
    }
}
