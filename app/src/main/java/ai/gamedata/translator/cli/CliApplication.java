package ai.gamedata.translator.cli;

import ai.gamedata.translator.batch.BatchListener;
import ai.gamedata.translator.batch.BatchOrchestrator;
import ai.gamedata.translator.batch.BatchReport;
import ai.gamedata.translator.batch.BatchRequest;
import ai.gamedata.translator.batch.CancellationToken;
import ai.gamedata.translator.batch.CheckpointEvent;
import ai.gamedata.translator.batch.ErrorKind;
import ai.gamedata.translator.batch.InFlightRegistry;
import ai.gamedata.translator.batch.ProgressEvent;
import ai.gamedata.translator.batch.UnitCommandService;
import ai.gamedata.translator.batch.UnitTranslationPipeline;
import ai.gamedata.translator.codec.ActorScanner;
import ai.gamedata.translator.codec.GameDataCodec;
import ai.gamedata.translator.codec.GameDataReader;
import ai.gamedata.translator.codec.StructuralMismatchException;
import ai.gamedata.translator.config.Config;
import ai.gamedata.translator.config.ConfigLoader;
import ai.gamedata.translator.config.Secrets;
import ai.gamedata.translator.config.SystemEnvironmentReader;
import ai.gamedata.translator.config.TranslatorConfig;
import ai.gamedata.translator.consistency.ConsistencyStore;
import ai.gamedata.translator.consistency.GeneralGlossaryStore;
import ai.gamedata.translator.consistency.TranslationMemory;
import ai.gamedata.translator.context.ContextAssembler;
import ai.gamedata.translator.context.HistoryWindow;
import ai.gamedata.translator.export.ExportReport;
import ai.gamedata.translator.export.ExportService;
import ai.gamedata.translator.logging.LoggingConfigurator;
import ai.gamedata.translator.placeholder.PlaceholderTransformer;
import ai.gamedata.translator.project.JsonProjectStore;
import ai.gamedata.translator.project.ProjectOpener;
import ai.gamedata.translator.project.ProjectState;
import ai.gamedata.translator.project.ProjectStoreException;
import ai.gamedata.translator.project.TranslatableUnit;
import ai.gamedata.translator.project.UnitId;
import ai.gamedata.translator.translate.ChatModelTranslator;
import ai.gamedata.translator.translate.Correction;
import ai.gamedata.translator.translate.MockTranslator;
import ai.gamedata.translator.translate.PassThroughTranslator;
import ai.gamedata.translator.translate.RetryingTranslator;
import ai.gamedata.translator.translate.TranslationException;
import ai.gamedata.translator.translate.TranslationPromptBuilder;
import ai.gamedata.translator.translate.Translator;
import ai.gamedata.translator.translate.TranslatorFactory;
import ai.gamedata.translator.wordwrap.PluginAnalysis;
import ai.gamedata.translator.wordwrap.PluginAnalyzer;
import ai.gamedata.translator.wordwrap.WordWrapProcessor;
import ai.gamedata.translator.wordwrap.WordWrapReport;
import ai.gamedata.translator.wordwrap.WordWrapSettings;
import ai.gamedata.translator.writer.DocumentWriter;
import ai.gamedata.translator.writer.SegmentFitter;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration and the translation pipeline.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);
    private static final String SOURCE_LANGUAGE = "Japanese";
    private static final int PROGRESS_LOG_EVERY = 10;
    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    private final ConfigLoader configLoader;
    private final GeneralGlossaryStore glossaryStore;
    private final JsonProjectStore projectStore;
    private final GameDataReader reader;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()));
    }

    CliApplication(ConfigLoader configLoader) {
        this.configLoader = Objects.requireNonNull(configLoader, "configLoader");
        this.glossaryStore = new GeneralGlossaryStore();
        this.projectStore = new JsonProjectStore();
        this.reader = new GameDataReader();
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException | IllegalStateException ex) {
            LOGGER.error("Invalid configuration: {}", ex.getMessage());
            return EXIT_FAILURE;
        }
        LoggingConfigurator.configure(config.logFormat());
        LOGGER.info("Game {} (state {}), {} pass, translation mode {}",
                config.gameDirectory(), config.statePath(), config.passMode(), config.translationMode());
        if (!config.translationMode().usesLanguageModel()) {
            LOGGER.warn("Translation mode {} does not call a language model; results are placeholders",
                    config.translationMode());
        }

        try {
            return execute(config);
        } catch (StructuralMismatchException ex) {
            LOGGER.error("Export aborted; game data does not match the project:");
            ex.mismatches().forEach(mismatch -> LOGGER.error("  {}", mismatch));
            return EXIT_FAILURE;
        } catch (ProjectStoreException | UncheckedIOException | IllegalStateException ex) {
            LOGGER.error("Run failed: {}", ex.getMessage(), ex);
            return EXIT_FAILURE;
        }
    }

    private int execute(Config config) {
        GameDataCodec codec = new GameDataCodec(new SegmentFitter(config.segmentOverflow()));
        Map<String, String> generalTerms = glossaryStore.load(config.generalGlossaryPath());
        ProjectOpener opener = new ProjectOpener(reader, codec, new ActorScanner(), projectStore);
        ProjectState project = opener.open(config.gameDirectory(), config.statePath(), generalTerms);

        if (config.retranslateUnit().isPresent()) {
            retranslate(config, project, config.retranslateUnit().get());
        } else if (config.translate()) {
            BatchReport report = runBatch(config, project);
            logSummary(report);
        }
        if (config.wordWrap()) {
            PluginAnalysis analysis = new PluginAnalyzer()
                    .analyze(config.gameDirectory(), reader.locateDataDirectory(config.gameDirectory()));
            LOGGER.info("Message window: {}", analysis.summary());
            WordWrapSettings settings = config.wordWrapOverrides().applyTo(analysis.settings());
            WordWrapReport wrap = new WordWrapProcessor(settings).applyAll(project.units());
            wrap.overflow().forEach(id -> LOGGER.debug("Paginates in game: {}", id));
        }

        projectStore.save(project, config.statePath());
        glossaryStore.save(project.glossary(), config.generalGlossaryPath());
        LOGGER.info("Saved project state to {}", config.statePath());

        if (config.export()) {
            ExportService exporter = new ExportService(reader, codec, new DocumentWriter());
            ExportReport exported = exporter.export(project, reader.locateDataDirectory(config.gameDirectory()));
            if (exported.backupCreated()) {
                LOGGER.info("Original data backed up before the first export");
            }
        }
        return EXIT_OK;
    }

    private BatchReport runBatch(Config config, ProjectState project) {
        List<TranslatableUnit> selected = project.units().stream()
                .filter(config.scope()::includes)
                .filter(unit -> BatchOrchestrator.needsWork(unit, config.passMode()))
                .limit(config.hasLimit() ? config.limit() : Long.MAX_VALUE)
                .collect(Collectors.toList());
        if (selected.isEmpty()) {
            LOGGER.info("Nothing to do for scope {}", config.scope());
            return BatchReport.empty();
        }

        ConsistencyStore store = new ConsistencyStore(project.glossary(), new TranslationMemory(), project.actors());
        UnitTranslationPipeline pipeline = createPipeline(config, store);
        BatchOrchestrator orchestrator = new BatchOrchestrator(project, pipeline, store,
                new HistoryWindow(config.historyWindowSize()), new InFlightRegistry(), config.checkpointInterval());

        CancellationToken token = new CancellationToken();
        Thread hook = new Thread(() -> {
            LOGGER.warn("Shutdown requested; finishing in-flight units");
            token.cancel();
        }, "batch-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);
        try {
            BatchRequest request = new BatchRequest(selected, config.workers(), config.passMode(), config.ordering(),
                    config.scope().autoGlossary());
            return orchestrator.run(request, new CheckpointingListener(config), token);
        } finally {
            removeHook(hook);
        }
    }

    private void retranslate(Config config, ProjectState project, UnitId unitId) {
        TranslatableUnit unit = project.unit(unitId)
                .orElseThrow(() -> new IllegalStateException("No unit " + unitId + " in the project"));
        ConsistencyStore store = new ConsistencyStore(project.glossary(), new TranslationMemory(), project.actors());
        UnitCommandService commands = new UnitCommandService(createPipeline(config, store),
                new HistoryWindow(config.historyWindowSize()), new InFlightRegistry());
        Optional<Correction> correction = config.retranslateHint()
                .map(hint -> new Correction(hint, unit.translation()));
        try {
            String translation = commands.retranslate(unit, correction);
            LOGGER.info("{} is now: {}", unitId, translation);
        } catch (TranslationException ex) {
            throw new IllegalStateException("Retranslation of " + unitId + " failed: " + ex.getMessage(), ex);
        }
    }

    private UnitTranslationPipeline createPipeline(Config config, ConsistencyStore store) {
        PlaceholderTransformer transformer = new PlaceholderTransformer();
        ContextAssembler assembler = new ContextAssembler(store, transformer, config.historyWindowSize());
        return new UnitTranslationPipeline(createTranslator(config), assembler, transformer);
    }

    private Translator createTranslator(Config config) {
        TranslatorFactory factory = new TranslatorFactory(
                () -> new RetryingTranslator(createProductionTranslator(config), config.retryPolicy()),
                new PassThroughTranslator(),
                new MockTranslator());
        return factory.select(config.translationMode());
    }

    private Translator createProductionTranslator(Config config) {
        TranslatorConfig translatorConfig = config.translatorConfig();
        ChatModel chatModel = switch (translatorConfig.provider()) {
            case OLLAMA -> createOllamaChatModel(translatorConfig);
            case GEMINI -> createGeminiChatModel(translatorConfig, config.secrets());
        };
        TranslationPromptBuilder prompts = new TranslationPromptBuilder(SOURCE_LANGUAGE, translatorConfig.targetLanguage());
        return new ChatModelTranslator(chatModel, translatorConfig.provider().name(), translatorConfig.modelName(), prompts);
    }

    private ChatModel createOllamaChatModel(TranslatorConfig translatorConfig) {
        try {
            String baseUrl = translatorConfig.baseUrl()
                    .orElseThrow(() -> new IllegalStateException("OLLAMA_BASE_URL must be configured when LLM_PROVIDER=ollama"));
            LOGGER.info("Using Ollama model '{}' via {}", translatorConfig.modelName(), baseUrl);
            return OllamaChatModel.builder()
                    .baseUrl(baseUrl)
                    .modelName(translatorConfig.modelName())
                    .temperature(0.1)
                    .timeout(translatorConfig.timeout())
                    .build();
        } catch (RuntimeException ex) {
            throw new IllegalStateException("Failed to initialize Ollama chat model", ex);
        }
    }

    private ChatModel createGeminiChatModel(TranslatorConfig translatorConfig, Secrets secrets) {
        String apiKey = secrets.geminiApiKey()
                .orElseThrow(() -> new IllegalStateException("GEMINI_API_KEY must be provided when LLM_PROVIDER=gemini"));
        try {
            LOGGER.info("Using Gemini model '{}'", translatorConfig.modelName());
            return GoogleAiGeminiChatModel.builder()
                    .apiKey(apiKey)
                    .modelName(translatorConfig.modelName())
                    .temperature(0.1)
                    .timeout(translatorConfig.timeout())
                    .build();
        } catch (RuntimeException ex) {
            throw new IllegalStateException("Failed to initialize Gemini chat model", ex);
        }
    }

    private static void logSummary(BatchReport report) {
        for (ErrorKind kind : ErrorKind.values()) {
            int count = report.errorCount(kind);
            if (count > 0) {
                LOGGER.warn("{} unit(s) hit {}", count, kind);
            }
        }
        if (!report.failures().isEmpty()) {
            LOGGER.warn("Failed units (retried on the next run): {}", report.failures().keySet());
        }
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException ex) {
            LOGGER.debug("JVM is already shutting down; hook stays registered", ex);
        }
    }

    private final class CheckpointingListener implements BatchListener {

        private final Config config;

        private CheckpointingListener(Config config) {
            this.config = config;
        }

        @Override
        public void onProgress(ProgressEvent event) {
            if (event.completed() % PROGRESS_LOG_EVERY == 0 || event.completed() == event.total()) {
                String eta = event.eta().map(duration -> ", ~" + duration.toSeconds() + "s left").orElse("");
                LOGGER.info("[{}/{}] {}{}", event.completed(), event.total(), event.preview(), eta);
            }
        }

        @Override
        public void onCheckpoint(CheckpointEvent event) {
            projectStore.save(event.snapshot(), config.statePath());
            LOGGER.info("Checkpoint saved after {} unit(s)", event.completedUnits());
        }

        @Override
        public void onUnitFailed(UnitId unitId, ErrorKind kind, String message) {
            LOGGER.debug("{} failed ({}): {}", unitId, kind, message);
        }
    }
}
