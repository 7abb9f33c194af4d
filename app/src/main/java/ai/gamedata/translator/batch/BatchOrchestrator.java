package ai.gamedata.translator.batch;

import ai.gamedata.translator.consistency.ConsistencyStore;
import ai.gamedata.translator.consistency.MemoryClaim;
import ai.gamedata.translator.context.HistoryWindow;
import ai.gamedata.translator.project.ProjectState;
import ai.gamedata.translator.project.TranslatableUnit;
import ai.gamedata.translator.project.UnitStatus;
import ai.gamedata.translator.translate.PassMode;
import ai.gamedata.translator.translate.TranslationException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Runs a batch of units through a fixed pool of workers pulling from one ordered queue.
 * Failures are recorded per unit and never stop the batch.
 */
public class BatchOrchestrator {

    private static final Logger LOGGER = LoggerFactory.getLogger(BatchOrchestrator.class);
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 60;
    private static final int LATENCY_WINDOW = 20;
    private static final int PREVIEW_LENGTH = 40;
    public static final int DEFAULT_CHECKPOINT_INTERVAL = 25;

    private final ProjectState project;
    private final UnitTranslationPipeline pipeline;
    private final ConsistencyStore store;
    private final HistoryWindow history;
    private final InFlightRegistry inFlight;
    private final int checkpointInterval;
    private final Object checkpointLock = new Object();

    public BatchOrchestrator(ProjectState project,
                             UnitTranslationPipeline pipeline,
                             ConsistencyStore store,
                             HistoryWindow history,
                             InFlightRegistry inFlight,
                             int checkpointInterval) {
        this.project = Objects.requireNonNull(project, "project");
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        this.store = Objects.requireNonNull(store, "store");
        this.history = Objects.requireNonNull(history, "history");
        this.inFlight = Objects.requireNonNull(inFlight, "inFlight");
        if (checkpointInterval < 1) {
            throw new IllegalArgumentException("checkpointInterval must be at least 1");
        }
        this.checkpointInterval = checkpointInterval;
    }

    public BatchReport run(BatchRequest request, BatchListener listener, CancellationToken token) {
        Objects.requireNonNull(request, "request");
        BatchListener safeListener = listener == null ? BatchListener.NONE : listener;
        CancellationToken safeToken = token == null ? new CancellationToken() : token;

        List<TranslatableUnit> ordered = UnitOrdering.order(request.units(), request.ordering(), store.actors());
        if (request.mode() == PassMode.TRANSLATE) {
            int seeded = store.memory().seed(project.units());
            LOGGER.debug("Translation memory seeded with {} entries", seeded);
        }
        BlockingQueue<TranslatableUnit> queue = new LinkedBlockingQueue<>(ordered);
        Run run = new Run(request, safeListener, safeToken, ordered.size());
        LOGGER.info("Starting {} batch of {} unit(s) with {} worker(s), {} order",
                request.mode(), ordered.size(), request.workerCount(), request.ordering());

        ExecutorService executor = Executors.newFixedThreadPool(request.workerCount(), workerThreads());
        List<Future<?>> workers = new ArrayList<>();
        for (int i = 0; i < request.workerCount(); i++) {
            workers.add(executor.submit(() -> drain(queue, run)));
        }
        try {
            for (Future<?> worker : workers) {
                awaitWorker(worker, safeToken);
            }
        } finally {
            shutdown(executor);
        }

        int pending = (int) Stream.of(queue, run.deferred, run.busy)
                .flatMap(Collection::stream)
                .filter(unit -> needsWork(unit, request.mode()))
                .count();
        if (run.changedSinceCheckpoint()) {
            emitCheckpoint(run);
        }
        BatchReport report = run.tally.toReport(pending, safeToken.isCancelled());
        LOGGER.info("Batch finished: {} translated, {} from memory, {} from glossary, {} skipped, {} failed, {} pending{}",
                report.translated(), report.memoryHits(), report.glossaryHits(), report.skipped(), report.failed(),
                report.pending(), report.cancelled() ? " (cancelled)" : "");
        return report;
    }

    private void drain(BlockingQueue<TranslatableUnit> queue, Run run) {
        while (!run.token.isCancelled()) {
            TranslatableUnit unit = queue.poll();
            if (unit != null) {
                if (!process(unit, run)) {
                    LOGGER.debug("Unit {} is held by a command; trying again after the queue drains", unit.id());
                    run.deferred.add(unit);
                }
                continue;
            }
            TranslatableUnit deferred = run.deferred.poll();
            if (deferred == null) {
                return;
            }
            if (!process(deferred, run)) {
                LOGGER.warn("Unit {} is still held by a command; leaving it pending", deferred.id());
                run.busy.add(deferred);
            }
        }
    }

    /**
     * @return false when the unit is claimed elsewhere and was not processed
     */
    private boolean process(TranslatableUnit unit, Run run) {
        if (!needsWork(unit, run.request.mode())) {
            run.tally.skipped();
            reportProgress(unit, run);
            return true;
        }
        if (!inFlight.tryClaim(unit.id())) {
            return false;
        }
        MDC.put("unit", unit.id().toString());
        MDC.put("file", unit.id().fileId());
        long started = System.nanoTime();
        try {
            int completed = run.request.mode() == PassMode.TRANSLATE ? translate(unit, run) : polish(unit, run);
            run.latencies.record(Duration.ofNanos(System.nanoTime() - started));
            checkpointIfDue(completed, run);
        } finally {
            inFlight.release(unit.id());
            MDC.remove("unit");
            MDC.remove("file");
        }
        reportProgress(unit, run);
        return true;
    }

    private int translate(TranslatableUnit unit, Run run) {
        Optional<String> glossaryHit = store.glossary().lookup(unit.sourceText().strip());
        if (glossaryHit.isPresent()) {
            unit.markTranslated(glossaryHit.get());
            LOGGER.debug("Filled {} from the glossary", unit.id());
            return run.tally.glossaryHit();
        }
        while (true) {
            MemoryClaim claim = store.memory().claim(unit.sourceText());
            if (!claim.isOwner()) {
                Optional<String> remembered = claim.await();
                if (remembered.isPresent()) {
                    unit.markTranslated(remembered.get());
                    propagateName(unit, remembered.get(), run);
                    LOGGER.debug("Filled {} from translation memory", unit.id());
                    return run.tally.memoryHit();
                }
                continue;
            }
            boolean settled = false;
            try {
                PipelineResult result = pipeline.run(unit, PassMode.TRANSLATE, history.snapshot(),
                        Optional.empty(), Optional.empty());
                claim.complete(result.text());
                settled = true;
                unit.markTranslated(result.text());
                history.add(result.historyEntry());
                propagateName(unit, result.text(), run);
                recordWarnings(result, run);
                return run.tally.translated();
            } catch (TranslationException ex) {
                claim.abandon(ex);
                settled = true;
                return fail(unit, ex, run);
            } catch (RuntimeException ex) {
                claim.abandon(ex);
                settled = true;
                LOGGER.error("Unexpected failure translating {}", unit.id(), ex);
                return fail(unit, ex, run);
            } finally {
                // errors bypass the handlers above; waiters must still be released
                if (!settled) {
                    claim.abandon(new IllegalStateException("Translation of " + unit.id() + " was aborted"));
                }
            }
        }
    }

    private int polish(TranslatableUnit unit, Run run) {
        try {
            PipelineResult result = pipeline.run(unit, PassMode.POLISH, history.snapshot(), Optional.empty(), Optional.empty());
            unit.markTranslated(result.text());
            history.add(result.historyEntry());
            recordWarnings(result, run);
            return run.tally.translated();
        } catch (TranslationException ex) {
            LOGGER.warn("Polish failed for {}; keeping the current translation: {}", unit.id(), ex.getMessage());
            run.listener.onUnitFailed(unit.id(), ErrorKind.TRANSIENT, ex.getMessage());
            return run.tally.failed(unit.id(), ex.getMessage());
        }
    }

    private int fail(TranslatableUnit unit, RuntimeException ex, Run run) {
        String message = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
        LOGGER.warn("Translation failed for {}: {}", unit.id(), message);
        unit.markFailed(message);
        run.listener.onUnitFailed(unit.id(), ErrorKind.TRANSIENT, message);
        return run.tally.failed(unit.id(), message);
    }

    private void propagateName(TranslatableUnit unit, String translation, Run run) {
        if (!run.request.autoGlossary() || !unit.category().isName()) {
            return;
        }
        String term = unit.sourceText().strip();
        String target = translation.strip();
        if (term.isEmpty() || target.isEmpty() || term.contains("\n")) {
            return;
        }
        if (store.glossary().addIfAbsent(term, target)) {
            LOGGER.info("Added glossary entry {} = {}", term, target);
        }
    }

    private static void recordWarnings(PipelineResult result, Run run) {
        if (result.leakageRetried()) {
            run.tally.error(ErrorKind.LEAKAGE);
        }
        if (result.retryFailed()) {
            run.tally.error(ErrorKind.TRANSIENT);
        }
        if (!result.repairedTokens().isEmpty()) {
            run.tally.error(ErrorKind.PLACEHOLDER_DRIFT);
        }
    }

    private void checkpointIfDue(int completed, Run run) {
        if (completed > 0 && completed % checkpointInterval == 0) {
            emitCheckpoint(run);
        }
    }

    private void emitCheckpoint(Run run) {
        synchronized (checkpointLock) {
            int completed = run.tally.completedCount();
            run.lastCheckpoint.set(completed);
            try {
                run.listener.onCheckpoint(new CheckpointEvent(completed, project.snapshot()));
            } catch (RuntimeException ex) {
                LOGGER.error("Checkpoint after {} unit(s) failed", completed, ex);
            }
        }
    }

    private void reportProgress(TranslatableUnit unit, Run run) {
        int processed = run.tally.processed();
        Optional<Duration> eta = run.latencies.estimateRemaining(run.total - processed, run.request.workerCount());
        run.listener.onProgress(new ProgressEvent(processed, run.total, unit.id(), preview(unit), eta));
    }

    private static String preview(TranslatableUnit unit) {
        String text = unit.translation().isEmpty() ? unit.sourceText() : unit.translation();
        String flat = text.replace('\n', ' ');
        return flat.length() <= PREVIEW_LENGTH ? flat : flat.substring(0, PREVIEW_LENGTH) + "…";
    }

    public static boolean needsWork(TranslatableUnit unit, PassMode mode) {
        UnitStatus status = unit.status();
        if (mode == PassMode.POLISH) {
            return status == UnitStatus.TRANSLATED && !unit.translation().isBlank();
        }
        return !status.isSettled();
    }

    private static void awaitWorker(Future<?> worker, CancellationToken token) {
        try {
            worker.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            token.cancel();
            LOGGER.warn("Interrupted while waiting for workers; cancelling batch");
        } catch (ExecutionException ex) {
            token.cancel();
            throw new IllegalStateException("Batch worker failed", ex.getCause());
        }
    }

    private static void shutdown(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                LOGGER.warn("Workers did not terminate in time, forcing shutdown");
                executor.shutdownNow();
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "batch-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private static final class Run {

        private final BatchRequest request;
        private final BatchListener listener;
        private final CancellationToken token;
        private final int total;
        private final BatchTally tally = new BatchTally();
        private final LatencyTracker latencies = new LatencyTracker(LATENCY_WINDOW);
        private final AtomicInteger lastCheckpoint = new AtomicInteger();
        private final Queue<TranslatableUnit> deferred = new ConcurrentLinkedQueue<>();
        private final Queue<TranslatableUnit> busy = new ConcurrentLinkedQueue<>();

        Run(BatchRequest request, BatchListener listener, CancellationToken token, int total) {
            this.request = request;
            this.listener = listener;
            this.token = token;
            this.total = total;
        }

        boolean changedSinceCheckpoint() {
            return tally.completedCount() > lastCheckpoint.get();
        }
    }
}
