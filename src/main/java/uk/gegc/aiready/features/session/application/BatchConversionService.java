package uk.gegc.aiready.features.session.application;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import uk.gegc.aiready.features.conversion.application.ConversionDispatcher;
import uk.gegc.aiready.features.conversion.domain.ConversionSource;
import uk.gegc.aiready.features.conversion.domain.ExtractionException;
import uk.gegc.aiready.features.conversion.domain.InputCategory;
import uk.gegc.aiready.features.conversion.domain.OutputFilenames;
import uk.gegc.aiready.features.conversion.domain.RenderedOutput;
import uk.gegc.aiready.features.conversion.domain.UnsupportedFormatException;
import uk.gegc.aiready.features.session.domain.FileState;
import uk.gegc.aiready.features.session.domain.model.ConversionResult;
import uk.gegc.aiready.features.session.domain.model.ConversionSession;
import uk.gegc.aiready.features.session.domain.model.FileRecord;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Converts every pending file of a session.
 *
 * <p>The whole batch runs under the session's exclusive lock. Extraction of each file is submitted to the
 * conversion executor and touches only that file's bytes; outcomes are folded back into the records on the
 * calling thread in upload order. A failure of one file never affects the others.
 */
@Service
@Slf4j
public class BatchConversionService {

    private final SessionStore sessionStore;
    private final ConversionDispatcher dispatcher;
    private final Executor conversionExecutor;
    private final ConversionMetrics metrics;
    private final Clock clock;

    public BatchConversionService(SessionStore sessionStore,
                                  ConversionDispatcher dispatcher,
                                  @Qualifier("conversionTaskExecutor") Executor conversionExecutor,
                                  ConversionMetrics metrics,
                                  Clock clock) {
        this.sessionStore = sessionStore;
        this.dispatcher = dispatcher;
        this.conversionExecutor = conversionExecutor;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Converts all files in the uploaded state. Returns one result per file converted in this call, in upload
     * order, or an empty list when nothing is pending.
     */
    public List<ConversionResult> convertAll(String sessionId) {
        return sessionStore.write(sessionId, this::convertPending);
    }

    private List<ConversionResult> convertPending(ConversionSession session) {
        List<FileRecord> pending = session.files().stream()
                .filter(record -> record.getState() == FileState.UPLOADED)
                .toList();
        if (pending.isEmpty()) {
            log.debug("No pending files in session {}", session.getId());
            return List.of();
        }

        log.info("Converting {} files in session {}", pending.size(), session.getId());
        try {
            List<CompletableFuture<Outcome>> outcomes = new ArrayList<>(pending.size());
            for (FileRecord record : pending) {
                record.markConverting();
                ConversionSource source = record.toConversionSource();
                InputCategory category = record.getCategory();
                outcomes.add(CompletableFuture.supplyAsync(() -> convertOne(source, category), conversionExecutor));
            }

            List<ConversionResult> results = new ArrayList<>(pending.size());
            for (int i = 0; i < pending.size(); i++) {
                FileRecord record = pending.get(i);
                apply(session, record, outcomes.get(i).join());
                results.add(ConversionResult.of(record));
            }

            long failed = results.stream().filter(result -> !result.succeeded()).count();
            log.info("Converted {} files in session {} ({} failed)", results.size(), session.getId(), failed);
            return results;
        } finally {
            for (FileRecord record : pending) {
                if (record.getState() == FileState.CONVERTING) {
                    log.warn("Rolling back file {} in session {} to uploaded", record.getId(), session.getId());
                    record.rollbackToUploaded();
                }
            }
        }
    }

    private Outcome convertOne(ConversionSource source, InputCategory category) {
        long start = System.nanoTime();
        Outcome outcome;
        try {
            outcome = Outcome.success(dispatcher.convert(source));
        } catch (ExtractionException | UnsupportedFormatException e) {
            log.warn("Conversion of '{}' failed: {}", source.filename(), e.getMessage());
            outcome = Outcome.failure(e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected error converting '{}'", source.filename(), e);
            outcome = Outcome.failure("Unexpected error while converting: " + e.getMessage());
        } catch (StackOverflowError e) {
            // Deeply nested input; the stack has unwound by now
            log.error("Stack overflow converting '{}'", source.filename());
            outcome = Outcome.failure("File structure is nested too deeply to convert");
        }
        metrics.recordConversion(category, outcome.output() != null, Duration.ofNanos(System.nanoTime() - start));
        return outcome;
    }

    private void apply(ConversionSession session, FileRecord record, Outcome outcome) {
        if (outcome.output() == null) {
            record.markFailed(outcome.error(), clock.instant());
            return;
        }
        List<String> taken = session.files().stream()
                .filter(other -> other != record)
                .map(FileRecord::getOutputFilename)
                .toList();
        String outputFilename = OutputFilenames.deduplicate(outcome.output().outputFilename(), taken);
        record.markConverted(outputFilename, outcome.output().text(), clock.instant());
        log.debug("File {} converted to {}", record.getId(), outputFilename);
    }

    private record Outcome(RenderedOutput output, String error) {

        static Outcome success(RenderedOutput output) {
            return new Outcome(output, null);
        }

        static Outcome failure(String error) {
            return new Outcome(null, error);
        }
    }
}
