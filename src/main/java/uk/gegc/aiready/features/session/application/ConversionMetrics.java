package uk.gegc.aiready.features.session.application;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.aiready.features.conversion.domain.InputCategory;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Micrometer instrumentation for uploads, conversions, archives and session expiry.
 */
@Slf4j
@Component
public class ConversionMetrics {

    private final MeterRegistry meterRegistry;

    private final Counter uploadsAcceptedCounter;
    private final Counter archivesBuiltCounter;
    private final Counter sessionsExpiredCounter;

    public ConversionMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.uploadsAcceptedCounter = Counter.builder("converter.uploads.accepted")
                .description("Number of files accepted for conversion")
                .register(meterRegistry);
        this.archivesBuiltCounter = Counter.builder("converter.archives.built")
                .description("Number of ZIP archives assembled")
                .register(meterRegistry);
        this.sessionsExpiredCounter = Counter.builder("converter.sessions.expired")
                .description("Number of sessions removed by the expiry sweeper")
                .register(meterRegistry);
    }

    /**
     * Registers the active-sessions gauge against the store's size.
     */
    public void bindActiveSessions(Supplier<Number> activeSessions) {
        Gauge.builder("converter.sessions.active", activeSessions)
                .description("Number of live sessions")
                .register(meterRegistry);
    }

    public void recordUploadAccepted() {
        uploadsAcceptedCounter.increment();
    }

    public void recordUploadRejected(String reason) {
        Counter.builder("converter.uploads.rejected")
                .description("Number of uploads rejected at validation")
                .tag("reason", reason)
                .register(meterRegistry)
                .increment();
    }

    public void recordConversion(InputCategory category, boolean success, Duration duration) {
        String categoryTag = category.getValue();
        Counter.builder("converter.conversions")
                .description("Number of files converted, by outcome")
                .tag("category", categoryTag)
                .tag("outcome", success ? "success" : "error")
                .register(meterRegistry)
                .increment();
        Timer.builder("converter.conversion.duration")
                .description("Time spent extracting and rendering one file")
                .tag("category", categoryTag)
                .register(meterRegistry)
                .record(duration);
        log.debug("Recorded {} conversion of category {} in {} ms",
                success ? "successful" : "failed", categoryTag, duration.toMillis());
    }

    public void recordArchiveBuilt() {
        archivesBuiltCounter.increment();
    }

    public void recordSessionExpired() {
        sessionsExpiredCounter.increment();
    }
}
