package uk.gegc.aiready.features.session.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Data
@Validated
@Component
@ConfigurationProperties(prefix = "app.session")
public class SessionProperties {

    /**
     * Idle time after which a session and all its files are discarded.
     */
    @NotNull
    private Duration ttl = Duration.ofMinutes(15);

    /**
     * Largest single upload.
     */
    @NotNull
    private DataSize maxFileSize = DataSize.ofMegabytes(10);

    /**
     * Largest cumulative size of the files held by one session.
     */
    @NotNull
    private DataSize maxSessionSize = DataSize.ofMegabytes(50);

    /**
     * Number of characters returned by the preview endpoint.
     */
    @Min(1)
    private int previewLength = 2000;

    /**
     * Delay between expiry sweeps, in milliseconds. Must be shorter than the TTL.
     */
    @Min(1000)
    private long sweepIntervalMs = 60_000;
}
