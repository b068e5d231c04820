package uk.gegc.aiready.features.session.domain.model;

import java.time.Instant;
import java.util.List;

public record SessionSnapshot(
        String id,
        Instant createdAt,
        Instant lastActivityAt,
        long totalBytes,
        List<FileSnapshot> files
) {
}
