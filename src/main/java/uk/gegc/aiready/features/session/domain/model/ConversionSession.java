package uk.gegc.aiready.features.session.domain.model;

import lombok.Getter;
import uk.gegc.aiready.shared.exception.ResourceNotFoundException;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * A user's working set of files.
 * The file collection and byte total are guarded by {@link #readLock()} / {@link #writeLock()};
 * last activity and the closed flag may be read without the lock.
 */
public class ConversionSession {

    @Getter
    private final String id;
    @Getter
    private final Instant createdAt;

    private final AtomicReference<Instant> lastActivityAt;
    private final Map<UUID, FileRecord> files = new LinkedHashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    @Getter
    private long totalBytes;
    private volatile boolean closed;

    public ConversionSession(String id, Instant createdAt) {
        this.id = id;
        this.createdAt = createdAt;
        this.lastActivityAt = new AtomicReference<>(createdAt);
    }

    public Lock readLock() {
        return lock.readLock();
    }

    public Lock writeLock() {
        return lock.writeLock();
    }

    public Instant getLastActivityAt() {
        return lastActivityAt.get();
    }

    /**
     * Moves last activity forward to {@code now}; never backwards.
     */
    public void touch(Instant now) {
        lastActivityAt.accumulateAndGet(now, (current, candidate) -> candidate.isAfter(current) ? candidate : current);
    }

    /**
     * Idle once at least {@code ttl} has elapsed since the last activity.
     */
    public boolean isIdle(Instant now, Duration ttl) {
        return !now.isBefore(lastActivityAt.get().plus(ttl));
    }

    public boolean isClosed() {
        return closed;
    }

    public void addFile(FileRecord record) {
        files.put(record.getId(), record);
        totalBytes += record.getSizeBytes();
    }

    public Optional<FileRecord> findFile(UUID fileId) {
        return Optional.ofNullable(files.get(fileId));
    }

    public FileRecord requireFile(UUID fileId) {
        return findFile(fileId)
                .orElseThrow(() -> new ResourceNotFoundException("File " + fileId + " not found"));
    }

    /**
     * Files in upload order.
     */
    public Collection<FileRecord> files() {
        return Collections.unmodifiableCollection(files.values());
    }

    /**
     * Removes the file, releases its bytes and gives its size back to the quota.
     */
    public FileRecord removeFile(UUID fileId) {
        FileRecord record = files.remove(fileId);
        if (record == null) {
            throw new ResourceNotFoundException("File " + fileId + " not found");
        }
        record.release();
        totalBytes -= record.getSizeBytes();
        return record;
    }

    /**
     * Removes and releases every file. Returns how many were removed.
     */
    public int clearFiles() {
        int removed = files.size();
        files.values().forEach(FileRecord::release);
        files.clear();
        totalBytes = 0;
        return removed;
    }

    /**
     * Releases everything and marks the session unusable. Callers still holding a reference see
     * {@link #isClosed()} after acquiring the lock.
     */
    public void close() {
        clearFiles();
        closed = true;
    }

    public SessionSnapshot snapshot() {
        List<FileSnapshot> snapshots = new ArrayList<>(files.size());
        files.values().forEach(record -> snapshots.add(record.snapshot()));
        return new SessionSnapshot(id, createdAt, lastActivityAt.get(), totalBytes, List.copyOf(snapshots));
    }
}
