package com.delta.factengine.facts.service;

import com.delta.factengine.config.EngineProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Zero-byte marker file lease. The holder touches the file periodically; a marker whose
 * modification time is older than the stale threshold belongs to a dead run and is reclaimed.
 */
@Component
public class FileRunLease implements RunLease {
    private static final Logger log = LoggerFactory.getLogger(FileRunLease.class);

    private final Path path;
    private final Duration staleAfter;
    private final Duration heartbeatInterval;
    private final Object monitor = new Object();
    private ScheduledExecutorService heartbeat;
    private boolean held;

    @Autowired
    public FileRunLease(EngineProperties properties) {
        this(
            Path.of(properties.getLease().getPath()),
            Duration.ofMinutes(properties.getLease().getStaleAfterMinutes()),
            Duration.ofSeconds(properties.getLease().getHeartbeatSeconds())
        );
    }

    FileRunLease(Path path, Duration staleAfter, Duration heartbeatInterval) {
        this.path = path.toAbsolutePath().normalize();
        this.staleAfter = staleAfter;
        this.heartbeatInterval = heartbeatInterval;
    }

    @Override
    public void acquire() {
        synchronized (monitor) {
            if (held) {
                throw new ActiveRunException("Run lease " + path + " is already held by this process");
            }
            try {
                createMarker();
            } catch (FileAlreadyExistsException e) {
                reclaimIfStale();
            } catch (IOException e) {
                throw new EngineSetupException("Cannot create run lease " + path, e);
            }
            held = true;
            startHeartbeat();
            log.info("Acquired run lease {}", path);
        }
    }

    @Override
    public void release() {
        synchronized (monitor) {
            if (!held) {
                return;
            }
            held = false;
            if (heartbeat != null) {
                heartbeat.shutdownNow();
                heartbeat = null;
            }
            try {
                Files.deleteIfExists(path);
                log.info("Released run lease {}", path);
            } catch (IOException e) {
                log.warn("Failed to delete run lease {}", path, e);
            }
        }
    }

    @Override
    public boolean isHeld() {
        synchronized (monitor) {
            return held;
        }
    }

    Path path() {
        return path;
    }

    private void reclaimIfStale() {
        Instant modifiedAt;
        try {
            modifiedAt = Files.getLastModifiedTime(path).toInstant();
        } catch (NoSuchFileException e) {
            // removed between our create attempt and the stat
            modifiedAt = Instant.EPOCH;
        } catch (IOException e) {
            throw new EngineSetupException("Cannot inspect run lease " + path, e);
        }
        Duration age = Duration.between(modifiedAt, Instant.now());
        if (age.compareTo(staleAfter) < 0) {
            throw new ActiveRunException(
                "Another run holds " + path + " (last heartbeat " + age.toSeconds() + "s ago)");
        }
        log.warn("Reclaiming stale run lease {} (last heartbeat {} minutes ago)", path, age.toMinutes());
        try {
            Files.deleteIfExists(path);
            createMarker();
        } catch (FileAlreadyExistsException e) {
            throw new ActiveRunException("Another run reclaimed " + path + " concurrently");
        } catch (IOException e) {
            throw new EngineSetupException("Cannot reclaim run lease " + path, e);
        }
    }

    private void createMarker() throws IOException {
        Path parent = path.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.createFile(path);
    }

    private void startHeartbeat() {
        heartbeat = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("run-lease-heartbeat");
            thread.setDaemon(true);
            return thread;
        });
        long intervalMs = heartbeatInterval.toMillis();
        heartbeat.scheduleAtFixedRate(this::touch, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    void touch() {
        try {
            Files.setLastModifiedTime(path, FileTime.from(Instant.now()));
        } catch (IOException e) {
            log.warn("Run lease heartbeat failed for {}", path, e);
        }
    }
}
