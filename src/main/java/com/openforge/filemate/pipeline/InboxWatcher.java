package com.openforge.filemate.pipeline;

import com.openforge.filemate.archive.ArchiveUnavailableException;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Watch mode: files dropped into the inbox are filed as they arrive.
 *
 * Each create event (re)starts a debounce timer for its path so a file still
 * being written is not read half-way.  All processing runs on one scheduler
 * thread, and a path already in progress is never picked up a second time.
 */
@Slf4j
@Component
public class InboxWatcher implements Closeable {

    private final InboxProcessor           processor;
    private final ProcessingProperties     processing;
    private final ScheduledExecutorService scheduler;
    private final Set<Path>                inFlight = ConcurrentHashMap.newKeySet();
    private final Map<Path, ScheduledFuture<?>> pending = new ConcurrentHashMap<>();

    private volatile WatchService watchService;
    private volatile boolean      running;

    public InboxWatcher(InboxProcessor processor, ProcessingProperties processing) {
        this.processor  = processor;
        this.processing = processing;
        this.scheduler  = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "inbox-watcher");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Files what is already in the inbox, then blocks handling new arrivals
     * until {@link #close()} is called or the thread is interrupted.
     */
    public void watch(Path inbox, boolean dryRun) throws IOException {
        Files.createDirectories(inbox);
        processor.processAll(inbox, dryRun);

        watchService = FileSystems.getDefault().newWatchService();
        inbox.register(watchService, StandardWatchEventKinds.ENTRY_CREATE);
        running = true;
        log.info("[Watch] Watching {} (debounce {} ms){}", inbox, processing.debounceMillis(),
                dryRun ? " — dry run" : "");

        try {
            while (running) {
                WatchKey key = watchService.take();
                for (WatchEvent<?> event : key.pollEvents()) {
                    if (event.kind() == StandardWatchEventKinds.OVERFLOW) {
                        log.warn("[Watch] Event overflow — rescanning inbox");
                        scheduler.execute(() -> safely(() -> processor.processAll(inbox, dryRun)));
                        continue;
                    }
                    Path created = inbox.resolve((Path) event.context());
                    onCreated(created, dryRun);
                }
                if (!key.reset()) {
                    log.warn("[Watch] Inbox {} is no longer accessible", inbox);
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ClosedWatchServiceException e) {
            log.debug("[Watch] Watch service closed");
        } finally {
            close();
        }
    }

    /** Schedules a file for processing once it has been quiet for the debounce delay. */
    void onCreated(Path file, boolean dryRun) {
        pending.compute(file, (path, previous) -> {
            if (previous != null) {
                previous.cancel(false);
            }
            return scheduler.schedule(() -> {
                pending.remove(path);
                safely(() -> handle(path, dryRun));
            }, processing.debounceMillis(), TimeUnit.MILLISECONDS);
        });
    }

    /**
     * Processes one path unless it is already being processed.
     *
     * @return false if the path was in flight or has disappeared
     */
    boolean handle(Path file, boolean dryRun) {
        if (!inFlight.add(file)) {
            log.debug("[Watch] {} already in progress", file.getFileName());
            return false;
        }
        try {
            if (!Files.isRegularFile(file)) {
                log.debug("[Watch] {} vanished before processing", file.getFileName());
                return false;
            }
            processor.processOne(file, dryRun);
            return true;
        } finally {
            inFlight.remove(file);
        }
    }

    boolean isInFlight(Path file) {
        return inFlight.contains(file);
    }

    private void safely(Runnable task) {
        try {
            task.run();
        } catch (ArchiveUnavailableException e) {
            log.error("[Watch] Archive unavailable, stopping: {}", e.getMessage());
            close();
        } catch (RuntimeException e) {
            log.error("[Watch] Unexpected failure: {}", e.getMessage(), e);
        }
    }

    @Override
    @PreDestroy
    public void close() {
        running = false;
        pending.values().forEach(f -> f.cancel(false));
        pending.clear();
        WatchService ws = watchService;
        if (ws != null) {
            try {
                ws.close();
            } catch (IOException e) {
                log.debug("[Watch] Closing watch service: {}", e.getMessage());
            }
        }
        scheduler.shutdownNow();
    }
}
