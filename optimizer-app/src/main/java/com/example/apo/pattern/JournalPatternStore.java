package com.example.apo.pattern;

import com.example.apo.geo.Coordinate;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

/**
 * File-backed {@link PatternStore}: an append-only JSON-lines journal in front of the
 * in-memory index.
 *
 * <h2>Lifecycle</h2>
 * <ol>
 *   <li><b>Open:</b> the journal is replayed line by line; the last row for a key wins.
 *       Rows that fail to parse or validate are skipped with a warning and counted in
 *       {@link #corruptRows()}.</li>
 *   <li><b>Write:</b> each upsert/compute appends one {@link PatternRow} while the key is
 *       locked. If the append fails the in-memory value is left untouched and a
 *       {@link StorageException} ({@code UNAVAILABLE}) propagates.</li>
 *   <li><b>Compact:</b> {@link #compact()} rewrites the journal with one row per live
 *       pattern, via a temp file and an atomic move.</li>
 * </ol>
 *
 * <h2>Locking</h2>
 * Writers hold the read side of {@code compactionLock} for the whole write, so many
 * writers run concurrently; compaction takes the write side so no write is in flight
 * while the snapshot is taken. Appends themselves are serialized on {@code appendLock}.
 * Reads never take either lock.
 */
@Slf4j
public class JournalPatternStore extends InMemoryPatternStore {

    private final Path journal;
    private final ObjectMapper mapper;
    private final ReadWriteLock compactionLock = new ReentrantReadWriteLock();
    private final Object appendLock = new Object();
    private final AtomicLong corruptRows = new AtomicLong();
    private final AtomicLong journalRows = new AtomicLong();

    public JournalPatternStore(Path journal, ObjectMapper mapper, Clock clock,
                               double cellSizeDegrees, int maxQueryResults) {
        super(clock, cellSizeDegrees, maxQueryResults);
        this.journal = journal;
        this.mapper = mapper;
        replay();
    }

    @Override
    public Pattern compute(Coordinate location, String modelId, Function<Optional<Pattern>, Pattern> remapping) {
        compactionLock.readLock().lock();
        try {
            return super.compute(location, modelId, remapping);
        } finally {
            compactionLock.readLock().unlock();
        }
    }

    @Override
    protected void onWrite(Pattern stored) {
        String line = toLine(stored);
        synchronized (appendLock) {
            try (BufferedWriter w = Files.newBufferedWriter(journal, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
                w.write(line);
                w.newLine();
            } catch (IOException e) {
                throw StorageException.unavailable("Failed to append to pattern journal " + journal.toAbsolutePath(), e);
            }
            journalRows.incrementAndGet();
        }
    }

    /**
     * Rewrite the journal so it holds exactly one row per live pattern.
     *
     * @return number of rows written
     * @throws StorageException with {@link StorageException.Kind#UNAVAILABLE} if the file cannot be rewritten
     */
    public int compact() {
        compactionLock.writeLock().lock();
        try {
            List<Pattern> live = findAll();
            Path tmp = journal.resolveSibling(journal.getFileName() + ".compact");
            try (BufferedWriter w = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING)) {
                for (Pattern p : live) {
                    w.write(toLine(p));
                    w.newLine();
                }
            } catch (IOException e) {
                throw StorageException.unavailable("Failed to write compacted journal " + tmp.toAbsolutePath(), e);
            }
            try {
                Files.move(tmp, journal, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (IOException e) {
                throw StorageException.unavailable("Failed to replace journal " + journal.toAbsolutePath(), e);
            }
            long before = journalRows.getAndSet(live.size());
            log.info("Compacted pattern journal {}: rows {} -> {}", journal.toAbsolutePath(), before, live.size());
            return live.size();
        } finally {
            compactionLock.writeLock().unlock();
        }
    }

    /** Compaction offloaded to {@code boundedElastic}; file I/O stays off the caller's thread. */
    public Mono<Integer> compactAsync() {
        return Mono.fromCallable(this::compact)
                .subscribeOn(Schedulers.boundedElastic());
    }

    /** Whether the journal holds noticeably more rows than live patterns. */
    public boolean needsCompaction() {
        long rows = journalRows.get();
        return rows > 0 && rows >= 2L * Math.max(1, size());
    }

    public long corruptRows() {
        return corruptRows.get();
    }

    public long journalRows() {
        return journalRows.get();
    }

    public Path journal() {
        return journal;
    }

    /* ===================== replay ===================== */

    private void replay() {
        try {
            Path parent = journal.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            if (Files.notExists(journal)) {
                log.info("No pattern journal at {}; starting empty", journal.toAbsolutePath());
                return;
            }
        } catch (IOException e) {
            throw StorageException.unavailable("Cannot prepare journal directory for " + journal.toAbsolutePath(), e);
        }

        long lineNo = 0;
        try (BufferedReader r = Files.newBufferedReader(journal, StandardCharsets.UTF_8)) {
            String line;
            while ((line = r.readLine()) != null) {
                lineNo++;
                if (line.isBlank()) continue;
                journalRows.incrementAndGet();
                try {
                    restore(parse(line));
                } catch (StorageException e) {
                    corruptRows.incrementAndGet();
                    log.warn("Skipping corrupt journal row {}:{}: {}", journal.getFileName(), lineNo, e.getMessage());
                }
            }
        } catch (IOException e) {
            throw StorageException.unavailable("Cannot read pattern journal " + journal.toAbsolutePath(), e);
        }
        log.info("Replayed pattern journal {}: rows={} patterns={} corrupt={}",
                journal.toAbsolutePath(), journalRows.get(), size(), corruptRows.get());
    }

    private Pattern parse(String line) {
        PatternRow row;
        try {
            row = mapper.readValue(line, PatternRow.class);
        } catch (JsonProcessingException e) {
            throw StorageException.corrupt("unparseable row: " + e.getOriginalMessage(), e);
        }
        if (row == null) throw StorageException.corrupt("null row", null);
        return row.toPattern();
    }

    private String toLine(Pattern p) {
        try {
            return mapper.writeValueAsString(PatternRow.of(p));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Pattern row not serializable: " + p, e);
        }
    }
}
