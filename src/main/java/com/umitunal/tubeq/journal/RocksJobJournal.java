package com.umitunal.tubeq.journal;

import com.umitunal.tubeq.config.StorageConfig;
import com.umitunal.tubeq.model.JobSnapshot;
import com.umitunal.tubeq.serialization.CodecException;
import com.umitunal.tubeq.serialization.JsonCodec;
import com.umitunal.tubeq.serialization.PayloadCodec;
import org.rocksdb.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * RocksDB-backed transition journal.
 *
 * <p>Entries are keyed by an 8-byte big-endian sequence number, so RocksDB's natural key order
 * is append order. Writes run on a single background thread; {@link #append} only assigns the
 * sequence number and queues the write. Reopening a directory continues after its last entry.
 *
 * @param <T> the type of job payload
 */
public class RocksJobJournal<T> implements JobJournal<T> {
    private static final Logger log = LoggerFactory.getLogger(RocksJobJournal.class);

    private final RocksDB database;
    private final Options dbOptions;
    private final WriteOptions writeOpts;
    private final ReadOptions scanReadOpts;
    private final PayloadCodec<T> payloadCodec;
    private final PayloadCodec<JournalEntry> entryCodec;
    private final ExecutorService writer;
    private final AtomicLong sequence;
    private final AtomicLong failedWrites = new AtomicLong(0);
    private volatile boolean closed;

    public RocksJobJournal(StorageConfig config, PayloadCodec<T> payloadCodec) throws RocksDBException {
        this(config, payloadCodec, new JsonCodec<>(JournalEntry.class));
    }

    public RocksJobJournal(StorageConfig config, PayloadCodec<T> payloadCodec, PayloadCodec<JournalEntry> entryCodec)
            throws RocksDBException {
        this.payloadCodec = payloadCodec;
        this.entryCodec = entryCodec;

        RocksDB.loadLibrary();

        this.dbOptions = new Options()
                .setCreateIfMissing(true)
                .setCompressionType(CompressionType.LZ4_COMPRESSION)
                .setWriteBufferSize((long) config.getMemoryBufferSizeMB() * 1024 * 1024)
                .setMaxWriteBufferNumber(config.getMaxMemoryBuffers())
                .setMaxBackgroundJobs(config.getBackgroundThreads());

        this.database = RocksDB.open(dbOptions, config.getDataDirectory());

        // The journal is a write-ahead log, so RocksDB's own WAL stays enabled
        this.writeOpts = new WriteOptions()
                .setSync(config.isSyncWrites());

        this.scanReadOpts = new ReadOptions()
                .setFillCache(false);

        this.sequence = new AtomicLong(lastSequence());
        this.writer = Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, "tubeq-journal");
            thread.setDaemon(true);
            return thread;
        });

        log.info("Opened journal at {} (last sequence {})", config.getDataDirectory(), sequence.get());
    }

    @Override
    public void append(TransitionEvent<T> event) {
        if (closed) {
            log.warn("Journal closed, dropping {}", event);
            return;
        }
        long seq = sequence.incrementAndGet();
        try {
            writer.execute(() -> write(seq, event));
        } catch (RejectedExecutionException e) {
            failedWrites.incrementAndGet();
            log.warn("Journal writer rejected entry #{} ({})", seq, event);
        }
    }

    /**
     * Waits until every entry appended so far has been written.
     */
    public void flush() throws InterruptedException {
        try {
            writer.submit(() -> { }).get();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Journal flush failed", e.getCause());
        }
    }

    /**
     * Reads back every stored entry in append order.
     */
    public List<JournalEntry> entries() {
        List<JournalEntry> entries = new ArrayList<>();
        try (final RocksIterator iter = database.newIterator(scanReadOpts)) {
            iter.seekToFirst();
            while (iter.isValid()) {
                entries.add(entryCodec.decode(iter.value()));
                iter.next();
            }
        }
        return entries;
    }

    /**
     * Decodes the payload stored with a {@link Transition#PUT} entry.
     */
    public T decodePayload(JournalEntry entry) {
        if (entry.getPayload() == null) {
            throw new IllegalArgumentException("Entry #" + entry.getSequence() + " carries no payload");
        }
        return payloadCodec.decode(entry.getPayload());
    }

    public long getLastSequence() {
        return sequence.get();
    }

    public long getFailedWrites() {
        return failedWrites.get();
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        writer.shutdown();
        try {
            if (!writer.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Journal writer did not drain in time, pending entries are lost");
                writer.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            writer.shutdownNow();
        }
        scanReadOpts.close();
        writeOpts.close();
        database.close();
        dbOptions.close();
        log.info("Closed journal at sequence {}", sequence.get());
    }

    private void write(long seq, TransitionEvent<T> event) {
        try {
            JournalEntry entry = toEntry(seq, event);
            database.put(writeOpts, createStorageKey(seq), entryCodec.encode(entry));
        } catch (RocksDBException | CodecException e) {
            failedWrites.incrementAndGet();
            log.error("Failed to write journal entry #{} ({}): {}", seq, event, e.getMessage(), e);
        }
    }

    private JournalEntry toEntry(long seq, TransitionEvent<T> event) {
        JobSnapshot<T> job = event.getJob();
        byte[] payload = event.getTransition() == Transition.PUT
                ? payloadCodec.encode(job.getPayload())
                : null;
        return new JournalEntry(seq, event.getTransition(), job.getTube(), job.getId(), job.getState(),
                job.getPriority(), job.getDelaySeconds(), job.getTtrSeconds(), event.getConsumerId(),
                event.getTimestamp(), payload);
    }

    private long lastSequence() {
        try (final RocksIterator iter = database.newIterator(scanReadOpts)) {
            iter.seekToLast();
            return iter.isValid() ? ByteBuffer.wrap(iter.key()).getLong() : 0;
        }
    }

    /**
     * Key format: [sequence(8 bytes, big-endian)], so lexicographic order is numeric order.
     */
    static byte[] createStorageKey(long sequence) {
        return ByteBuffer.allocate(Long.BYTES).putLong(sequence).array();
    }
}
