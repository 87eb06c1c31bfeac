package com.investbyyourself.etl.service.loader;

import com.investbyyourself.etl.model.BackendKind;
import com.investbyyourself.etl.model.DataVersion;
import com.investbyyourself.etl.model.LoadingStrategy;
import com.investbyyourself.etl.model.TransformedRecord;
import com.investbyyourself.etl.service.BackendUnavailableException;
import com.investbyyourself.etl.service.CancellationToken;
import com.investbyyourself.etl.service.ContentHashingService;
import com.investbyyourself.etl.service.RecordJsonCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Flat-file archive. Every committed load writes a full JSON Lines snapshot of the scope
 * ({@code <root>/<dataset>/<scope>/export-<time>-<version>.jsonl[.gz]}) plus a
 * {@code .meta.json} sidecar, then moves the scope's {@code CURRENT} pointer onto it.
 * Earlier snapshots are kept as history; only the pointer move makes a load visible.
 */
public class FileArchiveBackend implements StorageBackend {

    private static final Logger logger = LoggerFactory.getLogger(FileArchiveBackend.class);

    static final String CURRENT = "CURRENT";
    private static final DateTimeFormatter EXPORT_TIME =
            DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmssSSS'Z'").withZone(ZoneOffset.UTC);

    private final Path root;
    private final boolean compression;
    private final int batchSize;
    private final StrategyPlanner planner;
    private final ContentHashingService hashingService;
    private final RecordJsonCodec codec;
    private final Clock clock;
    private final Map<String, ReentrantLock> scopeLocks = new ConcurrentHashMap<>();

    public FileArchiveBackend(Path root,
                              boolean compression,
                              int batchSize,
                              StrategyPlanner planner,
                              ContentHashingService hashingService,
                              RecordJsonCodec codec,
                              Clock clock) {
        this.root = root;
        this.compression = compression;
        this.batchSize = batchSize;
        this.planner = planner;
        this.hashingService = hashingService;
        this.codec = codec;
        this.clock = clock;
    }

    @Override
    public BackendKind kind() {
        return BackendKind.FILE_ARCHIVE;
    }

    @Override
    public int batchSize() {
        return batchSize;
    }

    @Override
    public ScopeLoadOutcome loadScope(String dataset,
                                      String scopeKey,
                                      List<TransformedRecord> records,
                                      LoadingStrategy strategy,
                                      CancellationToken token) {
        Instant started = clock.instant();
        Path dir = scopeDir(dataset, scopeKey);
        ReentrantLock lock = scopeLocks.computeIfAbsent(dir.toString(), k -> new ReentrantLock());
        lock.lock();
        List<Path> pending = new ArrayList<>();
        try {
            Files.createDirectories(dir);
            ScopeState state = readState(dir);
            WritePlan plan = planner.plan(state, records, strategy);
            Duration elapsed = Duration.between(started, clock.instant());
            boolean newVersion = !plan.resultingVersionId().equals(state.currentVersionId());
            if (plan.unchanged() || !newVersion) {
                logger.info("backend=FILE_ARCHIVE dataset={} scope={} content unchanged, no snapshot written",
                        dataset, scopeKey);
                return ScopeLoadOutcome.from(scopeKey, records, plan, state.currentVersion(), false, elapsed);
            }

            Instant now = clock.instant();
            String base = "export-" + EXPORT_TIME.format(now) + "-" + plan.resultingVersionId().substring(0, 16);
            String dataName = base + (compression ? ".jsonl.gz" : ".jsonl");
            Path dataTmp = dir.resolve(dataName + ".tmp");
            pending.add(dataTmp);
            writeSnapshot(dataTmp, plan.resultingRows(), token, scopeKey);

            Map<String, String> metadata = new LinkedHashMap<>();
            metadata.put("strategy", strategy.name());
            metadata.put("file", dataName);
            metadata.put("compressed", String.valueOf(compression));
            if (state.currentVersionId() != null) {
                metadata.put("previousVersionId", state.currentVersionId());
            }
            DataVersion version = new DataVersion(plan.resultingVersionId(), dataset, scopeKey, kind(), now,
                    plan.resultingRows().size(), plan.sourceTag(), metadata);
            Path metaTmp = dir.resolve(base + ".meta.json.tmp");
            pending.add(metaTmp);
            Files.writeString(metaTmp, codec.toJson(version), StandardCharsets.UTF_8);
            Path pointerTmp = dir.resolve(CURRENT + ".tmp");
            pending.add(pointerTmp);
            Files.writeString(pointerTmp, base, StandardCharsets.UTF_8);

            token.throwIfCancelled("archive load of scope " + scopeKey);
            move(dataTmp, dir.resolve(dataName));
            move(metaTmp, dir.resolve(base + ".meta.json"));
            move(pointerTmp, dir.resolve(CURRENT));
            pending.clear();

            logger.info("backend=FILE_ARCHIVE dataset={} scope={} version={} rows={} file={}",
                    dataset, scopeKey, version.versionId(), version.recordCount(), dataName);
            return ScopeLoadOutcome.from(scopeKey, records, plan, version, true,
                    Duration.between(started, clock.instant()));
        } catch (IOException e) {
            throw new BackendUnavailableException("File archive I/O failure for scope " + scopeKey + ": "
                    + e.getMessage(), e);
        } finally {
            for (Path tmp : pending) {
                deleteQuietly(tmp);
            }
            lock.unlock();
        }
    }

    @Override
    public Optional<DataVersion> getVersion(String dataset, String scopeKey) {
        try {
            return Optional.ofNullable(readCurrentVersion(scopeDir(dataset, scopeKey)));
        } catch (IOException e) {
            throw new BackendUnavailableException("Cannot read archive version of " + scopeKey, e);
        }
    }

    @Override
    public void validate() {
        try {
            Files.createDirectories(root);
        } catch (IOException e) {
            throw new BackendUnavailableException("Archive root " + root + " cannot be created", e);
        }
        if (!Files.isWritable(root)) {
            throw new BackendUnavailableException("Archive root " + root + " is not writable");
        }
    }

    Path scopeDir(String dataset, String scopeKey) {
        return root.resolve(safeName(dataset)).resolve(safeName(scopeKey));
    }

    private ScopeState readState(Path dir) throws IOException {
        DataVersion current = readCurrentVersion(dir);
        if (current == null) {
            return ScopeState.empty();
        }
        Path data = dir.resolve(current.metadata().get("file"));
        List<StoredRecord> rows = new ArrayList<>();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(open(data), StandardCharsets.UTF_8))) {
            String line;
            int index = 0;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                rows.add(new StoredRecord("line-" + index++, hashingService.hash(line), codec.readRecord(line)));
            }
        }
        return new ScopeState(rows, current);
    }

    private DataVersion readCurrentVersion(Path dir) throws IOException {
        Path pointer = dir.resolve(CURRENT);
        if (!Files.exists(pointer)) {
            return null;
        }
        String base = Files.readString(pointer, StandardCharsets.UTF_8).trim();
        return codec.readVersion(Files.readString(dir.resolve(base + ".meta.json"), StandardCharsets.UTF_8));
    }

    private void writeSnapshot(Path target, List<WritePlan.PlannedRow> rows, CancellationToken token, String scopeKey)
            throws IOException {
        try (BufferedWriter writer = new BufferedWriter(new OutputStreamWriter(create(target), StandardCharsets.UTF_8))) {
            int inBatch = 0;
            for (WritePlan.PlannedRow row : rows) {
                writer.write(codec.toJson(row.record()));
                writer.newLine();
                if (++inBatch == batchSize) {
                    writer.flush();
                    inBatch = 0;
                    token.throwIfCancelled("archive load of scope " + scopeKey);
                }
            }
        }
    }

    private InputStream open(Path file) throws IOException {
        InputStream in = Files.newInputStream(file);
        return file.getFileName().toString().endsWith(".gz") ? new GZIPInputStream(in) : in;
    }

    private OutputStream create(Path file) throws IOException {
        OutputStream out = Files.newOutputStream(file);
        return compression ? new GZIPOutputStream(out) : out;
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            logger.warn("Could not remove temporary archive file {}: {}", file, e.getMessage());
        }
    }

    static String safeName(String value) {
        return value.replaceAll("[^A-Za-z0-9._@-]", "_");
    }
}
