package org.urbanscope.datapipeline.resources.ledger;

import com.typesafe.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.urbanscope.datapipeline.api.resources.IDedupLedger;
import org.urbanscope.datapipeline.api.resources.IRecordLog;
import org.urbanscope.datapipeline.api.resources.LedgerNamespace;
import org.urbanscope.datapipeline.resources.AbstractResource;
import org.urbanscope.datapipeline.utils.PathExpansion;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * {@link IDedupLedger} backed by two flat text files, one id per line, append-only.
 * <p>
 * Both sets are loaded fully into memory. Staged ids are appended on {@link #flush()} and the
 * file is forced to disk before the method returns. Ids are never removed.
 * <p>
 * A trailing line without newline is the remnant of an interrupted append. It is ignored on
 * load, and the next flush terminates it before appending, so the fragment never merges with
 * a valid id.
 * <p>
 * <strong>Configuration Options:</strong>
 * <ul>
 *   <li><b>directory</b>: ledger directory, supports {@code ${VAR}} expansion (required)</li>
 * </ul>
 */
public class FileDedupLedger extends AbstractResource implements IDedupLedger {

    private static final Logger log = LoggerFactory.getLogger(FileDedupLedger.class);

    private final Path directory;
    private final Map<LedgerNamespace, Set<String>> seen = new EnumMap<>(LedgerNamespace.class);
    private final Map<LedgerNamespace, LinkedHashSet<String>> pending = new EnumMap<>(LedgerNamespace.class);
    private final Map<LedgerNamespace, Boolean> needsTerminator = new EnumMap<>(LedgerNamespace.class);
    private long appendedTotal;

    public FileDedupLedger(String name, Config options) {
        super(name, options);
        if (!options.hasPath("directory")) {
            throw new IllegalArgumentException("directory is required for FileDedupLedger '" + name + "'");
        }
        this.directory = PathExpansion.expandToPath(options.getString("directory"));
        for (LedgerNamespace ns : LedgerNamespace.values()) {
            seen.put(ns, new HashSet<>());
            pending.put(ns, new LinkedHashSet<>());
            needsTerminator.put(ns, false);
        }
    }

    @Override
    public synchronized void load() throws IOException {
        for (LedgerNamespace ns : LedgerNamespace.values()) {
            Set<String> ids = seen.get(ns);
            ids.clear();
            pending.get(ns).clear();
            needsTerminator.put(ns, false);
            Path file = fileFor(ns);
            if (!Files.exists(file)) {
                continue;
            }
            String content = Files.readString(file, StandardCharsets.UTF_8);
            List<String> lines = new ArrayList<>(List.of(content.split("\n", -1)));
            String last = lines.remove(lines.size() - 1);
            if (!last.isEmpty()) {
                log.warn("Ignoring unterminated trailing line in ledger file {}", file);
                needsTerminator.put(ns, true);
            }
            for (String line : lines) {
                String id = line.trim();
                if (!id.isEmpty()) {
                    ids.add(id);
                }
            }
        }
        log.debug("Loaded ledger '{}': {} raw ids, {} project ids", resourceName,
            seen.get(LedgerNamespace.RAW).size(), seen.get(LedgerNamespace.PROJECT).size());
    }

    @Override
    public synchronized boolean contains(LedgerNamespace namespace, String key) {
        return seen.get(namespace).contains(key);
    }

    @Override
    public synchronized void markSeen(LedgerNamespace namespace, Collection<String> keys) {
        Set<String> ids = seen.get(namespace);
        for (String key : keys) {
            if (key == null || key.isBlank() || key.contains("\n")) {
                throw new IllegalArgumentException("Invalid ledger key: '" + key + "'");
            }
            if (ids.add(key)) {
                pending.get(namespace).add(key);
            }
        }
    }

    @Override
    public synchronized int size(LedgerNamespace namespace) {
        return seen.get(namespace).size();
    }

    @Override
    public synchronized void flush() throws IOException {
        for (LedgerNamespace ns : LedgerNamespace.values()) {
            LinkedHashSet<String> staged = pending.get(ns);
            if (staged.isEmpty()) {
                continue;
            }
            StringBuilder block = new StringBuilder();
            if (needsTerminator.get(ns)) {
                block.append('\n');
            }
            for (String id : staged) {
                block.append(id).append('\n');
            }
            append(fileFor(ns), block.toString().getBytes(StandardCharsets.UTF_8));
            appendedTotal += staged.size();
            log.debug("Appended {} ids to ledger file {}", staged.size(), fileFor(ns).getFileName());
            staged.clear();
            needsTerminator.put(ns, false);
        }
    }

    private void append(Path file, byte[] data) throws IOException {
        Files.createDirectories(directory);
        try (FileChannel channel = FileChannel.open(file,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND)) {
            ByteBuffer buffer = ByteBuffer.wrap(data);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(true);
        }
    }

    @Override
    public int reconcile(IRecordLog recordLog) throws IOException {
        Set<String> missingRaw = new LinkedHashSet<>();
        Set<String> missingProjects = new LinkedHashSet<>();
        synchronized (this) {
            recordLog.readAll(record -> {
                if (!seen.get(LedgerNamespace.RAW).contains(record.raw().id())) {
                    missingRaw.add(record.raw().id());
                }
                String project = record.projectId().value();
                if (!seen.get(LedgerNamespace.PROJECT).contains(project)) {
                    missingProjects.add(project);
                }
            });
            if (missingRaw.isEmpty() && missingProjects.isEmpty()) {
                return 0;
            }
            markSeen(LedgerNamespace.RAW, missingRaw);
            markSeen(LedgerNamespace.PROJECT, missingProjects);
            flush();
        }
        log.warn("Ledger '{}' was behind the record log, restored {} raw ids and {} project ids",
            resourceName, missingRaw.size(), missingProjects.size());
        return missingRaw.size() + missingProjects.size();
    }

    private Path fileFor(LedgerNamespace namespace) {
        return directory.resolve(namespace.fileName());
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        synchronized (this) {
            metrics.put("ledger_raw_ids", seen.get(LedgerNamespace.RAW).size());
            metrics.put("ledger_project_ids", seen.get(LedgerNamespace.PROJECT).size());
            metrics.put("ledger_appended_total", appendedTotal);
        }
    }
}
