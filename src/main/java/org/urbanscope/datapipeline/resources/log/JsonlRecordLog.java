package org.urbanscope.datapipeline.resources.log;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectReader;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.urbanscope.datapipeline.api.contracts.EnrichedRecord;
import org.urbanscope.datapipeline.api.resources.IRecordLog;
import org.urbanscope.datapipeline.resources.AbstractResource;
import org.urbanscope.datapipeline.utils.JsonMapper;
import org.urbanscope.datapipeline.utils.PathExpansion;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@link IRecordLog} writing one NDJSON segment chain per calendar year.
 * <p>
 * The first segment of a year is {@code <prefix>_<year>.jsonl}; once appending a line would push
 * it past {@code maxSegmentBytes} the log continues in {@code <prefix>_<year>_part001.jsonl},
 * {@code _part002} and so on. Segments are never rewritten. A line that does not fit an empty
 * segment is still written whole.
 * <p>
 * A trailing line without newline is the remnant of an interrupted append. Readers skip it and
 * the next append to that segment truncates it away before writing.
 * <p>
 * <strong>Configuration Options:</strong>
 * <ul>
 *   <li><b>directory</b>: log directory, supports {@code ${VAR}} expansion (required)</li>
 *   <li><b>prefix</b>: segment file prefix (default: catalog)</li>
 *   <li><b>maxSegmentBytes</b>: rotation threshold (default: 50 MB)</li>
 * </ul>
 */
public class JsonlRecordLog extends AbstractResource implements IRecordLog {

    private static final Logger log = LoggerFactory.getLogger(JsonlRecordLog.class);

    private final Path directory;
    private final String prefix;
    private final long maxSegmentBytes;
    private final Pattern segmentPattern;
    private final ObjectReader reader = JsonMapper.mapper().readerFor(EnrichedRecord.class);

    private final AtomicLong recordsAppended = new AtomicLong();
    private final AtomicLong rotations = new AtomicLong();

    public JsonlRecordLog(String name, Config options) {
        super(name, options);
        if (!options.hasPath("directory")) {
            throw new IllegalArgumentException("directory is required for JsonlRecordLog '" + name + "'");
        }
        Config config = options.withFallback(ConfigFactory.parseMap(Map.of(
            "prefix", "catalog",
            "maxSegmentBytes", 50L * 1024 * 1024
        )));
        this.directory = PathExpansion.expandToPath(config.getString("directory"));
        this.prefix = config.getString("prefix");
        this.maxSegmentBytes = config.getBytes("maxSegmentBytes");
        if (maxSegmentBytes <= 0) {
            throw new IllegalArgumentException("maxSegmentBytes must be positive: " + maxSegmentBytes);
        }
        this.segmentPattern = Pattern.compile(Pattern.quote(prefix) + "_(\\d{4})(?:_part(\\d{3,}))?\\.jsonl");
    }

    @Override
    public synchronized void append(int period, List<EnrichedRecord> records) throws IOException {
        if (records.isEmpty()) {
            return;
        }
        Files.createDirectories(directory);
        List<Path> segments = segmentsOf(period);
        int part = segments.isEmpty() ? 0 : partOf(segments.get(segments.size() - 1));
        Path segment = segmentPath(period, part);
        long size = Files.exists(segment) ? Files.size(segment) : 0L;

        List<byte[]> chunk = new ArrayList<>();
        long chunkBytes = 0;
        for (EnrichedRecord record : records) {
            byte[] line = (JsonMapper.compact().writeValueAsString(record) + "\n").getBytes(StandardCharsets.UTF_8);
            if (size + chunkBytes > 0 && size + chunkBytes + line.length > maxSegmentBytes) {
                write(segment, chunk);
                chunk.clear();
                chunkBytes = 0;
                part++;
                segment = segmentPath(period, part);
                size = Files.exists(segment) ? Files.size(segment) : 0L;
                rotations.incrementAndGet();
                log.debug("Rotating record log for {} to {}", period, segment.getFileName());
            }
            chunk.add(line);
            chunkBytes += line.length;
        }
        write(segment, chunk);
        recordsAppended.addAndGet(records.size());
    }

    private void write(Path segment, List<byte[]> lines) throws IOException {
        if (lines.isEmpty()) {
            return;
        }
        long keep = completeLength(segment);
        try (FileChannel channel = FileChannel.open(segment, StandardOpenOption.CREATE, StandardOpenOption.WRITE)) {
            if (keep < channel.size()) {
                log.warn("Record log segment {} ends with a partial line, truncating it", segment.getFileName());
                channel.truncate(keep);
            }
            channel.position(channel.size());
            for (byte[] line : lines) {
                ByteBuffer buffer = ByteBuffer.wrap(line);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
            }
            channel.force(true);
        }
    }

    /**
     * Length of the segment up to and including its last newline.
     */
    private static long completeLength(Path segment) throws IOException {
        if (!Files.exists(segment)) {
            return 0L;
        }
        try (RandomAccessFile file = new RandomAccessFile(segment.toFile(), "r")) {
            long pos = file.length();
            while (pos > 0) {
                file.seek(pos - 1);
                if (file.read() == '\n') {
                    return pos;
                }
                pos--;
            }
            return 0L;
        }
    }

    private static boolean needsTerminator(Path segment) throws IOException {
        if (!Files.exists(segment) || Files.size(segment) == 0) {
            return false;
        }
        try (RandomAccessFile file = new RandomAccessFile(segment.toFile(), "r")) {
            file.seek(file.length() - 1);
            return file.read() != '\n';
        }
    }

    @Override
    public synchronized void readAll(Consumer<EnrichedRecord> visitor) throws IOException {
        for (int period : periods()) {
            for (Path segment : segmentsOf(period)) {
                readSegment(segment, visitor);
            }
        }
    }

    private void readSegment(Path segment, Consumer<EnrichedRecord> visitor) throws IOException {
        boolean unterminated = needsTerminator(segment);
        try (BufferedReader in = Files.newBufferedReader(segment, StandardCharsets.UTF_8)) {
            String line = in.readLine();
            int lineNo = 0;
            while (line != null) {
                lineNo++;
                String next = in.readLine();
                if (next == null && unterminated) {
                    // Not committed until its newline is written, even if the bytes parse.
                    log.warn("Skipping partial trailing line in {}", segment.getFileName());
                } else if (!line.isBlank()) {
                    try {
                        visitor.accept(reader.readValue(line));
                    } catch (JsonProcessingException e) {
                        throw new IOException("Corrupt record at " + segment + ":" + lineNo, e);
                    }
                }
                line = next;
            }
        }
    }

    @Override
    public synchronized SortedSet<Integer> periods() throws IOException {
        return new TreeSet<>(listSegments().keySet());
    }

    private List<Path> segmentsOf(int period) throws IOException {
        List<Path> segments = listSegments().get(period);
        return segments == null ? List.of() : segments;
    }

    private Map<Integer, List<Path>> listSegments() throws IOException {
        Map<Integer, List<Path>> byPeriod = new TreeMap<>();
        if (!Files.isDirectory(directory)) {
            return byPeriod;
        }
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, prefix + "_*.jsonl")) {
            for (Path file : files) {
                Matcher m = segmentPattern.matcher(file.getFileName().toString());
                if (m.matches()) {
                    byPeriod.computeIfAbsent(Integer.parseInt(m.group(1)), p -> new ArrayList<>()).add(file);
                }
            }
        }
        byPeriod.values().forEach(list -> list.sort(Comparator.comparingInt(this::partOf)));
        return byPeriod;
    }

    private int partOf(Path segment) {
        Matcher m = segmentPattern.matcher(segment.getFileName().toString());
        if (!m.matches()) {
            throw new IllegalStateException("Not a segment file: " + segment);
        }
        return m.group(2) == null ? 0 : Integer.parseInt(m.group(2));
    }

    private Path segmentPath(int period, int part) {
        String name = part == 0
            ? String.format("%s_%d.jsonl", prefix, period)
            : String.format("%s_%d_part%03d.jsonl", prefix, period, part);
        return directory.resolve(name);
    }

    public Path getDirectory() {
        return directory;
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("log_records_appended", recordsAppended.get());
        metrics.put("log_rotations", rotations.get());
    }
}
