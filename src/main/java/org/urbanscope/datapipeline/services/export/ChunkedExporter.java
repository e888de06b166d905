package org.urbanscope.datapipeline.services.export;

import com.fasterxml.jackson.databind.ObjectWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.urbanscope.datapipeline.utils.JsonMapper;

import java.io.BufferedOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Streams records into numbered JSON array files ({@code <prefix>_part000.json}, ...), each at most
 * {@code maxPartBytes} long.
 * <p>
 * Before an entry is written, the exporter checks whether entry, separator and closing bracket
 * still fit the current part. If not, and the part already holds a record, the part is closed
 * and a new one opened. A single record larger than the budget still goes into its own part
 * whole. Each part is written to a temp file and renamed into place when closed.
 * <p>
 * Not thread-safe. Call {@link #finish()} once; {@link #close()} after a failure discards the
 * open part.
 */
public class ChunkedExporter implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(ChunkedExporter.class);

    private static final byte[] OPEN = "[\n".getBytes(StandardCharsets.UTF_8);
    private static final byte[] SEPARATOR = ",\n".getBytes(StandardCharsets.UTF_8);
    private static final byte[] CLOSE = "\n]\n".getBytes(StandardCharsets.UTF_8);

    private final Path directory;
    private final String prefix;
    private final long maxPartBytes;
    private final ObjectWriter writer;
    private final Clock clock;

    private final List<ExportManifest.Part> parts = new ArrayList<>();
    private OutputStream out;
    private Path tempFile;
    private long partBytes;
    private long partRecords;
    private long totalRecords;
    private boolean finished;

    public ChunkedExporter(Path directory, String prefix, long maxPartBytes) {
        this(directory, prefix, maxPartBytes, JsonMapper.pretty());
    }

    public ChunkedExporter(Path directory, String prefix, long maxPartBytes, ObjectWriter writer) {
        this(directory, prefix, maxPartBytes, writer, Clock.systemUTC());
    }

    public ChunkedExporter(Path directory, String prefix, long maxPartBytes, ObjectWriter writer, Clock clock) {
        if (maxPartBytes <= OPEN.length + CLOSE.length) {
            throw new IllegalArgumentException("maxPartBytes too small: " + maxPartBytes);
        }
        this.directory = directory;
        this.prefix = prefix;
        this.maxPartBytes = maxPartBytes;
        this.writer = writer;
        this.clock = clock;
    }

    /**
     * Appends one record to the export.
     */
    public void write(Object record) throws IOException {
        if (finished) {
            throw new IllegalStateException("Exporter already finished");
        }
        byte[] entry = writer.writeValueAsBytes(record);
        if (out == null) {
            openPart();
        }
        long separator = partRecords == 0 ? 0 : SEPARATOR.length;
        if (partRecords > 0 && partBytes + separator + entry.length + CLOSE.length > maxPartBytes) {
            closePart();
            openPart();
            separator = 0;
        }
        if (separator > 0) {
            out.write(SEPARATOR);
            partBytes += SEPARATOR.length;
        }
        out.write(entry);
        partBytes += entry.length;
        partRecords++;
        totalRecords++;
        if (partBytes + CLOSE.length > maxPartBytes) {
            log.warn("Record {} of export '{}' alone exceeds the part budget of {} bytes", totalRecords, prefix, maxPartBytes);
        }
    }

    /**
     * Closes the last part and returns the manifest. An empty stream still yields one empty part.
     */
    public ExportManifest finish() throws IOException {
        if (finished) {
            throw new IllegalStateException("Exporter already finished");
        }
        if (out == null) {
            openPart();
        }
        closePart();
        finished = true;
        log.debug("Exported {} records into {} parts with prefix '{}'", totalRecords, parts.size(), prefix);
        return new ExportManifest(clock.instant().truncatedTo(ChronoUnit.SECONDS).toString(), totalRecords, parts, null);
    }

    private void openPart() throws IOException {
        Files.createDirectories(directory);
        Path target = partPath(parts.size());
        tempFile = directory.resolve(target.getFileName() + "." + UUID.randomUUID() + ".tmp");
        out = new BufferedOutputStream(Files.newOutputStream(tempFile));
        out.write(OPEN);
        partBytes = OPEN.length;
        partRecords = 0;
    }

    private void closePart() throws IOException {
        out.write(CLOSE);
        partBytes += CLOSE.length;
        out.close();
        out = null;
        Path target = partPath(parts.size());
        Files.move(tempFile, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        tempFile = null;
        parts.add(new ExportManifest.Part(target.getFileName().toString(), partRecords, partBytes));
    }

    Path partPath(int index) {
        return directory.resolve(String.format("%s_part%03d.json", prefix, index));
    }

    /**
     * Returns whether {@code fileName} is a part file name for {@code prefix}.
     */
    public static boolean isPartFile(String prefix, String fileName) {
        return fileName.matches(Pattern.quote(prefix) + "_part\\d{3,}\\.json");
    }

    @Override
    public void close() throws IOException {
        if (out != null) {
            out.close();
            out = null;
        }
        if (tempFile != null) {
            Files.deleteIfExists(tempFile);
            tempFile = null;
        }
    }
}
