package org.urbanscope.datapipeline.resources.ledger;

import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.urbanscope.datapipeline.TestRecords;
import org.urbanscope.datapipeline.api.resources.LedgerNamespace;
import org.urbanscope.datapipeline.resources.log.JsonlRecordLog;
import org.urbanscope.datapipeline.utils.JsonMapper;
import org.urbanscope.junit.extensions.logging.ExpectLog;
import org.urbanscope.junit.extensions.logging.LogLevel;
import org.urbanscope.junit.extensions.logging.LogWatchExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class FileDedupLedgerTest {

    @TempDir
    Path tempDir;

    private FileDedupLedger ledger;

    @BeforeEach
    void setUp() throws IOException {
        ledger = newLedger();
        ledger.load();
    }

    private FileDedupLedger newLedger() {
        return new FileDedupLedger("test-ledger", ConfigFactory.parseMap(Map.of("directory", tempDir.toString())));
    }

    @Test
    void markSeen_isVisibleImmediatelyButPersistedOnlyOnFlush() throws IOException {
        ledger.markSeen(LedgerNamespace.RAW, List.of("SRR1", "SRR2"));

        assertThat(ledger.contains(LedgerNamespace.RAW, "SRR1")).isTrue();
        assertThat(ledger.contains(LedgerNamespace.PROJECT, "SRR1")).isFalse();
        assertThat(tempDir.resolve("seen_raw_ids.txt")).doesNotExist();

        ledger.flush();

        assertThat(Files.readAllLines(tempDir.resolve("seen_raw_ids.txt"))).containsExactly("SRR1", "SRR2");

        ledger.flush();

        assertThat(Files.readAllLines(tempDir.resolve("seen_raw_ids.txt"))).containsExactly("SRR1", "SRR2");
    }

    @Test
    void flush_appendsOnlyNewIds() throws IOException {
        ledger.markSeen(LedgerNamespace.PROJECT, List.of("PRJNA1"));
        ledger.flush();
        ledger.markSeen(LedgerNamespace.PROJECT, List.of("PRJNA1", "PRJNA2"));
        ledger.flush();

        assertThat(Files.readAllLines(tempDir.resolve("seen_projects.txt"))).containsExactly("PRJNA1", "PRJNA2");
    }

    @Test
    void unflushedIds_areLostOnReload() throws IOException {
        ledger.markSeen(LedgerNamespace.RAW, List.of("SRR1"));
        ledger.flush();
        ledger.markSeen(LedgerNamespace.RAW, List.of("SRR2"));

        FileDedupLedger reloaded = newLedger();
        reloaded.load();

        assertThat(reloaded.contains(LedgerNamespace.RAW, "SRR1")).isTrue();
        assertThat(reloaded.contains(LedgerNamespace.RAW, "SRR2")).isFalse();
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Ignoring unterminated trailing line.*")
    void load_ignoresPartialTrailingLineAndTerminatesItOnNextFlush() throws IOException {
        Files.writeString(tempDir.resolve("seen_raw_ids.txt"), "SRR1\nSRR2\nSRR3_TRUNC");
        FileDedupLedger reloaded = newLedger();
        reloaded.load();

        assertThat(reloaded.size(LedgerNamespace.RAW)).isEqualTo(2);
        assertThat(reloaded.contains(LedgerNamespace.RAW, "SRR3_TRUNC")).isFalse();

        reloaded.markSeen(LedgerNamespace.RAW, List.of("SRR4"));
        reloaded.flush();

        assertThat(Files.readAllLines(tempDir.resolve("seen_raw_ids.txt")))
            .containsExactly("SRR1", "SRR2", "SRR3_TRUNC", "SRR4");
    }

    @Test
    void markSeen_rejectsBlankKeys() {
        assertThatThrownBy(() -> ledger.markSeen(LedgerNamespace.RAW, List.of(" ")))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Ledger 'test-ledger' was behind the record log.*")
    void reconcile_restoresIdsPresentInTheLog() throws IOException {
        JsonlRecordLog recordLog = new JsonlRecordLog("test-log",
            ConfigFactory.parseMap(Map.of("directory", tempDir.resolve("catalog").toString())));
        recordLog.append(2024, List.of(
            TestRecords.enriched("SRR1", "PRJNA1"),
            TestRecords.enriched("SRR2", "PRJNA2")));
        ledger.markSeen(LedgerNamespace.RAW, List.of("SRR1"));
        ledger.markSeen(LedgerNamespace.PROJECT, List.of("PRJNA1"));
        ledger.flush();

        int restored = ledger.reconcile(recordLog);

        assertThat(restored).isEqualTo(2);
        FileDedupLedger reloaded = newLedger();
        reloaded.load();
        assertThat(reloaded.contains(LedgerNamespace.RAW, "SRR2")).isTrue();
        assertThat(reloaded.contains(LedgerNamespace.PROJECT, "PRJNA2")).isTrue();
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Skipping partial trailing line.*")
    void reconcile_ignoresRecordWhoseLineWasNeverTerminated() throws IOException {
        // Given
        JsonlRecordLog recordLog = new JsonlRecordLog("test-log",
            ConfigFactory.parseMap(Map.of("directory", tempDir.resolve("catalog").toString())));
        recordLog.append(2024, List.of(TestRecords.enriched("SRR1", "PRJNA1")));
        ledger.markSeen(LedgerNamespace.RAW, List.of("SRR1"));
        ledger.markSeen(LedgerNamespace.PROJECT, List.of("PRJNA1"));
        ledger.flush();
        Files.writeString(tempDir.resolve("catalog/catalog_2024.jsonl"),
            JsonMapper.compact().writeValueAsString(TestRecords.enriched("SRR2", "PRJNA2")),
            StandardOpenOption.APPEND);

        // When
        int restored = ledger.reconcile(recordLog);

        // Then
        assertThat(restored).isZero();
        assertThat(ledger.contains(LedgerNamespace.RAW, "SRR2")).isFalse();
        assertThat(ledger.contains(LedgerNamespace.PROJECT, "PRJNA2")).isFalse();
    }

    @Test
    void reconcile_inSync_changesNothing() throws IOException {
        JsonlRecordLog recordLog = new JsonlRecordLog("test-log",
            ConfigFactory.parseMap(Map.of("directory", tempDir.resolve("catalog").toString())));

        assertThat(ledger.reconcile(recordLog)).isZero();
        assertThat(tempDir.resolve("seen_raw_ids.txt")).doesNotExist();
    }
}
