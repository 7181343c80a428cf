package com.tundrafire.server.vector;

import com.tundrafire.db.ExportRecord;
import com.tundrafire.db.ExportRecordDao;
import com.tundrafire.db.SqliteInitializer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class RecordingExportSinkTest {

    @Test
    void testExportIsRecorded(@TempDir Path dir) throws Exception {
        String db = dir.resolve("ledger.db").toString();
        SqliteInitializer.initialize(db);
        ExportRecordDao dao = new ExportRecordDao(db);
        RecordingExportSink sink = new RecordingExportSink(new TiledExporterTest.MemorySink(), dao);

        sink.export(2021, "candidateFires__2021__drawROI_0px60m", List.of());

        Optional<ExportRecord> record = dao.findByName("candidateFires__2021__drawROI_0px60m");
        assertTrue(record.isPresent());
        assertEquals(2021, record.get().getAnalysisYear());
        assertEquals("memory:candidateFires__2021__drawROI_0px60m", record.get().getLocation());
    }

    @Test
    void testLedgerFailureDoesNotFailExport(@TempDir Path dir) throws Exception {
        // schema never created, so every insert fails
        ExportRecordDao dao = new ExportRecordDao(dir.resolve("uninitialized.db").toString());
        TiledExporterTest.MemorySink memory = new TiledExporterTest.MemorySink();
        RecordingExportSink sink = new RecordingExportSink(memory, dao);

        ExportOutcome outcome = sink.export(2021, "x", List.of());

        assertEquals("x", outcome.getName());
        assertEquals(List.of("x"), memory.names);
    }
}
