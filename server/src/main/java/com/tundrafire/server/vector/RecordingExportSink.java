package com.tundrafire.server.vector;

import com.tundrafire.db.ExportRecordDao;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.sql.SQLException;
import java.util.List;

/**
 * Records every completed export in the SQLite ledger. A ledger failure is logged and does not fail the export.
 */
public class RecordingExportSink implements ExportSink {

    private static final Logger logger = LoggerFactory.getLogger(RecordingExportSink.class);

    private final ExportSink delegate;
    private final ExportRecordDao recordDao;

    public RecordingExportSink(ExportSink delegate, ExportRecordDao recordDao) {
        this.delegate = delegate;
        this.recordDao = recordDao;
    }

    @Override
    public ExportOutcome export(int year, String name, List<VectorFeature> features) throws IOException {
        ExportOutcome outcome = delegate.export(year, name, features);
        try {
            recordDao.upsert(year, outcome.getName(), outcome.getFeatureCount(), outcome.getPixelCount(),
                    outcome.getLocation());
        } catch (SQLException e) {
            logger.error("Database error recording export {}, export itself completed", name, e);
        }
        return outcome;
    }
}
