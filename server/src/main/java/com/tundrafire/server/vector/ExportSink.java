package com.tundrafire.server.vector;

import java.io.IOException;
import java.util.List;

/**
 * Destination for vectorized candidate fires.
 */
public interface ExportSink {
    ExportOutcome export(int year, String name, List<VectorFeature> features) throws IOException;
}
