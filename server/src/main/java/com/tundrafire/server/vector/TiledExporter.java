package com.tundrafire.server.vector;

import com.tundrafire.server.raster.BooleanRaster;
import org.locationtech.jts.geom.Geometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Vectorizes and exports a candidate mask, either as one named region or as a single tile.
 */
public class TiledExporter {

    private static final Logger logger = LoggerFactory.getLogger(TiledExporter.class);

    private final PolygonVectorizer vectorizer;
    private final ExportSink sink;

    public TiledExporter(PolygonVectorizer vectorizer, ExportSink sink) {
        this.vectorizer = vectorizer;
        this.sink = sink;
    }

    public ExportOutcome exportRegion(int year, BooleanRaster mask, Geometry region, String regionId)
            throws IOException {
        return sink.export(year, exportName(year, regionId), vectorizer.vectorize(mask, region));
    }

    /**
     * Exports the part of the mask inside the tile's cell under the tile's own name. Pixels outside the cell are
     * never read.
     */
    public ExportOutcome exportTile(int year, BooleanRaster mask, Tile tile) throws IOException {
        logger.debug("Exporting {}", tile);
        return sink.export(year, exportName(year, tile.getId()),
                vectorizer.vectorizeCell(mask, tile.getCell().getEnvelopeInternal()));
    }

    private String exportName(int year, String regionId) {
        return ExportNaming.exportName(year, regionId, vectorizer.getPixelFilter(), vectorizer.getScale());
    }
}
