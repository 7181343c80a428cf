package com.tundrafire.server.vector;

import org.locationtech.jts.geom.Polygon;

public class Tile {
    private final int index;
    private final Polygon cell;

    public Tile(int index, Polygon cell) {
        this.index = index;
        this.cell = cell;
    }

    public int getIndex() {
        return index;
    }

    public String getId() {
        return ExportNaming.tileId(index);
    }

    public Polygon getCell() {
        return cell;
    }

    @Override
    public String toString() {
        return "Tile{" + getId() + ", " + cell.getEnvelopeInternal() + "}";
    }
}
