package com.tundrafire.server.pipeline;

import com.tundrafire.server.vector.Tile;

import java.io.IOException;
import java.util.List;

/**
 * Evaluates per-tile work. Implementations decide where and how concurrently tiles run; results always come back in
 * tile order.
 */
public interface ComputeBackend {

    @FunctionalInterface
    interface TileTask<T> {
        T apply(Tile tile) throws IOException;
    }

    <T> List<T> evaluate(List<Tile> tiles, TileTask<T> task) throws IOException;
}
