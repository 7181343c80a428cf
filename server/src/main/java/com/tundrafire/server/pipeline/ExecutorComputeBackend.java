package com.tundrafire.server.pipeline;

import com.tundrafire.server.vector.Tile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs tiles on a fixed pool of local threads, one pool per evaluation.
 */
public class ExecutorComputeBackend implements ComputeBackend {

    private static final Logger logger = LoggerFactory.getLogger(ExecutorComputeBackend.class);

    private final int threads;

    public ExecutorComputeBackend(int threads) {
        this.threads = Math.max(1, threads);
    }

    public int getThreads() {
        return threads;
    }

    @Override
    public <T> List<T> evaluate(List<Tile> tiles, TileTask<T> task) throws IOException {
        int poolSize = Math.min(threads, Math.max(1, tiles.size()));
        logger.info("Evaluating {} tiles on {} threads", tiles.size(), poolSize);
        ExecutorService executor = Executors.newFixedThreadPool(poolSize);
        try {
            List<Future<T>> futures = new ArrayList<>();
            for (Tile tile : tiles) {
                Callable<T> call = () -> {
                    logger.debug("Evaluating {}", tile);
                    return task.apply(tile);
                };
                futures.add(executor.submit(call));
            }
            List<T> results = new ArrayList<>();
            for (Future<T> f : futures) {
                results.add(f.get());
            }
            return results;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while evaluating tiles", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException) {
                throw (IOException) cause;
            }
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IOException("Tile evaluation failed", cause);
        } finally {
            executor.shutdownNow();
        }
    }
}
