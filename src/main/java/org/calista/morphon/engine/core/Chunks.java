package org.calista.morphon.engine.core;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.function.Function;

/**
 * Explicit chunked tasks on a caller-supplied pool. Results come back in chunk order,
 * so merging them is deterministic regardless of scheduling.
 */
public final class Chunks {

    private Chunks() {}

    /**
     * Splits {@code items} into contiguous chunks and maps each one, on {@code pool} when given,
     * inline otherwise. A failing chunk fails the whole call.
     */
    public static <T, R> List<R> map(ExecutorService pool, int parallelism, List<T> items, int minChunk,
                                     Function<List<T>, R> fn) {
        final int n = items.size();
        if (n == 0) return List.of();

        final int p = Math.max(1, parallelism);
        final int chunk = Math.max(Math.max(1, minChunk), (n + p - 1) / p);

        if (pool == null || p == 1 || n <= chunk) {
            List<R> out = new ArrayList<>(1);
            out.add(fn.apply(items));
            return out;
        }

        List<CompletableFuture<R>> fs = new ArrayList<>((n + chunk - 1) / chunk);
        for (int start = 0; start < n; start += chunk) {
            final List<T> slice = items.subList(start, Math.min(n, start + chunk));
            fs.add(CompletableFuture.supplyAsync(() -> fn.apply(slice), pool));
        }

        List<R> out = new ArrayList<>(fs.size());
        for (CompletableFuture<R> f : fs) {
            try {
                out.add(f.join());
            } catch (CompletionException e) {
                Throwable cause = (e.getCause() != null) ? e.getCause() : e;
                if (cause instanceof RuntimeException) throw (RuntimeException) cause;
                throw new IllegalStateException("Chunk task failed", cause);
            }
        }
        return out;
    }
}
