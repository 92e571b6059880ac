package com.avtimeline.geometry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Resolves every distinct reference of a run before the state machine starts.
 * References are fetched in batches of at most {@code concurrency}; a batch
 * completes before the next one is submitted. A failure of one reference
 * becomes {@link GeometryResolution.Failed} and never fails the run.
 */
public class GeometryPrefetcher {

    private static final Logger log = LoggerFactory.getLogger(GeometryPrefetcher.class);

    private final GeometryResolver resolver;
    private final Executor executor;
    private final int concurrency;

    public GeometryPrefetcher(GeometryResolver resolver, Executor executor, int concurrency) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be >= 1");
        }
        this.resolver = resolver;
        this.executor = executor;
        this.concurrency = concurrency;
    }

    public GeometryLookup prefetch(Collection<GeometryReference> references) {
        Map<String, GeometryReference> distinct = new LinkedHashMap<>();
        references.stream()
            .sorted(Comparator.comparing(GeometryReference::id))
            .forEach(ref -> distinct.putIfAbsent(ref.id(), ref));
        if (distinct.isEmpty()) {
            return GeometryLookup.empty();
        }

        List<GeometryReference> pending = new ArrayList<>(distinct.values());
        int batches = (pending.size() + concurrency - 1) / concurrency;
        Map<String, GeometryResolution> resolved = new LinkedHashMap<>();
        for (int batch = 0; batch < batches; batch++) {
            List<GeometryReference> slice = pending.subList(
                batch * concurrency, Math.min(pending.size(), (batch + 1) * concurrency));
            log.info("Geometry batch {}/{} ({} references)", batch + 1, batches, slice.size());

            List<CompletableFuture<GeometryResolution>> futures = slice.stream()
                .map(ref -> CompletableFuture.supplyAsync(() -> resolver.resolve(ref), executor)
                    .exceptionally(ex -> new GeometryResolution.Failed(describe(ref, ex))))
                .toList();
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
            for (int i = 0; i < slice.size(); i++) {
                resolved.put(slice.get(i).id(), futures.get(i).join());
            }
        }

        GeometryLookup lookup = new GeometryLookup(resolved);
        log.info("Geometry prefetch complete: {} resolved, {} failed", lookup.resolvedCount(), lookup.failedCount());
        return lookup;
    }

    private static String describe(GeometryReference ref, Throwable ex) {
        Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
        log.debug("Geometry {} failed to resolve", ref.id(), cause);
        return "geometry " + ref.id() + " failed to resolve: " + cause.getMessage();
    }
}
