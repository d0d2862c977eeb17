package com.health.misinfo.repository;

import com.health.misinfo.model.InteractionEdge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory edge store: the raw interaction records exactly as ingested, unmerged.
 *
 * Appends are atomic per batch and bump a version counter, which lets the graph service
 * skip rebuilds when nothing changed. Callers validate records before saving.
 */
@Repository
public class EdgeRepository {

    private static final Logger log = LoggerFactory.getLogger(EdgeRepository.class);

    private final List<InteractionEdge> edges = new ArrayList<>();
    private final AtomicLong version = new AtomicLong();

    public synchronized void saveAll(Collection<InteractionEdge> batch) {
        if (batch.isEmpty()) return;
        for (InteractionEdge edge : batch) {
            edges.add(InteractionEdge.of(edge.getSourceId(), edge.getTargetId(), edge.getWeight()));
        }
        version.incrementAndGet();
        log.debug("Stored {} interaction records, {} total", batch.size(), edges.size());
    }

    /** Snapshot copy of all stored records in ingestion order. */
    public synchronized List<InteractionEdge> findAll() {
        List<InteractionEdge> copy = new ArrayList<>(edges.size());
        for (InteractionEdge edge : edges) {
            copy.add(InteractionEdge.of(edge.getSourceId(), edge.getTargetId(), edge.getWeight()));
        }
        return copy;
    }

    public synchronized int count() {
        return edges.size();
    }

    public long getVersion() {
        return version.get();
    }
}
