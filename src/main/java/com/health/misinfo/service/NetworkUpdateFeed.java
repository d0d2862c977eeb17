package com.health.misinfo.service;

import com.health.misinfo.config.GraphConfig;
import com.health.misinfo.model.NetworkUpdateEvent;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Ordered, bounded log of graph snapshot diffs for clients that follow the network
 * "live". Clients poll with the last sequence they saw; the oldest events are dropped
 * once the capacity is reached.
 */
@Component
public class NetworkUpdateFeed {

    private final GraphConfig graphConfig;
    private final Deque<NetworkUpdateEvent> events = new ArrayDeque<>();
    private long lastSequence = 0;

    public NetworkUpdateFeed(GraphConfig graphConfig) {
        this.graphConfig = graphConfig;
    }

    /**
     * Assigns the next sequence number and timestamp, and appends the event.
     *
     * @return the stored event
     */
    public synchronized NetworkUpdateEvent publish(NetworkUpdateEvent diff, long occurredAt) {
        NetworkUpdateEvent event = diff.toBuilder()
                .sequence(++lastSequence)
                .occurredAt(occurredAt)
                .build();
        events.addLast(event);
        int capacity = Math.max(1, graphConfig.getUpdateFeedCapacity());
        while (events.size() > capacity) {
            events.removeFirst();
        }
        return event;
    }

    /** Events with a sequence greater than {@code sequence}, oldest first. */
    public synchronized List<NetworkUpdateEvent> eventsAfter(long sequence) {
        List<NetworkUpdateEvent> result = new ArrayList<>();
        for (NetworkUpdateEvent event : events) {
            if (event.getSequence() > sequence) {
                result.add(event);
            }
        }
        return result;
    }

    public synchronized long getLastSequence() {
        return lastSequence;
    }
}
