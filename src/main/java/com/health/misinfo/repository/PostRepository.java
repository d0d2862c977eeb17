package com.health.misinfo.repository;

import com.health.misinfo.model.PostRecord;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory post store keyed by post id. Saving an existing id replaces the record.
 */
@Repository
public class PostRepository {

    private final ConcurrentHashMap<String, PostRecord> posts = new ConcurrentHashMap<>();
    private final AtomicLong version = new AtomicLong();

    public void saveAll(Collection<PostRecord> batch) {
        for (PostRecord post : batch) {
            posts.put(post.getPostId(), post.toBuilder().build());
        }
        version.incrementAndGet();
    }

    public Optional<PostRecord> findById(String postId) {
        if (postId == null) return Optional.empty();
        PostRecord post = posts.get(postId);
        return post != null ? Optional.of(post.toBuilder().build()) : Optional.empty();
    }

    /** All posts ordered by post id. */
    public List<PostRecord> findAll() {
        List<PostRecord> all = new ArrayList<>(posts.size());
        for (PostRecord post : posts.values()) {
            all.add(post.toBuilder().build());
        }
        all.sort(Comparator.comparing(PostRecord::getPostId));
        return all;
    }

    /** Distinct non-blank author ids, sorted. */
    public List<String> findAllAuthorIds() {
        return posts.values().stream()
                .map(PostRecord::getUserId)
                .filter(id -> id != null && !id.isBlank())
                .distinct()
                .sorted()
                .toList();
    }

    public int count() {
        return posts.size();
    }

    public long getVersion() {
        return version.get();
    }
}
