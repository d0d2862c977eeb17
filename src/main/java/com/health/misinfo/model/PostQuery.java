package com.health.misinfo.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Post listing criteria. Empty platform/category lists match everything.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PostQuery {

    @Builder.Default
    private List<String> platforms = List.of();

    @Builder.Default
    private List<String> categories = List.of();

    private double minScore;

    private String search;

    @Builder.Default
    private PostSortOrder sortBy = PostSortOrder.TIMESTAMP;

    @Builder.Default
    private int limit = 100;

    public static PostQuery all() {
        return PostQuery.builder().limit(Integer.MAX_VALUE).build();
    }
}
