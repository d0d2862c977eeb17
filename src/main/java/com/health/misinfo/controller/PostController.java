package com.health.misinfo.controller;

import com.health.misinfo.model.PostQuery;
import com.health.misinfo.model.PostRecord;
import com.health.misinfo.model.PostRiskScore;
import com.health.misinfo.model.PostSortOrder;
import com.health.misinfo.model.ScoredPost;
import com.health.misinfo.service.PostService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/posts")
@Tag(name = "Posts", description = "Post ingestion, misinformation risk scoring and the archival recovery queue")
public class PostController {

    private final PostService postService;

    public PostController(PostService postService) {
        this.postService = postService;
    }

    @Operation(summary = "Ingest posts",
            description = "Stores a batch of flagged posts and returns them with their risk scores. " +
                    "Authors are added to the interaction graph as nodes.")
    @PostMapping
    public ResponseEntity<Map<String, Object>> ingestPosts(@RequestBody List<PostRecord> posts) {
        List<ScoredPost> scored = postService.ingestPosts(posts);
        return ResponseEntity.ok(Map.of("accepted", scored.size(), "posts", scored));
    }

    @Operation(summary = "Score a post",
            description = "Computes the 0-100 misinformation score and risk tier of a post without storing it.")
    @PostMapping("/score")
    public ResponseEntity<PostRiskScore> scorePost(@RequestBody PostRecord post) {
        return ResponseEntity.ok(postService.scorePost(post));
    }

    @Operation(summary = "List scored posts",
            description = "Filters by platform, category, minimum score and content search; sorts descending.")
    @GetMapping
    public ResponseEntity<List<ScoredPost>> listPosts(
            @Parameter(description = "Platforms to include (all when omitted)", example = "Twitter")
            @RequestParam(required = false) List<String> platform,
            @Parameter(description = "Categories to include (all when omitted)", example = "Vaccine")
            @RequestParam(required = false) List<String> category,
            @Parameter(description = "Minimum misinformation score", example = "70")
            @RequestParam(defaultValue = "0") double minScore,
            @Parameter(description = "Case-insensitive content search")
            @RequestParam(required = false) String search,
            @Parameter(description = "Sort order: TIMESTAMP, SCORE or SHARES", example = "SCORE")
            @RequestParam(defaultValue = "TIMESTAMP") PostSortOrder sortBy,
            @RequestParam(defaultValue = "20") int limit) {
        PostQuery query = PostQuery.builder()
                .platforms(platform != null ? platform : List.of())
                .categories(category != null ? category : List.of())
                .minScore(minScore)
                .search(search)
                .sortBy(sortBy)
                .limit(limit)
                .build();
        return ResponseEntity.ok(postService.listPosts(query));
    }

    @Operation(summary = "Get a scored post by ID")
    @GetMapping("/{postId}")
    public ResponseEntity<ScoredPost> getPost(
            @Parameter(description = "Post ID", example = "POST_0001")
            @PathVariable String postId) {
        return postService.getPost(postId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @Operation(summary = "Get the archival recovery queue",
            description = "Posts without an archival copy, highest risk first. Accepts the same filters as the post list.")
    @GetMapping("/recovery-queue")
    public ResponseEntity<List<ScoredPost>> getRecoveryQueue(
            @RequestParam(required = false) List<String> platform,
            @RequestParam(required = false) List<String> category,
            @RequestParam(defaultValue = "0") double minScore,
            @RequestParam(required = false) String search,
            @Parameter(description = "Queue size (configured default when omitted)", example = "5")
            @RequestParam(required = false) Integer limit) {
        PostQuery query = PostQuery.builder()
                .platforms(platform != null ? platform : List.of())
                .categories(category != null ? category : List.of())
                .minScore(minScore)
                .search(search)
                .build();
        return ResponseEntity.ok(postService.recoveryQueue(query, limit));
    }
}
