package com.health.misinfo.service;

import com.health.misinfo.config.GraphConfig;
import com.health.misinfo.config.MetricsConfig;
import com.health.misinfo.config.RiskScoringConfig;
import com.health.misinfo.exception.InvalidParameterException;
import com.health.misinfo.model.PostQuery;
import com.health.misinfo.model.PostRecord;
import com.health.misinfo.model.PostRiskScore;
import com.health.misinfo.model.PostSortOrder;
import com.health.misinfo.model.ScoredPost;
import com.health.misinfo.repository.PostRepository;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Post ingestion and scored post listing. Scores are never stored; every read rescores
 * the post with the current scoring configuration.
 */
@Service
public class PostService {

    private static final Logger log = LoggerFactory.getLogger(PostService.class);

    private final PostRepository postRepository;
    private final RiskScoringService riskScoringService;
    private final ContextGraphService graphService;
    private final RiskScoringConfig scoringConfig;
    private final GraphConfig graphConfig;
    private final MetricsConfig metricsConfig;

    public PostService(PostRepository postRepository,
                       RiskScoringService riskScoringService,
                       ContextGraphService graphService,
                       RiskScoringConfig scoringConfig,
                       GraphConfig graphConfig,
                       MetricsConfig metricsConfig) {
        this.postRepository = postRepository;
        this.riskScoringService = riskScoringService;
        this.graphService = graphService;
        this.scoringConfig = scoringConfig;
        this.graphConfig = graphConfig;
        this.metricsConfig = metricsConfig;
    }

    /**
     * Validate and store a batch of posts. One invalid post rejects the whole batch.
     * Authors join the interaction graph as nodes on the next rebuild, which is
     * triggered here.
     *
     * @return the stored posts with their scores
     */
    @Observed(name = "posts.ingest", contextualName = "ingest-posts")
    public List<ScoredPost> ingestPosts(List<PostRecord> posts) {
        List<ScoredPost> scored;
        try {
            Set<String> seen = new HashSet<>();
            for (PostRecord post : posts) {
                if (post == null || post.getPostId() == null || post.getPostId().isBlank()) {
                    throw new InvalidParameterException("postId is required");
                }
                if (!seen.add(post.getPostId())) {
                    throw new InvalidParameterException("Duplicate postId in batch: " + post.getPostId());
                }
            }
            scored = posts.stream().map(this::toScored).toList();
        } catch (InvalidParameterException e) {
            metricsConfig.recordPostsRejected(posts.size());
            log.warn("Rejected batch of {} posts: {}", posts.size(), e.getMessage());
            throw e;
        }

        postRepository.saveAll(posts);
        scored.forEach(s -> metricsConfig.recordPostScored(
                s.getScore().getRiskLevel(), s.getScore().getMisinformationScore()));
        log.info("Ingested {} posts ({} stored)", posts.size(), postRepository.count());

        if (graphConfig.isIncludePostAuthors()) {
            graphService.refreshGraph();
        }
        return scored;
    }

    /** Score a post without storing it. */
    public PostRiskScore scorePost(PostRecord post) {
        PostRiskScore score = riskScoringService.score(post);
        metricsConfig.recordPostScored(score.getRiskLevel(), score.getMisinformationScore());
        return score;
    }

    public Optional<ScoredPost> getPost(String postId) {
        return postRepository.findById(postId).map(this::toScored);
    }

    /**
     * Posts matching the query's platform, category, minimum score and content search,
     * in the requested order (descending), then by post id.
     */
    public List<ScoredPost> listPosts(PostQuery query) {
        if (query.getLimit() < 0) {
            throw new InvalidParameterException("limit must be >= 0, got " + query.getLimit());
        }
        return matching(query).stream()
                .sorted(comparator(query.getSortBy()))
                .limit(query.getLimit())
                .toList();
    }

    /**
     * Posts matching {@code query} that have no archival copy, highest score first.
     * The query's own sort order and limit are ignored.
     */
    public List<ScoredPost> recoveryQueue(PostQuery query, Integer limit) {
        int size = limit != null ? limit : scoringConfig.getRecoveryQueueSize();
        if (size < 0) {
            throw new InvalidParameterException("limit must be >= 0, got " + size);
        }
        return matching(query).stream()
                .filter(s -> !s.getPost().isArchived())
                .sorted(comparator(PostSortOrder.SCORE))
                .limit(size)
                .toList();
    }

    /** All posts matching the query's filters, unsorted and unlimited. */
    public List<ScoredPost> matching(PostQuery query) {
        Set<String> platforms = lowerCase(query.getPlatforms());
        Set<String> categories = lowerCase(query.getCategories());
        String search = query.getSearch() != null && !query.getSearch().isBlank()
                ? query.getSearch().toLowerCase(Locale.ROOT)
                : null;

        return postRepository.findAll().stream()
                .filter(p -> platforms.isEmpty() || (p.getPlatform() != null
                        && platforms.contains(p.getPlatform().toLowerCase(Locale.ROOT))))
                .filter(p -> categories.isEmpty() || (p.getCategory() != null
                        && categories.contains(p.getCategory().toLowerCase(Locale.ROOT))))
                .filter(p -> search == null || (p.getContent() != null
                        && p.getContent().toLowerCase(Locale.ROOT).contains(search)))
                .map(this::toScored)
                .filter(s -> s.getScore().getMisinformationScore() >= query.getMinScore())
                .toList();
    }

    private ScoredPost toScored(PostRecord post) {
        return ScoredPost.builder()
                .post(post)
                .score(riskScoringService.score(post))
                .build();
    }

    private static Comparator<ScoredPost> comparator(PostSortOrder sortBy) {
        Comparator<ScoredPost> primary = switch (sortBy == null ? PostSortOrder.TIMESTAMP : sortBy) {
            case TIMESTAMP -> Comparator.comparingLong((ScoredPost s) -> s.getPost().getTimestamp());
            case SCORE -> Comparator.comparingDouble((ScoredPost s) -> s.getScore().getMisinformationScore());
            case SHARES -> Comparator.comparingLong((ScoredPost s) -> s.getPost().getShares());
        };
        return primary.reversed().thenComparing(s -> s.getPost().getPostId());
    }

    private static Set<String> lowerCase(List<String> values) {
        if (values == null) return Set.of();
        return values.stream()
                .filter(v -> v != null && !v.isBlank())
                .map(v -> v.toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
    }
}
