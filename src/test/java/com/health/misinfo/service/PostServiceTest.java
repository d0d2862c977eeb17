package com.health.misinfo.service;

import com.health.misinfo.config.GraphConfig;
import com.health.misinfo.config.MetricsConfig;
import com.health.misinfo.config.RiskScoringConfig;
import com.health.misinfo.exception.InvalidParameterException;
import com.health.misinfo.model.*;
import com.health.misinfo.repository.PostRepository;
import com.health.misinfo.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PostServiceTest {

    @Mock private ContextGraphService graphService;
    @Mock private MetricsConfig metricsConfig;

    private PostRepository postRepository;
    private GraphConfig graphConfig;
    private PostService postService;

    @BeforeEach
    void setUp() {
        RiskScoringConfig scoringConfig = new RiskScoringConfig();
        graphConfig = new GraphConfig();
        postRepository = new PostRepository();
        postService = new PostService(postRepository, new RiskScoringService(scoringConfig), graphService,
                scoringConfig, graphConfig, metricsConfig);
    }

    @Test
    void ingestPosts_storesScoresAndRefreshesGraph() {
        List<ScoredPost> scored = postService.ingestPosts(List.of(
                TestDataFactory.createPost("P1", "user_1", VerificationStatus.VERIFIED_FALSE, 10_000),
                TestDataFactory.createPost("P2", "user_2", VerificationStatus.UNDER_REVIEW, 5)));

        assertThat(scored).hasSize(2);
        assertThat(scored.get(0).getScore().getRiskLevel()).isEqualTo(RiskLevel.HIGH);
        assertThat(postRepository.count()).isEqualTo(2);
        verify(graphService).refreshGraph();
        verify(metricsConfig, times(2)).recordPostScored(any(RiskLevel.class), anyDouble());
    }

    @Test
    void ingestPosts_authorsExcluded_noGraphRefresh() {
        graphConfig.setIncludePostAuthors(false);

        postService.ingestPosts(List.of(TestDataFactory.createPost("P1", "user_1", VerificationStatus.FLAGGED, 10)));

        verify(graphService, never()).refreshGraph();
    }

    @Test
    void ingestPosts_duplicateId_rejectsBatch() {
        List<PostRecord> batch = List.of(
                TestDataFactory.createPost("P1", "user_1", VerificationStatus.FLAGGED, 10),
                TestDataFactory.createPost("P1", "user_2", VerificationStatus.FLAGGED, 10));

        assertThatThrownBy(() -> postService.ingestPosts(batch))
                .isInstanceOf(InvalidParameterException.class)
                .hasMessageContaining("P1");

        assertThat(postRepository.count()).isZero();
        verify(metricsConfig).recordPostsRejected(2);
        verifyNoInteractions(graphService);
    }

    @Test
    void ingestPosts_invalidPost_rejectsBatch() {
        List<PostRecord> batch = List.of(
                TestDataFactory.createPost("P1", "user_1", VerificationStatus.FLAGGED, 10),
                TestDataFactory.createPost("P2", "user_2", null, 10));

        assertThatThrownBy(() -> postService.ingestPosts(batch))
                .isInstanceOf(InvalidParameterException.class);

        assertThat(postRepository.count()).isZero();
        verify(metricsConfig).recordPostsRejected(anyInt());
    }

    @Test
    void listPosts_filtersAndSortsByScore() {
        postRepository.saveAll(List.of(
                TestDataFactory.createPost("P1", "u1", VerificationStatus.UNDER_REVIEW, 10),
                TestDataFactory.createPost("P2", "u2", VerificationStatus.VERIFIED_FALSE, 10_000),
                TestDataFactory.createPost("P3", "u3", VerificationStatus.DEBUNKED, 100)
                        .toBuilder().platform("Reddit").build()));

        List<ScoredPost> result = postService.listPosts(PostQuery.builder()
                .platforms(List.of("twitter", "reddit"))
                .sortBy(PostSortOrder.SCORE)
                .build());

        assertThat(result).extracting(s -> s.getPost().getPostId()).containsExactly("P2", "P3", "P1");
    }

    @Test
    void listPosts_minScoreAndSearch() {
        postRepository.saveAll(List.of(
                TestDataFactory.createPost("P1", "u1", VerificationStatus.UNDER_REVIEW, 10),
                TestDataFactory.createPost("P2", "u2", VerificationStatus.VERIFIED_FALSE, 10_000)
                        .toBuilder().content("Garlic cures the flu").build(),
                TestDataFactory.createPost("P3", "u3", VerificationStatus.VERIFIED_FALSE, 10_000)));

        List<ScoredPost> result = postService.listPosts(PostQuery.builder()
                .minScore(70)
                .search("GARLIC")
                .build());

        assertThat(result).extracting(s -> s.getPost().getPostId()).containsExactly("P2");
    }

    @Test
    void listPosts_categoryFilterAndLimit() {
        postRepository.saveAll(List.of(
                TestDataFactory.createPost("P1", "u1", VerificationStatus.FLAGGED, 1),
                TestDataFactory.createPost("P2", "u2", VerificationStatus.FLAGGED, 3),
                TestDataFactory.createPost("P3", "u3", VerificationStatus.FLAGGED, 2),
                TestDataFactory.createPost("P4", "u4", VerificationStatus.FLAGGED, 9)
                        .toBuilder().category("Diet").build()));

        List<ScoredPost> result = postService.listPosts(PostQuery.builder()
                .categories(List.of("Vaccine"))
                .sortBy(PostSortOrder.SHARES)
                .limit(2)
                .build());

        assertThat(result).extracting(s -> s.getPost().getPostId()).containsExactly("P2", "P3");
    }

    @Test
    void listPosts_negativeLimit_throws() {
        assertThatThrownBy(() -> postService.listPosts(PostQuery.builder().limit(-1).build()))
                .isInstanceOf(InvalidParameterException.class);
    }

    @Test
    void recoveryQueue_unarchivedByScore() {
        postRepository.saveAll(List.of(
                TestDataFactory.createPost("P1", "u1", VerificationStatus.UNDER_REVIEW, 10),
                TestDataFactory.createPost("P2", "u2", VerificationStatus.VERIFIED_FALSE, 10_000)
                        .toBuilder().archived(true).archiveUrl("https://archive.example.org/P2").build(),
                TestDataFactory.createPost("P3", "u3", VerificationStatus.DEBUNKED, 100)));

        List<ScoredPost> queue = postService.recoveryQueue(PostQuery.all(), null);

        assertThat(queue).extracting(s -> s.getPost().getPostId()).containsExactly("P3", "P1");
        assertThat(postService.recoveryQueue(PostQuery.all(), 1)).hasSize(1);
    }

    @Test
    void recoveryQueue_appliesPostFilters() {
        postRepository.saveAll(List.of(
                TestDataFactory.createPost("P1", "u1", VerificationStatus.DEBUNKED, 100),
                TestDataFactory.createPost("P2", "u2", VerificationStatus.DEBUNKED, 100)
                        .toBuilder().platform("Facebook").build(),
                TestDataFactory.createPost("P3", "u3", VerificationStatus.UNDER_REVIEW, 1)
                        .toBuilder().platform("Facebook").build()));

        PostQuery facebook = PostQuery.builder().platforms(List.of("facebook")).build();
        assertThat(postService.recoveryQueue(facebook, null))
                .extracting(s -> s.getPost().getPostId()).containsExactly("P2", "P3");

        PostQuery risky = PostQuery.builder().platforms(List.of("Facebook")).minScore(40).build();
        assertThat(postService.recoveryQueue(risky, null))
                .extracting(s -> s.getPost().getPostId()).containsExactly("P2");
    }

    @Test
    void recoveryQueue_negativeLimit_throws() {
        assertThatThrownBy(() -> postService.recoveryQueue(PostQuery.all(), -1))
                .isInstanceOf(InvalidParameterException.class);
    }

    @Test
    void getPost_missing_empty() {
        assertThat(postService.getPost("missing")).isEmpty();
    }

    @Test
    void scorePost_recordsMetric() {
        PostRiskScore score = postService.scorePost(
                TestDataFactory.createPost("P1", "u1", VerificationStatus.DEBUNKED, 0));

        assertThat(score.getRiskLevel()).isEqualTo(RiskLevel.MEDIUM);
        verify(metricsConfig).recordPostScored(RiskLevel.MEDIUM, 45.0);
        assertThat(postRepository.count()).isZero();
    }
}
