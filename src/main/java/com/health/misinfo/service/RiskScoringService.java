package com.health.misinfo.service;

import com.health.misinfo.config.RiskScoringConfig;
import com.health.misinfo.exception.InvalidParameterException;
import com.health.misinfo.model.PostRecord;
import com.health.misinfo.model.PostRiskScore;
import com.health.misinfo.model.RiskLevel;
import org.springframework.stereotype.Service;

/**
 * Computes the misinformation risk score of a post from its engagement and
 * verification status. Independent of the interaction graph.
 *
 * score = statusPoints × severity(status) + engagementPoints × engagement
 *
 * where engagement is the weighted average of per-metric signals
 * min(1, log10(1 + count) / log10(1 + reference)). Both terms only grow with their
 * inputs, so raising any metric or moving to a more confirmed-false status never lowers
 * the score. The result is clamped to [0, 100] and rounded to 2 decimals.
 */
@Service
public class RiskScoringService {

    private final RiskScoringConfig scoringConfig;

    public RiskScoringService(RiskScoringConfig scoringConfig) {
        this.scoringConfig = scoringConfig;
    }

    /**
     * Score a single post. Pure: no state is read or written besides the configuration.
     *
     * @throws InvalidParameterException if the post or its status is missing, or a metric is negative
     */
    public PostRiskScore score(PostRecord post) {
        validate(post);

        double engagement = engagementScore(post);
        double severity = post.getVerificationStatus().getSeverity();

        double raw = scoringConfig.getStatusPoints() * severity
                + scoringConfig.getEngagementPoints() * engagement;
        double score = Math.max(0.0, Math.min(100.0, raw));
        score = Math.round(score * 100.0) / 100.0; // round to 2 decimal

        return PostRiskScore.builder()
                .postId(post.getPostId())
                .misinformationScore(score)
                .riskLevel(classify(score))
                .engagementScore(Math.round(engagement * 10000.0) / 10000.0)
                .statusSeverity(severity)
                .build();
    }

    public RiskLevel classify(double score) {
        return RiskLevel.fromScore(score, scoringConfig.getHighThreshold(), scoringConfig.getMediumThreshold());
    }

    /**
     * Weighted average of the log-scaled engagement signals, in [0, 1].
     */
    double engagementScore(PostRecord post) {
        RiskScoringConfig.Engagement cfg = scoringConfig.getEngagement();

        double weighted = cfg.getSharesWeight() * signal(post.getShares(), cfg.getSharesReference())
                + cfg.getViewsWeight() * signal(post.getViews(), cfg.getViewsReference())
                + cfg.getCommentsWeight() * signal(post.getComments(), cfg.getCommentsReference())
                + cfg.getLikesWeight() * signal(post.getLikes(), cfg.getLikesReference());
        double totalWeight = cfg.getSharesWeight() + cfg.getViewsWeight()
                + cfg.getCommentsWeight() + cfg.getLikesWeight();

        return totalWeight > 0 ? weighted / totalWeight : 0.0;
    }

    private static double signal(long count, long reference) {
        if (count <= 0) return 0.0;
        if (reference <= 0) return 1.0;
        return Math.min(1.0, Math.log10(1.0 + count) / Math.log10(1.0 + reference));
    }

    private static void validate(PostRecord post) {
        if (post == null) {
            throw new InvalidParameterException("post is required");
        }
        if (post.getVerificationStatus() == null) {
            throw new InvalidParameterException("verificationStatus is required for post " + post.getPostId());
        }
        if (post.getShares() < 0 || post.getLikes() < 0 || post.getComments() < 0 || post.getViews() < 0) {
            throw new InvalidParameterException("Engagement metrics must be non-negative for post " + post.getPostId());
        }
    }
}
