package com.health.misinfo.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A social-media post flagged as possible health misinformation")
public class PostRecord {

    @Schema(description = "Unique post identifier", example = "POST_0001")
    private String postId;

    @Schema(description = "Platform the post was captured from", example = "Twitter")
    private String platform;

    @Schema(description = "Misinformation category", example = "Vaccine")
    private String category;

    @Schema(description = "Posting time in epoch milliseconds", example = "1739886764000")
    private long timestamp;

    @Schema(description = "Author account id; matches node ids of the interaction graph", example = "user_1")
    private String userId;

    @Schema(description = "Author display name", example = "healthnut42")
    private String username;

    @Schema(description = "Post text", example = "Vitamin D cures COVID")
    private String content;

    @Schema(description = "Share count", example = "1200")
    private long shares;

    @Schema(description = "Like count", example = "3400")
    private long likes;

    @Schema(description = "Comment count", example = "210")
    private long comments;

    @Schema(description = "View count", example = "50000")
    private long views;

    @Schema(description = "Fact-check status", example = "Verified False")
    private VerificationStatus verificationStatus;

    @Schema(description = "Whether an archival copy exists", example = "false")
    private boolean archived;

    @Schema(description = "Link to the archival copy, if any")
    private String archiveUrl;
}
