package com.health.misinfo.seeder;

import com.health.misinfo.model.InteractionEdge;
import com.health.misinfo.model.PostRecord;
import com.health.misinfo.model.VerificationStatus;
import com.health.misinfo.service.ContextGraphService;
import com.health.misinfo.service.PostService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Seeds the in-memory stores with a synthetic misinformation spread network for local testing.
 * Only runs when the "seed" Spring profile is active.
 *
 * Run with:  mvn spring-boot:run -Dspring-boot.run.profiles=seed
 *
 * Generates 30 accounts. user_1 to user_3 are hubs that share with most of the network,
 * the rest interact sparsely. Each account authors a handful of posts over the last 30 days.
 */
@Component
@Profile("seed")
public class DataSeeder implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(DataSeeder.class);

    static final int ACCOUNTS = 30;
    static final int HUBS = 3;
    static final int POSTS = 120;

    private static final String[] PLATFORMS = {"Twitter", "Facebook", "Instagram", "TikTok", "Reddit"};
    private static final String[] CATEGORIES = {"Vaccine", "Treatment", "Diet", "Cancer", "Mental Health"};
    private static final String[] CLAIMS = {
            "Vaccines contain microchips that track your location",
            "Vitamin D megadoses cure COVID overnight",
            "Drinking bleach solution cleanses the immune system",
            "Alkaline water reverses cancer growth",
            "Antidepressants are just sugar pills",
            "Garlic prevents all viral infections",
            "Fasting for 14 days cures diabetes",
            "5G towers spread respiratory illness"
    };

    private final ContextGraphService graphService;
    private final PostService postService;
    private final Random random = new Random(42); // fixed seed for reproducibility

    public DataSeeder(ContextGraphService graphService, PostService postService) {
        this.graphService = graphService;
        this.postService = postService;
    }

    @Override
    public void run(String... args) {
        log.info("=== Starting data seeding ===");

        List<InteractionEdge> edges = generateEdges();
        graphService.ingestEdges(edges);
        log.info("Seeded {} interaction records", edges.size());

        List<PostRecord> posts = generatePosts();
        postService.ingestPosts(posts);
        log.info("Seeded {} posts", posts.size());

        log.info("=== Data seeding complete ===");
    }

    List<InteractionEdge> generateEdges() {
        List<InteractionEdge> edges = new ArrayList<>();

        for (int hub = 1; hub <= HUBS; hub++) {
            for (int other = HUBS + 1; other <= ACCOUNTS; other++) {
                if (random.nextDouble() < 0.6) {
                    edges.add(InteractionEdge.of(account(hub), account(other), 1 + random.nextInt(8)));
                }
            }
        }

        // Sparse background chatter; repeats are merged by the graph builder
        for (int i = 0; i < ACCOUNTS * 2; i++) {
            int a = HUBS + 1 + random.nextInt(ACCOUNTS - HUBS);
            int b = HUBS + 1 + random.nextInt(ACCOUNTS - HUBS);
            if (a != b) {
                edges.add(InteractionEdge.of(account(a), account(b), 1 + random.nextInt(3)));
            }
        }
        return edges;
    }

    List<PostRecord> generatePosts() {
        Instant now = Instant.now().truncatedTo(ChronoUnit.SECONDS);
        VerificationStatus[] statuses = VerificationStatus.values();
        List<PostRecord> posts = new ArrayList<>();

        for (int i = 1; i <= POSTS; i++) {
            int author = 1 + random.nextInt(ACCOUNTS);
            // Hubs get viral reach
            long reach = author <= HUBS ? 5_000 + random.nextInt(50_000) : random.nextInt(2_000);

            posts.add(PostRecord.builder()
                    .postId(String.format("POST_%04d", i))
                    .platform(PLATFORMS[random.nextInt(PLATFORMS.length)])
                    .category(CATEGORIES[random.nextInt(CATEGORIES.length)])
                    .timestamp(now.minus(random.nextInt(30 * 24 * 60), ChronoUnit.MINUTES).toEpochMilli())
                    .userId(account(author))
                    .username("account" + author)
                    .content(CLAIMS[random.nextInt(CLAIMS.length)])
                    .shares(reach)
                    .likes(reach * (1 + random.nextInt(3)))
                    .comments(reach / (5 + random.nextInt(20)))
                    .views(reach * (10 + random.nextInt(40)))
                    .verificationStatus(statuses[random.nextInt(statuses.length)])
                    .archived(random.nextDouble() < 0.4)
                    .build());
        }

        // Archived posts carry a link to their copy
        posts.replaceAll(p -> p.isArchived()
                ? p.toBuilder().archiveUrl("https://archive.example.org/" + p.getPostId()).build()
                : p);
        return posts;
    }

    private static String account(int index) {
        return "user_" + index;
    }
}
