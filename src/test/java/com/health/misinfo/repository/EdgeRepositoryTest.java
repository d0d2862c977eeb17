package com.health.misinfo.repository;

import com.health.misinfo.model.InteractionEdge;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.health.misinfo.testutil.TestDataFactory.edge;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class EdgeRepositoryTest {

    private EdgeRepository repository;

    @BeforeEach
    void setUp() {
        repository = new EdgeRepository();
    }

    @Test
    void saveAll_keepsRecordsUnmergedInOrder() {
        repository.saveAll(List.of(edge("A", "B", 1), edge("B", "A", 2)));

        assertThat(repository.findAll())
                .extracting(InteractionEdge::getSourceId, InteractionEdge::getWeight)
                .containsExactly(
                        tuple("A", 1.0),
                        tuple("B", 2.0));
        assertThat(repository.count()).isEqualTo(2);
    }

    @Test
    void saveAll_bumpsVersionOncePerBatch() {
        long before = repository.getVersion();

        repository.saveAll(List.of(edge("A", "B", 1), edge("C", "D", 1)));
        repository.saveAll(List.of());

        assertThat(repository.getVersion()).isEqualTo(before + 1);
    }

    @Test
    void findAll_returnsCopies() {
        InteractionEdge original = edge("A", "B", 1);
        repository.saveAll(List.of(original));

        original.setWeight(99);
        repository.findAll().get(0).setWeight(50);

        assertThat(repository.findAll().get(0).getWeight()).isEqualTo(1.0);
    }
}
