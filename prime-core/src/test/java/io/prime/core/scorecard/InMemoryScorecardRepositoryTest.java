package io.prime.core.scorecard;

import static io.prime.core.EvidenceFixtures.NOW;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("InMemoryScorecardRepository")
class InMemoryScorecardRepositoryTest {

    private InMemoryScorecardRepository repository;

    @BeforeEach
    void setUp() {
        repository = new InMemoryScorecardRepository();
    }

    private static Scorecard scorecard(String revision) {
        return Scorecard.builder()
                .generatedAt(NOW)
                .scoringRevision(revision)
                .evidenceSummary(new EvidenceSummary(0, 0, null, Map.of()))
                .build();
    }

    @Test
    @DisplayName("saving does not move the latest pointer")
    void shouldKeepPointerUntilSet() throws Exception {
        String id = repository.save("subject-1", scorecard("a"));

        assertThat(repository.findLatest("subject-1")).isEmpty();
        assertThat(repository.findById(id).getScoringRevision()).isEqualTo("a");

        repository.setLatest("subject-1", id);
        assertThat(repository.findLatest("subject-1")).map(Scorecard::getScoringRevision).contains("a");
    }

    @Test
    @DisplayName("unknown ids raise ScorecardNotFoundException")
    void shouldRejectUnknownIds() {
        assertThatThrownBy(() -> repository.findById("nope"))
                .isInstanceOf(ScorecardNotFoundException.class)
                .hasMessageContaining("nope");
        assertThatThrownBy(() -> repository.setLatest("subject-1", "nope"))
                .isInstanceOf(ScorecardNotFoundException.class);
    }

    @Test
    @DisplayName("clear removes scorecards and pointers")
    void shouldClear() throws Exception {
        repository.setLatest("subject-1", repository.save("subject-1", scorecard("a")));

        repository.clear();

        assertThat(repository.size()).isZero();
        assertThat(repository.findLatest("subject-1")).isEmpty();
    }
}
