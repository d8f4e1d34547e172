package io.prime.core.scorecard;

import static io.prime.core.EvidenceFixtures.NOW;
import static io.prime.core.EvidenceFixtures.fullEvidence;
import static io.prime.core.EvidenceFixtures.item;
import static org.assertj.core.api.Assertions.assertThat;

import io.prime.core.evidence.EvidenceItem;
import io.prime.core.evidence.EvidenceSet;
import io.prime.core.model.PrimeDomain;
import io.prime.core.model.SourceType;
import io.prime.core.registry.DefaultDriverRegistry;
import io.prime.core.registry.SourceQualityTable;
import io.prime.core.scoring.NoHistoryStabilityCalculator;
import io.prime.core.scoring.PrimeScoreAggregator;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ScorecardGenerator")
class ScorecardGeneratorTest {

    private ScorecardGenerator generator;

    @BeforeEach
    void setUp() {
        ScorecardEngine engine =
                new ScorecardEngine(
                        DefaultDriverRegistry.create(),
                        SourceQualityTable.defaults(),
                        new NoHistoryStabilityCalculator(),
                        new PrimeScoreAggregator());
        generator = new ScorecardGenerator(engine, new ReusePolicy());
    }

    @Test
    @DisplayName("computes when there is no previous scorecard")
    void shouldComputeWithoutPrevious() {
        GenerationResult result = generator.generateOrReuse(null, fullEvidence(), NOW, "rev-1");

        assertThat(result.cached()).isFalse();
        assertThat(result.scorecard().getGeneratedAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("returns the existing scorecard unchanged when nothing changed")
    void shouldReuseUnchangedScorecard() {
        Scorecard first = generator.generateOrReuse(null, fullEvidence(), NOW, "rev-1").scorecard();

        GenerationResult second =
                generator.generateOrReuse(first, fullEvidence(), NOW.plus(Duration.ofMinutes(3)), "rev-1");

        assertThat(second.cached()).isTrue();
        assertThat(second.scorecard()).isSameAs(first);
    }

    @Test
    @DisplayName("recomputes when newer evidence arrives inside the window")
    void shouldRecomputeOnNewerEvidence() {
        Scorecard first = generator.generateOrReuse(null, fullEvidence(), NOW, "rev-1").scorecard();
        List<EvidenceItem> items = new ArrayList<>(fullEvidence().getItems());
        items.add(item(PrimeDomain.HEART, "rhr", 52, SourceType.DEVICE, NOW.plus(Duration.ofMinutes(1))));
        EvidenceSet updated = new EvidenceSet("subject-1", items);

        GenerationResult second =
                generator.generateOrReuse(first, updated, NOW.plus(Duration.ofMinutes(2)), "rev-1");

        assertThat(second.cached()).isFalse();
        assertThat(second.scorecard().getDomainScores().get(PrimeDomain.HEART))
                .isGreaterThan(first.getDomainScores().get(PrimeDomain.HEART));
    }

    @Test
    @DisplayName("recomputes after a revision change")
    void shouldRecomputeAfterRevisionChange() {
        Scorecard first = generator.generateOrReuse(null, fullEvidence(), NOW, "rev-1").scorecard();

        GenerationResult second =
                generator.generateOrReuse(first, fullEvidence(), NOW.plus(Duration.ofMinutes(1)), "rev-2");

        assertThat(second.cached()).isFalse();
        assertThat(second.scorecard().getScoringRevision()).isEqualTo("rev-2");
    }
}
