package io.prime.core.scoring;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.prime.core.evidence.EvidenceValue;
import io.prime.core.model.PrimeDomain;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("RiskFlag")
class RiskFlagTest {

    @Test
    @DisplayName("blood pressure flags from 180 mmHg systolic")
    void shouldFlagBloodPressureCrisis() {
        assertThat(RiskFlag.BP_CRISIS.raisedBy(EvidenceValue.numeric(180))).isTrue();
        assertThat(RiskFlag.BP_CRISIS.raisedBy(EvidenceValue.numeric(179.5))).isFalse();
        assertThat(RiskFlag.BP_CRISIS.raisedBy(EvidenceValue.categorical("high"))).isFalse();
        assertThat(RiskFlag.BP_CRISIS.raisedBy(EvidenceValue.unestimable())).isFalse();
    }

    @Test
    @DisplayName("categorical flags match the whole answer")
    void shouldMatchWholeCategory() {
        assertThat(RiskFlag.SEVERE_PAIN.raisedBy(EvidenceValue.categorical(" Severe "))).isTrue();
        assertThat(RiskFlag.SEVERE_PAIN.raisedBy(EvidenceValue.categorical("moderate"))).isFalse();
        assertThat(RiskFlag.DIABETES.raisedBy(EvidenceValue.categorical("diabetes"))).isTrue();
        assertThat(RiskFlag.DIABETES.raisedBy(EvidenceValue.categorical("prediabetes"))).isFalse();
    }

    @Test
    @DisplayName("each flag watches one driver of its domain")
    void shouldWatchOneDriver() {
        assertThat(RiskFlag.BP_CRISIS.domain()).isEqualTo(PrimeDomain.HEART);
        assertThat(RiskFlag.SEVERE_PAIN.driverKey()).isEqualTo("pain_limitation");
        assertThat(RiskFlag.DIABETES.driverKey()).isEqualTo("metabolic_risk");
    }

    @Test
    @DisplayName("resolves wire keys and rejects unknown ones")
    void shouldResolveKeys() {
        assertThat(RiskFlag.fromKey("BP_CRISIS")).isEqualTo(RiskFlag.BP_CRISIS);
        assertThat(RiskFlag.fromKey("severe_pain")).isEqualTo(RiskFlag.SEVERE_PAIN);
        assertThatThrownBy(() -> RiskFlag.fromKey("gout"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unknown risk flag: gout");
    }
}
