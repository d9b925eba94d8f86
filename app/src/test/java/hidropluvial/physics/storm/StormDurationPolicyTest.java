package hidropluvial.physics.storm;

import hidropluvial.config.AnalysisConfig;
import hidropluvial.domain.storm.StormType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StormDurationPolicyTest {

    private final AnalysisConfig config = AnalysisConfig.builder()
            .bimodalDurationHr(4.0)
            .customDurationHr(3.0)
            .build();

    @Test
    @DisplayName("Duración según el tipo de tormenta")
    void durationByType() {
        assertEquals(6.0, StormDurationPolicy.durationHr(StormType.GZ, 0.3, config), 0.0);
        assertEquals(4.0, StormDurationPolicy.durationHr(StormType.BIMODAL, 0.3, config), 0.0);
        assertEquals(3.0, StormDurationPolicy.durationHr(StormType.CUSTOM, 0.3, config), 0.0);
        assertEquals(24.0, StormDurationPolicy.durationHr(StormType.BLOCKS_24, 0.3, config), 0.0);
        assertEquals(24.0, StormDurationPolicy.durationHr(StormType.SCS_IA, 0.3, config), 0.0);
        assertEquals(2.0, StormDurationPolicy.durationHr(StormType.HUFF_Q1, 0.3, config), 0.0);
        assertEquals(3.0, StormDurationPolicy.durationHr(StormType.HUFF_Q1, 1.5, config), 0.0);
        assertEquals(1.0, StormDurationPolicy.durationHr(StormType.BLOCKS, 0.3, config), 0.0);
        assertEquals(1.8, StormDurationPolicy.durationHr(StormType.CHICAGO, 1.8, config), 0.0);
    }

    @Test
    @DisplayName("Las tormentas diarias no bajan de 10 min de paso")
    void dailyStormsClampStep() {
        assertEquals(10.0, StormDurationPolicy.effectiveDtMin(StormType.SCS_III, 5.0), 0.0);
        assertEquals(15.0, StormDurationPolicy.effectiveDtMin(StormType.BLOCKS_24, 15.0), 0.0);
        assertEquals(5.0, StormDurationPolicy.effectiveDtMin(StormType.GZ, 5.0), 0.0);
    }
}
