package com.llmorch.core.model;

import com.llmorch.core.crd.SlaSpec;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class QualityClassTest {

    @Test
    void testThresholds() {
        assertEquals(QualityClass.PREMIUM, QualityClass.fromSla(sla(99.9, 100.0)));
        assertEquals(QualityClass.STANDARD, QualityClass.fromSla(sla(99.9, 101.0)));
        assertEquals(QualityClass.STANDARD, QualityClass.fromSla(sla(99.5, 400.0)));
        assertEquals(QualityClass.BASIC, QualityClass.fromSla(sla(99.5, 501.0)));
        assertEquals(QualityClass.BASIC, QualityClass.fromSla(sla(99.0, 50.0)));
    }

    @Test
    void testMissingSla_IsBasic() {
        assertEquals(QualityClass.BASIC, QualityClass.fromSla(null));
        assertEquals(QualityClass.BASIC, QualityClass.fromSla(sla(99.99, null)));
    }

    private static SlaSpec sla(Double availability, Double p95) {
        SlaSpec sla = new SlaSpec();
        sla.setAvailability(availability);
        sla.setP95ResponseTimeMs(p95);
        return sla;
    }
}
