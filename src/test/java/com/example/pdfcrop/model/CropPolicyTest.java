package com.example.pdfcrop.model;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CropPolicyTest {

    @Test
    void defaultsMatchDocumentedValues() {
        CropPolicy policy = CropPolicy.defaults();

        assertEquals(SideValues.all(10), policy.getPercentRetain());
        assertEquals(191, policy.getThreshold());
        assertEquals(SideValues.all(1), policy.getPageRatioWeights());
        assertFalse(policy.isEffectivelyUniform());
    }

    @Test
    void evenoddAndOrderStatImplyUniform() {
        assertTrue(CropPolicy.builder().evenodd(true).build().isEffectivelyUniform());
        assertTrue(CropPolicy.builder().uniformOrderStat(SideValues.of(0, 0, 2, 0)).build().isEffectivelyUniform());
    }

    @Test
    void fingerprintIgnoresAggregationFields() {
        CropPolicy base = CropPolicy.defaults();
        CropPolicy offset = base.toBuilder()
                .absoluteOffset(SideValues.all(5))
                .percentRetain(SideValues.all(0))
                .percentText(true)
                .cropSafe(true)
                .build();
        CropPolicy threshold = base.toBuilder().threshold(120).build();

        assertEquals(base.fingerprint(4), offset.fingerprint(4));
        assertNotEquals(base.fingerprint(4), threshold.fingerprint(4));
    }

    @Test
    void selectedPagesIgnoreOutOfRangeIndices() {
        CropPolicy policy = CropPolicy.builder().pageSubset(Set.of(0, 2, 9)).build();

        assertEquals(Set.of(0, 2), policy.selectedPages(4));
        assertEquals(4, CropPolicy.defaults().selectedPages(4).size());
    }
}
