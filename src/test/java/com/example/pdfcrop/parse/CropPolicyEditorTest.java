package com.example.pdfcrop.parse;

import com.example.pdfcrop.model.CropPolicy;
import com.example.pdfcrop.model.SideValues;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CropPolicyEditorTest {

    private final CropPolicy defaults = CropPolicy.defaults();

    @Test
    void singleAndQuadrupleFormsStayConsistent() {
        CropPolicy quad = CropPolicyEditor.apply(defaults, "percentRetain4", "5 10 15 20", 4).getPolicy();
        assertEquals(SideValues.of(5, 10, 15, 20), quad.getPercentRetain());
        assertEquals("N/A", CropPolicyEditor.describe(quad).get("percentRetain"));

        CropPolicy unchanged = CropPolicyEditor.apply(quad, "percentRetain", "N/A", 4).getPolicy();
        assertEquals(quad.getPercentRetain(), unchanged.getPercentRetain());

        CropPolicy single = CropPolicyEditor.apply(quad, "percentRetain", "7", 4).getPolicy();
        assertEquals(SideValues.all(7), single.getPercentRetain());
        assertEquals("7", CropPolicyEditor.describe(single).get("percentRetain"));
        assertArrayEquals(new double[]{7, 7, 7, 7}, (double[]) CropPolicyEditor.describe(single).get("percentRetain4"));
    }

    @Test
    void numericFieldsAreClamped() {
        CropPolicy policy = CropPolicyEditor.applyAll(defaults, Map.of(
                "threshold", "-4",
                "numBlurs", "-1",
                "pageRatioWeights", "1,-2,3,0",
                "uniformOrderStat", "9"), 4).getPolicy();

        assertEquals(0, policy.getThreshold());
        assertEquals(0, policy.getNumBlurs());
        assertEquals(SideValues.of(1, 0, 3, 0), policy.getPageRatioWeights());
        assertEquals(SideValues.all(3), policy.getUniformOrderStat());
    }

    @Test
    void parseErrorKeepsPreviousValue() {
        CropPolicy withRatio = CropPolicyEditor.apply(defaults, "setPageRatios", "4:3", 4).getPolicy();

        PolicyEdit edit = CropPolicyEditor.apply(withRatio, "setPageRatios", "4:x", 4);

        assertFalse(edit.isSuccess());
        assertSame(withRatio, edit.getPolicy());
        assertEquals("setPageRatios", edit.getError().getParameter());
        assertEquals(4.0 / 3.0, edit.getPolicy().getPageRatio().getRatio(), 1e-9);
    }

    @Test
    void pagesAndRatioCanBeCleared() {
        CropPolicy selected = CropPolicyEditor.apply(defaults, "pages", "1,3-4", 5).getPolicy();
        assertEquals(Set.of(0, 2, 3), selected.getPageSubset());
        assertEquals("1,3-4", CropPolicyEditor.describe(selected).get("pages"));

        CropPolicy cleared = CropPolicyEditor.applyAll(selected, Map.of("pages", "", "setPageRatios", ""), 5)
                .getPolicy();
        assertNull(cleared.getPageSubset());
        assertNull(cleared.getPageRatio());
    }

    @Test
    void booleanAndUnknownFields() {
        PolicyEdit on = CropPolicyEditor.apply(defaults, "cropSafe", "on", 4);
        PolicyEdit bad = CropPolicyEditor.apply(defaults, "evenodd", "maybe", 4);
        PolicyEdit unknown = CropPolicyEditor.apply(defaults, "gutter", "3", 4);

        assertTrue(on.getPolicy().isCropSafe());
        assertFalse(bad.isSuccess());
        assertEquals("gutter", unknown.getError().getParameter());
    }

    @Test
    void quadrupleNeedsFourValues() {
        PolicyEdit edit = CropPolicyEditor.apply(defaults, "absoluteOffset4", "1 2 3", 4);

        assertFalse(edit.isSuccess());
        assertEquals("absoluteOffset4", edit.getError().getParameter());
    }
}
