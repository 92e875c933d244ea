package org.flowxmi.activity.conversion.graph;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GuardLabelsTest {

    @Test
    void shouldMapAffirmativeSpellingsToYes() {
        assertEquals("yes", GuardLabels.normalize("Yes"));
        assertEquals("yes", GuardLabels.normalize("[true]"));
        assertEquals("yes", GuardLabels.normalize("(tak)"));
        assertEquals("yes", GuardLabels.normalize("[amount is true]"));
        assertEquals("yes", GuardLabels.normalize("yes?"));
    }

    @Test
    void shouldMapNegativeSpellingsToNo() {
        assertEquals("no", GuardLabels.normalize("NO"));
        assertEquals("no", GuardLabels.normalize("[(false)]"));
        assertEquals("no", GuardLabels.normalize("nie"));
        assertEquals("no", GuardLabels.normalize("stock is false"));
    }

    @Test
    void shouldKeepOtherGuardsUnbracketed() {
        assertEquals("amount > 100", GuardLabels.normalize(" [amount > 100] "));
    }

    @Test
    void shouldTreatBlankGuardAsAbsent() {
        assertNull(GuardLabels.normalize(null));
        assertNull(GuardLabels.normalize("  "));
        assertNull(GuardLabels.normalize("[]"));
    }
}
