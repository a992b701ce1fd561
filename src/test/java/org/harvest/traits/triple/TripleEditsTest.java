package org.harvest.traits.triple;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class TripleEditsTest {

    @Test
    void testOnlyProvidedFieldsChange() {
        final ExtractedTriple triple = new ExtractedTriple();
        triple.setSourceEntityName("FLC");
        triple.setRelationType("regulates");
        triple.setSinkEntityName("flowering time");

        new TripleEdits(null, null, "represses", null, null, null, "late", "days").applyTo(triple);

        assertEquals("FLC", triple.getSourceEntityName());
        assertEquals("represses", triple.getRelationType());
        assertEquals("flowering time", triple.getSinkEntityName());
        assertEquals("late", triple.getTraitValue());
        assertEquals("days", triple.getUnit());
    }

    @Test
    void testEmptiness() {
        assertTrue(TripleEdits.none().isEmpty());
        assertFalse(new TripleEdits(null, null, null, null, null, "height", null, null).isEmpty());
    }
}
