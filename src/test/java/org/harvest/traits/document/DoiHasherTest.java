package org.harvest.traits.document;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import org.junit.jupiter.api.Test;

class DoiHasherTest {

    @Test
    void testHashIgnoresCaseAndWhitespace() {
        final String hash = DoiHasher.hash("10.1000/XYZ123");

        assertEquals(64, hash.length());
        assertEquals(hash, DoiHasher.hash("  10.1000/xyz123 "));
    }

    @Test
    void testNoDoiNoHash() {
        assertNull(DoiHasher.hash(null));
        assertNull(DoiHasher.hash(" "));
    }

    @Test
    void testDocumentComputesHash() {
        final TraitDocument document = new TraitDocument(1L, "paper.pdf", "text", "10.1000/abc");

        assertEquals(DoiHasher.hash("10.1000/abc"), document.getDoiHash());
        assertEquals(TraitDocument.STATUS_PENDING, document.getStatus());
    }
}
