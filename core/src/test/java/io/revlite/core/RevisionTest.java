// file: core/src/test/java/io/revlite/core/RevisionTest.java
package io.revlite.core;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RevisionTest {

    private static final Address A = new Address("application/json", "of:doc-1");

    private static ObjectNode value(int n) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("n", n);
        return node;
    }

    @Test
    void states_follow_value_and_cause() {
        Revision unclaimed = Revision.unclaimed(A);
        Revision asserted = Revision.asserted(A, value(1), unclaimed.hash(), 3);
        Revision retracted = Revision.retracted(A, asserted.hash(), 4);

        assertEquals(RevisionState.UNCLAIMED, unclaimed.state());
        assertEquals(RevisionState.ASSERTED, asserted.state());
        assertEquals(RevisionState.RETRACTED, retracted.state());
        assertEquals(Revision.UNCONFIRMED, unclaimed.since());
    }

    @Test
    void value_without_cause_is_rejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new Revision(A.the(), A.of(), value(1), null, 1));
    }

    @Test
    void json_null_is_normalized_to_no_value() {
        Revision r = new Revision(A.the(), A.of(), JsonNodeFactory.instance.nullNode(), null, 1);
        assertNull(r.is());
        assertEquals(RevisionState.UNCLAIMED, r.state());
    }

    @Test
    void hash_ignores_since_and_field_order() {
        ObjectNode ab = JsonNodeFactory.instance.objectNode();
        ab.put("a", 1);
        ab.put("b", 2);
        ObjectNode ba = JsonNodeFactory.instance.objectNode();
        ba.put("b", 2);
        ba.put("a", 1);

        ContentHash cause = Revision.unclaimed(A).hash();
        Revision r1 = Revision.asserted(A, ab, cause, 1);
        Revision r2 = Revision.asserted(A, ba, cause, 99);

        assertEquals(r1.hash(), r2.hash());
        assertTrue(r1.hash().value().startsWith(ContentHash.PREFIX));
    }

    @Test
    void hash_distinguishes_retraction_from_unclaimed() {
        Revision unclaimed = Revision.unclaimed(A);
        Revision retracted = Revision.retracted(A, unclaimed.hash(), 2);
        assertNotEquals(unclaimed.hash(), retracted.hash());
    }

    @Test
    void address_key_round_trips_and_rejects_separator_in_entity() {
        assertEquals("of:doc-1/application/json", A.key());
        assertEquals(A, Address.fromKey(A.key()));
        assertThrows(IllegalArgumentException.class, () -> new Address("x", "a/b"));
    }
}
