package com.avtimeline.contract;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class EventKindTest {

    @Test
    @DisplayName("Every update kind names the attribute it writes")
    void everyUpdateKind_hasTargetAttribute() {
        for (EventKind kind : EventKind.values()) {
            if (kind.category() == EventCategory.ATTRIBUTE_UPDATE) {
                assertNotNull(kind.targetAttribute(), kind.name());
                assertNull(kind.targetStatus(), kind.name());
            } else {
                assertNotNull(kind.targetStatus(), kind.name());
                assertNull(kind.targetAttribute(), kind.name());
            }
        }
    }

    @Test
    void serviceEnded_isTheOnlyTermination() {
        assertEquals(EventCategory.TERMINATION, EventKind.SERVICE_ENDED.category());
        assertTrue(EventKind.SERVICE_TESTING.isLifecycleStart());
        assertTrue(EventKind.SERVICE_ANNOUNCED.isLifecycleStart());
        assertTrue(EventKind.SERVICE_CREATED.isLifecycleStart());
        assertFalse(EventKind.SERVICE_ENDED.isLifecycleStart());
    }

    @Test
    void lookup_isCaseInsensitiveAndKnowsAliases() {
        assertEquals(Optional.of(EventKind.FARES_POLICY_CHANGED), EventKind.lookup(" Fares_Policy_Changed "));
        assertEquals(Optional.of(EventKind.GEOMETRY_UPDATED), EventKind.lookup("Service Area Change"));
        assertEquals(Optional.empty(), EventKind.lookup("ride_count_reported"));
        assertEquals(Optional.empty(), EventKind.lookup(null));
    }
}
