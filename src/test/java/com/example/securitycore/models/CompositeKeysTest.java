package com.example.securitycore.models;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class CompositeKeysTest {

    @Test
    @DisplayName("Plain parts are joined unchanged")
    void plainParts() {
        assertEquals("DATA#SSN#tenant-a", CompositeKeys.join("DATA", "SSN", "tenant-a"));
    }

    @Test
    @DisplayName("Separators inside parts cannot make two part lists collide")
    void separatorsEscaped() {
        assertNotEquals(CompositeKeys.join("A#B", "C"), CompositeKeys.join("A", "B#C"));
        assertNotEquals(CompositeKeys.join("a|b", "c"), CompositeKeys.join("a", "b|c"));
        assertNotEquals(CompositeKeys.join("a%23", "b"), CompositeKeys.join("a#", "b"));
        assertEquals("A%23B#C", CompositeKeys.join("A#B", "C"));
    }

    @Test
    @DisplayName("Scope ids and user keys go through the same escaping")
    void usedByScopesAndSessions() {
        assertNotEquals(KeyScope.data("A#B", "C").id(), KeyScope.data("A", "B#C").id());
        assertNotEquals(Session.userKey("a|b", "c"), Session.userKey("a", "b|c"));
    }
}
