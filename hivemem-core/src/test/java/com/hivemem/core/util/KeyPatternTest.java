/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 *
 * Legal Notice: This module and the associated software architecture are proprietary
 * and confidential. Unauthorized copying, distribution, modification, or use is
 * strictly prohibited without explicit written permission from the copyright holder.
 *
 * Patent Pending: Certain architectural patterns and implementations described in
 * this module may be subject to patent applications.
 */
package com.hivemem.core.util;

import com.hivemem.core.exception.ValidationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class KeyPatternTest {

    @Test
    void starMatchesEverything() {
        KeyPattern pattern = KeyPattern.compile("*");
        assertSame(KeyPattern.ALL, pattern);
        assertTrue(pattern.matches("anything:at:all"));
        assertTrue(KeyPattern.compile(null).matches("x"));
    }

    @Test
    void plainStringIsLiteral() {
        KeyPattern pattern = KeyPattern.compile("agent.1");
        assertEquals(KeyPattern.Kind.LITERAL, pattern.getKind());
        assertTrue(pattern.matches("agent.1"));
        assertFalse(pattern.matches("agentX1"));
        assertFalse(pattern.matches("agent.10"));
    }

    @Test
    void globMatchesWholeKey() {
        KeyPattern pattern = KeyPattern.compile("agent:*:ctx");
        assertEquals(KeyPattern.Kind.GLOB, pattern.getKind());
        assertTrue(pattern.matches("agent:1:ctx"));
        assertTrue(pattern.matches("agent::ctx"));
        assertFalse(pattern.matches("agent:1:ctx:old"));
        assertFalse(pattern.matches("xagent:1:ctx"));

        KeyPattern single = KeyPattern.compile("job.?");
        assertTrue(single.matches("job.1"));
        assertFalse(single.matches("jobx1"));
        assertFalse(single.matches("job.12"));
    }

    @Test
    void regexUsesFindSemantics() {
        KeyPattern pattern = KeyPattern.compile("^task:(a|b)");
        assertEquals(KeyPattern.Kind.REGEX, pattern.getKind());
        assertTrue(pattern.matches("task:a:1"));
        assertTrue(pattern.matches("task:b"));
        assertFalse(pattern.matches("task:c"));

        assertTrue(KeyPattern.compile("[0-9]+$").matches("counter42"));
    }

    @Test
    void invalidRegexIsRejected() {
        assertThrows(ValidationException.class, () -> KeyPattern.compile("task:(unclosed"));
    }
}
