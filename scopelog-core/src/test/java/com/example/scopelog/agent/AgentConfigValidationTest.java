/*
 * Copyright 2025 Justin Marsh
 * SPDX-License-Identifier: Apache-2.0
 */

package com.example.scopelog.agent;

import net.bytebuddy.description.type.TypeDescription;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

/**
 * Unit tests for AgentConfig parsing and validation.
 * Tests that malformed patterns are rejected with clear error messages.
 */
public class AgentConfigValidationTest {

    @Test(expected = IllegalArgumentException.class)
    public void testEmptyIncludePattern() {
        AgentConfig.parse("include=");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEmptyPatternInList() {
        AgentConfig.parse("include=com.example.*,,org.foo.*");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testTrailingComma() {
        AgentConfig.parse("include=com.example.*,");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testConsecutiveDots() {
        AgentConfig.parse("include=com..example.*");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testGlobalWildcardJustStar() {
        // Would trace every class in the JVM
        AgentConfig.parse("include=*");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testGlobalWildcardDotStar() {
        AgentConfig.parse("include=.*");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testPatternEndingWithJustDot() {
        AgentConfig.parse("include=com.example.");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testDoubleWildcard() {
        AgentConfig.parse("include=com.example.**");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testExcludeEmptyPattern() {
        AgentConfig.parse("exclude=");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testExcludeConsecutiveDots() {
        AgentConfig.parse("exclude=com..example.*");
    }

    @Test
    public void testDefaults() {
        AgentConfig config = AgentConfig.parse(null);

        assertEquals(3, config.getIncludePatterns().size());
        assertTrue(config.getIncludePatterns().contains("com.*"));
        assertTrue(config.getExcludePatterns().isEmpty());
        assertTrue(config.isAnnotatedOnly());
    }

    @Test
    public void testValidConfig() {
        AgentConfig config = AgentConfig.parse(
            "include=com.acme.*, com.other.Service ;exclude=com.acme.generated.*;annotatedOnly=false");

        assertEquals(2, config.getIncludePatterns().size());
        assertTrue(config.getIncludePatterns().contains("com.other.Service"));
        assertTrue(config.getExcludePatterns().contains("com.acme.generated.*"));
        assertFalse(config.isAnnotatedOnly());
    }

    @Test
    public void testUnknownKeysIgnored() {
        AgentConfig config = AgentConfig.parse("verbose=true;include=com.acme.*");

        assertEquals(1, config.getIncludePatterns().size());
    }

    @Test
    public void testTypeMatcher_ExclusionsWin() {
        AgentConfig config = AgentConfig.parse(
            "include=com.example.scopelog.*;exclude=com.example.scopelog.agent.*,com.example.scopelog.ScopeLog");

        assertTrue(config.getTypeMatcher().matches(TypeDescription.ForLoadedType.of(
            com.example.scopelog.ScopeLogConfig.class)));
        assertFalse(config.getTypeMatcher().matches(TypeDescription.ForLoadedType.of(
            com.example.scopelog.ScopeLog.class)));
        assertFalse(config.getTypeMatcher().matches(TypeDescription.ForLoadedType.of(
            ScopeTraceAgent.class)));
        assertFalse(config.getTypeMatcher().matches(TypeDescription.ForLoadedType.of(String.class)));
    }
}
