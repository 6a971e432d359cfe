/*
 * Copyright 2025 Justin Marsh
 * SPDX-License-Identifier: Apache-2.0
 */

package com.example.scopelog;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ScopeLogConfigTest {

    private Properties saved;

    @BeforeEach
    public void saveProperties() {
        saved = (Properties) System.getProperties().clone();
        System.clearProperty(ScopeLogConfig.PROP_OUTPUT_FILE);
        System.clearProperty(ScopeLogConfig.PROP_OUTPUT_MAX_BYTES);
        System.clearProperty(ScopeLogConfig.PROP_DIAGNOSTICS_FILE);
        System.clearProperty(ScopeLogConfig.PROP_DIAGNOSTICS_MAX_BYTES);
        System.clearProperty(ScopeLogConfig.PROP_TO_FILE);
        System.clearProperty(ScopeLogConfig.PROP_TO_CONSOLE);
    }

    @AfterEach
    public void restoreProperties() {
        System.setProperties(saved);
    }

    @Test
    public void testDefaults() {
        ScopeLogConfig config = new ScopeLogConfig();

        assertThat(config.getOutputFile()).isEqualTo(Paths.get("output.log"));
        assertThat(config.getOutputMaxBytes()).isEqualTo(5L * 1024 * 1024);
        assertThat(config.getDiagnosticsFile()).isEqualTo(Paths.get("diagnostics.log"));
        assertThat(config.getDiagnosticsMaxBytes()).isEqualTo(2L * 1024 * 1024);
        assertThat(config.isLogToFile()).isTrue();
        assertThat(config.isLogToConsole()).isTrue();
    }

    @Test
    public void testFromSystemProperties_NothingSetGivesDefaults() {
        ScopeLogConfig config = ScopeLogConfig.fromSystemProperties();

        assertThat(config.getOutputFile()).isEqualTo(Paths.get(ScopeLogConfig.DEFAULT_OUTPUT_FILE));
        assertThat(config.getDiagnosticsMaxBytes()).isEqualTo(ScopeLogConfig.DEFAULT_DIAGNOSTICS_MAX_BYTES);
        assertThat(config.isLogToConsole()).isTrue();
    }

    @Test
    public void testFromSystemProperties_Overrides() {
        System.setProperty(ScopeLogConfig.PROP_OUTPUT_FILE, "logs/app.log");
        System.setProperty(ScopeLogConfig.PROP_OUTPUT_MAX_BYTES, "1000");
        System.setProperty(ScopeLogConfig.PROP_DIAGNOSTICS_FILE, "logs/trace.log");
        System.setProperty(ScopeLogConfig.PROP_DIAGNOSTICS_MAX_BYTES, "2000");
        System.setProperty(ScopeLogConfig.PROP_TO_FILE, "false");
        System.setProperty(ScopeLogConfig.PROP_TO_CONSOLE, " FALSE ");

        ScopeLogConfig config = ScopeLogConfig.fromSystemProperties();

        assertThat(config.getOutputFile()).isEqualTo(Paths.get("logs/app.log"));
        assertThat(config.getOutputMaxBytes()).isEqualTo(1000);
        assertThat(config.getDiagnosticsFile()).isEqualTo(Paths.get("logs/trace.log"));
        assertThat(config.getDiagnosticsMaxBytes()).isEqualTo(2000);
        assertThat(config.isLogToFile()).isFalse();
        assertThat(config.isLogToConsole()).isFalse();
    }

    @Test
    public void testFromSystemProperties_UnparseableSizeFallsBack() {
        System.setProperty(ScopeLogConfig.PROP_OUTPUT_MAX_BYTES, "lots");

        assertThat(ScopeLogConfig.fromSystemProperties().getOutputMaxBytes())
            .isEqualTo(ScopeLogConfig.DEFAULT_OUTPUT_MAX_BYTES);
    }

    @Test
    public void testSetters_Validate() {
        ScopeLogConfig config = new ScopeLogConfig();

        assertThatThrownBy(() -> config.setOutputMaxBytes(-1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> config.setDiagnosticsMaxBytes(-1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> config.setOutputFile((String) null)).isInstanceOf(NullPointerException.class);
        assertThat(config.setOutputMaxBytes(0).getOutputMaxBytes()).isZero();
    }
}
