package com.componenttrace.agent;

import com.componenttrace.core.config.TracerConfig;
import com.componenttrace.core.session.TracerSessions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class AgentBootstrapTest {

    @Test
    void parseArgsDefaults() {
        AgentBootstrap.AgentConfig config = AgentBootstrap.parseArgs(null);
        assertNotNull(config.outputPath());
        assertNull(config.namespace());
        assertNull(config.configPath());
        assertNull(config.componentType());
        assertTrue(config.record());
    }

    @Test
    void parseArgsBlankString() {
        AgentBootstrap.AgentConfig config = AgentBootstrap.parseArgs("   ");
        assertNull(config.componentType());
        assertTrue(config.record());
    }

    @Test
    void parseArgsOutput() {
        AgentBootstrap.AgentConfig config = AgentBootstrap.parseArgs("output=/tmp/trace");
        assertEquals("/tmp/trace", config.outputPath());
    }

    @Test
    void parseArgsHostTypes() {
        AgentBootstrap.AgentConfig config = AgentBootstrap.parseArgs(
            "component_type=org.host.Component, renderer_type = org.host.Renderer");
        assertEquals("org.host.Component", config.componentType());
        assertEquals("org.host.Renderer", config.rendererType());
    }

    @Test
    void parseArgsAll() {
        AgentBootstrap.AgentConfig config = AgentBootstrap.parseArgs(
            "output=/tmp,namespace=com.example,config=/etc/tracer.json,component_type=a.B,renderer_type=a.R,record=false");
        assertEquals("/tmp", config.outputPath());
        assertEquals("com.example", config.namespace());
        assertEquals("/etc/tracer.json", config.configPath());
        assertEquals("a.B", config.componentType());
        assertEquals("a.R", config.rendererType());
        assertFalse(config.record());
    }

    @Test
    void parseArgsIgnoresUnknownAndMalformedParts() {
        AgentBootstrap.AgentConfig config = AgentBootstrap.parseArgs("colour=blue,novalue,namespace=com.x");
        assertEquals("com.x", config.namespace());
    }

    // --- Config loading ---

    @Test
    void loadConfigReadsFileAndAppliesNamespaceOverride(@TempDir Path tmp) throws Exception {
        Path file = tmp.resolve("component-tracer.json");
        Files.writeString(file, """
            {
              "enhanced_namespace": "com.from.file",
              "max_events": 700
            }
            """);

        TracerConfig fromFile = AgentBootstrap.loadConfig(AgentBootstrap.parseArgs("config=" + file));
        assertEquals("com.from.file", fromFile.getEnhancedNamespace());
        assertEquals(700, fromFile.getMaxEvents());

        TracerConfig overridden = AgentBootstrap.loadConfig(
            AgentBootstrap.parseArgs("config=" + file + ",namespace=com.from.args"));
        assertEquals("com.from.args", overridden.getEnhancedNamespace());
        assertEquals(700, overridden.getMaxEvents());
    }

    @Test
    void loadConfigFallsBackToDefaultsWhenFileMissing(@TempDir Path tmp) {
        TracerConfig config = AgentBootstrap.loadConfig(
            AgentBootstrap.parseArgs("config=" + tmp.resolve("absent.json")));
        assertEquals(TracerConfig.defaults().getMaxEvents(), config.getMaxEvents());
    }

    @Test
    void loadConfigFallsBackToDefaultsWhenFileMalformed(@TempDir Path tmp) throws Exception {
        Path file = tmp.resolve("broken.json");
        Files.writeString(file, "{ not json");
        TracerConfig config = AgentBootstrap.loadConfig(AgentBootstrap.parseArgs("config=" + file));
        assertTrue(config.isTimingEnabled());
    }

    @Test
    void createSessionsSizesRecorderFromConfig(@TempDir Path tmp) throws Exception {
        Path file = tmp.resolve("tracer.json");
        Files.writeString(file, "{\"max_events\": 250}");
        TracerConfig config = AgentBootstrap.loadConfig(AgentBootstrap.parseArgs("config=" + file));

        try (TracerSessions sessions = AgentBootstrap.createSessions(config, HostBinding.defaults(null, null))) {
            assertEquals(250, sessions.recorder().maxEvents());
            assertFalse(sessions.recorder().isRecording());
        }
    }
}
