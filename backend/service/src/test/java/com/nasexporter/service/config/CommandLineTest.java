package com.nasexporter.service.config;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CommandLineTest {
    private final ExporterOptions options = new ExporterOptions();

    @Test
    void acceptsEqualsAndSeparateValueForms() {
        CommandLine commandLine = options.parse(
                "--nifcloud.nas-instance-id=nas001",
                "--nifcloud.region", "east-1"
        );

        assertEquals(Optional.of("nas001"), commandLine.value(options.nasInstanceId));
        assertEquals(Optional.of("east-1"), commandLine.value(options.region));
        assertEquals(Optional.empty(), commandLine.value(options.endpoint));
        assertFalse(commandLine.helpRequested());
        assertFalse(commandLine.versionRequested());
    }

    @Test
    void defaultsAreNotReportedAsExplicitValues() {
        CommandLine commandLine = options.parse();

        assertEquals(Optional.empty(), commandLine.value(options.listenAddress));
        assertEquals(Optional.empty(), commandLine.value(options.disableExporterMetrics));
    }

    @Test
    void bareToggleMeansTrue() {
        CommandLine bare = options.parse("--web.disable-exporter-metrics", "--log.level=debug");
        CommandLine explicit = options.parse("--web.disable-exporter-metrics=false");

        assertEquals(Optional.of("true"), bare.value(options.disableExporterMetrics));
        assertEquals(Optional.of("debug"), bare.value(options.logLevel));
        assertEquals(Optional.of("false"), explicit.value(options.disableExporterMetrics));
    }

    @Test
    void recognisesHelpAndVersion() {
        assertTrue(options.parse("-h").helpRequested());
        assertTrue(options.parse("--help").helpRequested());
        assertTrue(options.parse("--version").versionRequested());
    }

    @Test
    void rejectsUnknownFlagsAbbreviationsAndMissingValues() {
        IllegalArgumentException unknown = assertThrows(IllegalArgumentException.class,
                () -> options.parse("--no.such-flag=1"));
        assertTrue(unknown.getMessage().contains("no.such-flag"));

        assertThrows(IllegalArgumentException.class, () -> options.parse("--nifcloud.reg=east-1"));
        assertThrows(IllegalArgumentException.class, () -> options.parse("--nifcloud.region"));
        assertThrows(IllegalArgumentException.class, () -> options.parse("positional"));
    }

    @Test
    void usageListsEveryFlagWithEnvironmentVariableAndDefault() {
        String usage = options.usage();

        for (var option : options.valueOptions()) {
            assertTrue(usage.contains("--" + options.flag(option)), options.flag(option));
            assertTrue(usage.contains("$" + options.envVar(option)), options.envVar(option));
        }
        assertTrue(usage.contains("--help"));
        assertTrue(usage.contains(":9123"));
        assertTrue(usage.contains("(required)"));
    }

    @Test
    void requiredOptionsAreDeclared() {
        assertTrue(options.isRequired(options.nasInstanceId));
        assertTrue(options.isRequired(options.accessKeyId));
        assertTrue(options.isRequired(options.secretAccessKey));
        assertFalse(options.isRequired(options.region));
    }
}
