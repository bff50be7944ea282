package com.nasexporter.service.config;

import joptsimple.OptionSet;
import joptsimple.OptionSpec;

import java.util.Optional;

/**
 * Options given explicitly on the command line. Defaults are applied later by
 * {@link ConfigLoader}, after the environment and the config file.
 */
public final class CommandLine {
    private final ExporterOptions options;
    private final OptionSet set;

    CommandLine(ExporterOptions options, OptionSet set) {
        this.options = options;
        this.set = set;
    }

    public static CommandLine parse(String... args) {
        return new ExporterOptions().parse(args);
    }

    public ExporterOptions options() {
        return options;
    }

    public Optional<String> value(OptionSpec<String> spec) {
        if (!set.has(spec)) {
            return Optional.empty();
        }
        if (!set.hasArgument(spec)) {
            return Optional.of("true");
        }
        return Optional.of(set.valueOf(spec));
    }

    public boolean helpRequested() {
        return set.has(options.help);
    }

    public boolean versionRequested() {
        return set.has(options.version);
    }
}
