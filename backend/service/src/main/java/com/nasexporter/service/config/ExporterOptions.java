package com.nasexporter.service.config;

import joptsimple.ArgumentAcceptingOptionSpec;
import joptsimple.BuiltinHelpFormatter;
import joptsimple.OptionException;
import joptsimple.OptionParser;
import joptsimple.OptionSet;
import joptsimple.OptionSpec;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The exporter's command-line options. Every value option is also read from an environment
 * variable and from the JSON config file; see {@link ConfigLoader} for the precedence.
 */
public final class ExporterOptions {
    private final OptionParser parser = new OptionParser(false);
    private final Map<String, ArgumentAcceptingOptionSpec<String>> byFlag = new LinkedHashMap<>();
    private final Map<OptionSpec<String>, String> envVars = new HashMap<>();
    private final Set<OptionSpec<String>> required = new HashSet<>();

    final OptionSpec<Void> help = parser.acceptsAll(List.of("h", "help"), "Show this help.").forHelp();
    final OptionSpec<Void> version = parser.accepts("version", "Show application version.");

    final ArgumentAcceptingOptionSpec<String> listenAddress = value("web.listen-address", "WEB_LISTEN_ADDRESS",
            "Address on which to expose metrics and web interface.", ":9123");
    final ArgumentAcceptingOptionSpec<String> telemetryPath = value("web.telemetry-path", "WEB_TELEMETRY_PATH",
            "Path under which to expose metrics.", "/metrics");
    final ArgumentAcceptingOptionSpec<String> disableExporterMetrics = toggle("web.disable-exporter-metrics",
            "WEB_DISABLE_EXPORTER_METRICS",
            "Exclude metrics about the exporter itself (JVM, process and HTTP handler metrics).");
    final ArgumentAcceptingOptionSpec<String> maxRequests = value("web.max-requests", "WEB_MAX_REQUESTS",
            "Maximum number of parallel scrape requests. Use 0 to disable.", "40");
    final ArgumentAcceptingOptionSpec<String> nasInstanceId = requiredValue("nifcloud.nas-instance-id",
            "NIFCLOUD_NAS_INSTANCE_ID", "Target NAS instance identifier.");
    final ArgumentAcceptingOptionSpec<String> region = value("nifcloud.region", "NIFCLOUD_REGION",
            "NIFCLOUD region name that target instance exists.", "jp-east-1");
    final ArgumentAcceptingOptionSpec<String> accessKeyId = requiredValue("nifcloud.access-key-id",
            "NIFCLOUD_ACCESS_KEY_ID", "NIFCLOUD Access Key ID to fetch the metrics.");
    final ArgumentAcceptingOptionSpec<String> secretAccessKey = requiredValue("nifcloud.secret-access-key",
            "NIFCLOUD_SECRET_ACCESS_KEY", "NIFCLOUD Secret Access Key to fetch the metrics.");
    final ArgumentAcceptingOptionSpec<String> endpoint = value("nifcloud.endpoint", "NIFCLOUD_ENDPOINT",
            "Override the NAS API endpoint. Defaults to https://nas.<region>.api.nifcloud.com/.", null);
    final ArgumentAcceptingOptionSpec<String> apiVersion = value("nifcloud.api-version", "NIFCLOUD_API_VERSION",
            "NAS API version sent with each request.", "N2016-02-24");
    final ArgumentAcceptingOptionSpec<String> requestTimeout = value("nifcloud.request-timeout",
            "NIFCLOUD_REQUEST_TIMEOUT", "Timeout for a single statistics request.", "60s");
    final ArgumentAcceptingOptionSpec<String> window = value("nifcloud.window", "NIFCLOUD_WINDOW",
            "Trailing query window; must cover at least one published datapoint.", "180s");
    final ArgumentAcceptingOptionSpec<String> logLevel = value("log.level", "LOG_LEVEL",
            "Only log messages with the given severity or above. One of: [debug, info, warn, error].", "info");
    final ArgumentAcceptingOptionSpec<String> configFile = value("config.file", "CONFIG_FILE",
            "Optional JSON file with option values keyed by flag name.", null);

    public ExporterOptions() {
        parser.formatHelpWith(new BuiltinHelpFormatter(120, 2));
    }

    public CommandLine parse(String... args) {
        OptionSet set;
        try {
            set = parser.parse(args);
        } catch (OptionException e) {
            throw new IllegalArgumentException(e.getMessage(), e);
        }
        if (!set.nonOptionArguments().isEmpty()) {
            throw new IllegalArgumentException("unexpected argument " + set.nonOptionArguments().get(0));
        }
        return new CommandLine(this, set);
    }

    public String usage() {
        StringWriter out = new StringWriter();
        out.write("usage: nifcloud_nas_exporter [<flags>]\n\n");
        try {
            parser.printHelpOn(out);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toString();
    }

    List<ArgumentAcceptingOptionSpec<String>> valueOptions() {
        return new ArrayList<>(byFlag.values());
    }

    Optional<ArgumentAcceptingOptionSpec<String>> byFlag(String flag) {
        return Optional.ofNullable(byFlag.get(flag));
    }

    String flag(OptionSpec<String> spec) {
        return spec.options().iterator().next();
    }

    String envVar(OptionSpec<String> spec) {
        return envVars.get(spec);
    }

    boolean isRequired(OptionSpec<String> spec) {
        return required.contains(spec);
    }

    private ArgumentAcceptingOptionSpec<String> value(String flag, String envVar, String description, String defaultValue) {
        ArgumentAcceptingOptionSpec<String> spec = parser.accepts(flag, description + " [$" + envVar + "]")
                .withRequiredArg()
                .describedAs("value")
                .ofType(String.class);
        if (defaultValue != null) {
            spec.defaultsTo(defaultValue);
        }
        return register(flag, envVar, spec);
    }

    private ArgumentAcceptingOptionSpec<String> requiredValue(String flag, String envVar, String description) {
        ArgumentAcceptingOptionSpec<String> spec = value(flag, envVar, description + " (required)", null);
        required.add(spec);
        return spec;
    }

    // A bare toggle means true; --flag=false is also accepted.
    private ArgumentAcceptingOptionSpec<String> toggle(String flag, String envVar, String description) {
        ArgumentAcceptingOptionSpec<String> spec = parser.accepts(flag, description + " [$" + envVar + "]")
                .withOptionalArg()
                .describedAs("true|false")
                .ofType(String.class)
                .defaultsTo("false");
        return register(flag, envVar, spec);
    }

    private ArgumentAcceptingOptionSpec<String> register(String flag, String envVar,
                                                        ArgumentAcceptingOptionSpec<String> spec) {
        byFlag.put(flag, spec);
        envVars.put(spec, envVar);
        return spec;
    }
}
