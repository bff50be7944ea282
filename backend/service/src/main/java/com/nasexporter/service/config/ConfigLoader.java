package com.nasexporter.service.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.nasexporter.collectors.config.NasApiConfig;
import com.nasexporter.core.model.Credentials;
import com.nasexporter.core.model.TargetInstance;
import com.nasexporter.core.util.JsonUtils;
import joptsimple.ArgumentAcceptingOptionSpec;
import joptsimple.OptionSpec;

import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Level;

/**
 * Resolves {@link ExporterConfig} from the command line, then the environment, then the optional
 * JSON config file, then the option defaults.
 */
public final class ConfigLoader {
    private ConfigLoader() {
    }

    public static ExporterConfig load(CommandLine commandLine, Map<String, String> env) {
        ExporterOptions options = commandLine.options();
        Map<OptionSpec<String>, String> fileValues = resolve(commandLine, env, Map.of(), options.configFile)
                .map(path -> readConfigFile(options, Path.of(path)))
                .orElse(Map.of());
        Resolver resolver = new Resolver(commandLine, env, fileValues);
        for (ArgumentAcceptingOptionSpec<String> option : options.valueOptions()) {
            if (options.isRequired(option)) {
                resolver.required(option);
            }
        }

        TargetInstance target = new TargetInstance(
                resolver.required(options.nasInstanceId),
                resolver.required(options.region)
        );
        Credentials credentials = new Credentials(
                resolver.required(options.accessKeyId),
                resolver.required(options.secretAccessKey)
        );
        NasApiConfig api = new NasApiConfig(
                credentials,
                resolver.optional(options.endpoint).map(ConfigLoader::parseEndpoint).orElse(null),
                resolver.required(options.apiVersion),
                parseDuration(options.flag(options.window), resolver.required(options.window)),
                parseDuration(options.flag(options.requestTimeout), resolver.required(options.requestTimeout))
        );

        return new ExporterConfig(
                parseListenAddress(resolver.required(options.listenAddress)),
                resolver.required(options.telemetryPath),
                !parseBoolean(options.flag(options.disableExporterMetrics),
                        resolver.required(options.disableExporterMetrics)),
                parseInt(options.flag(options.maxRequests), resolver.required(options.maxRequests)),
                target,
                api,
                parseLogLevel(resolver.required(options.logLevel)),
                trustStoreFromEnvironment(env)
        );
    }

    static Map<OptionSpec<String>, String> readConfigFile(ExporterOptions options, Path path) {
        JsonNode root = JsonUtils.readObject(path);
        Map<OptionSpec<String>, String> values = new HashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            OptionSpec<String> option = options.byFlag(field.getKey())
                    .filter(candidate -> !candidate.equals(options.configFile))
                    .orElseThrow(() -> new IllegalArgumentException(
                            "unknown option '" + field.getKey() + "' in " + path));
            JsonNode value = field.getValue();
            if (!value.isValueNode() || value.isNull()) {
                throw new IllegalArgumentException("option '" + field.getKey() + "' in " + path + " must be a scalar");
            }
            values.put(option, value.asText());
        }
        return values;
    }

    static InetSocketAddress parseListenAddress(String raw) {
        int colon = raw.lastIndexOf(':');
        if (colon < 0) {
            throw new IllegalArgumentException("web.listen-address must be host:port or :port, got " + raw);
        }
        String host = raw.substring(0, colon);
        int port = parseInt("web.listen-address", raw.substring(colon + 1));
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("web.listen-address has an invalid port: " + raw);
        }
        if (host.startsWith("[") && host.endsWith("]")) {
            host = host.substring(1, host.length() - 1);
        }
        return host.isEmpty() ? new InetSocketAddress(port) : new InetSocketAddress(host, port);
    }

    static Duration parseDuration(String flag, String raw) {
        String value = raw.trim().toLowerCase(Locale.ROOT);
        try {
            if (value.startsWith("p")) {
                return Duration.parse(raw.trim());
            }
            if (value.endsWith("ms")) {
                return Duration.ofMillis(Long.parseLong(value.substring(0, value.length() - 2)));
            }
            if (value.endsWith("s")) {
                return Duration.ofSeconds(Long.parseLong(value.substring(0, value.length() - 1)));
            }
            if (value.endsWith("m")) {
                return Duration.ofMinutes(Long.parseLong(value.substring(0, value.length() - 1)));
            }
            if (value.endsWith("h")) {
                return Duration.ofHours(Long.parseLong(value.substring(0, value.length() - 1)));
            }
        } catch (NumberFormatException | DateTimeParseException e) {
            throw new IllegalArgumentException(flag + " is not a valid duration: " + raw, e);
        }
        throw new IllegalArgumentException(flag + " is not a valid duration: " + raw);
    }

    static Level parseLogLevel(String raw) {
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "debug" -> Level.FINE;
            case "info" -> Level.INFO;
            case "warn" -> Level.WARNING;
            case "error" -> Level.SEVERE;
            default -> throw new IllegalArgumentException("log.level must be one of debug, info, warn, error: " + raw);
        };
    }

    private static URI parseEndpoint(String raw) {
        try {
            URI uri = URI.create(raw);
            if (uri.getScheme() == null || uri.getHost() == null) {
                throw new IllegalArgumentException("nifcloud.endpoint must be an absolute URL: " + raw);
            }
            return uri;
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("nifcloud.endpoint must be an absolute URL: " + raw, e);
        }
    }

    private static boolean parseBoolean(String flag, String raw) {
        if ("true".equalsIgnoreCase(raw)) {
            return true;
        }
        if ("false".equalsIgnoreCase(raw)) {
            return false;
        }
        throw new IllegalArgumentException(flag + " must be true or false: " + raw);
    }

    private static int parseInt(String flag, String raw) {
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(flag + " must be an integer: " + raw, e);
        }
    }

    private static TrustStoreConfig trustStoreFromEnvironment(Map<String, String> env) {
        String path = env.get("TRUSTSTORE_PATH");
        if (path == null || path.isBlank()) {
            return null;
        }
        String password = env.get("TRUSTSTORE_PASSWORD");
        if (password == null) {
            throw new IllegalStateException("TRUSTSTORE_PASSWORD must be set when TRUSTSTORE_PATH is configured");
        }
        return new TrustStoreConfig(Path.of(path), password);
    }

    private static Optional<String> resolve(
            CommandLine commandLine,
            Map<String, String> env,
            Map<OptionSpec<String>, String> fileValues,
            ArgumentAcceptingOptionSpec<String> option
    ) {
        Optional<String> fromCommandLine = commandLine.value(option);
        if (fromCommandLine.isPresent()) {
            return fromCommandLine;
        }
        String fromEnv = env.get(commandLine.options().envVar(option));
        if (fromEnv != null && !fromEnv.isBlank()) {
            return Optional.of(fromEnv);
        }
        String fromFile = fileValues.get(option);
        if (fromFile != null) {
            return Optional.of(fromFile);
        }
        return option.defaultValues().stream().findFirst().map(Object::toString);
    }

    private record Resolver(CommandLine commandLine, Map<String, String> env, Map<OptionSpec<String>, String> fileValues) {
        Optional<String> optional(ArgumentAcceptingOptionSpec<String> option) {
            return resolve(commandLine, env, fileValues, option);
        }

        String required(ArgumentAcceptingOptionSpec<String> option) {
            ExporterOptions options = commandLine.options();
            return optional(option).orElseThrow(() -> new IllegalArgumentException(
                    "required flag --" + options.flag(option) + " not provided (or set $" + options.envVar(option) + ")"));
        }
    }
}
