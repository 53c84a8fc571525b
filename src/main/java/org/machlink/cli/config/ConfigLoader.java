package org.machlink.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

import java.io.File;
import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Loads and checks the settings of the {@code machlink} command.
 * <p>
 * The settings file is looked up in this order: the {@code --config} option, the
 * {@code -Dconfig.file} property, then {@code config/machlink.conf} below the working
 * directory. System properties and environment variables override the file, which in
 * turn overrides {@code reference.conf}.
 * <p>
 * The resolver and timeout settings are checked before any command runs, so a typo in
 * the resolver order fails at startup rather than on the first import.
 */
public final class ConfigLoader {

    static final File DEFAULT_FILE = new File("config", "machlink.conf");

    private static final String RESOLVER = "machlink.resolver.";
    private static final Set<String> RESOLVER_NAMES = Set.of("filesystem", "virtual", "url");

    private ConfigLoader() {
    }

    /**
     * Locates, loads and validates the settings.
     *
     * @param explicitFile The file given with {@code --config}, or {@code null}.
     * @param report       Receives one line naming where the settings came from.
     * @return The resolved settings.
     * @throws IllegalArgumentException If a named settings file does not exist.
     * @throws ConfigException          If the settings cannot be parsed or hold invalid values.
     */
    public static Config resolve(final File explicitFile, final Consumer<String> report) {
        final File file = locate(explicitFile, report);
        return validate(file == null ? loadDefaults() : loadFromFile(file));
    }

    static File locate(final File explicitFile, final Consumer<String> report) {
        if (explicitFile != null) {
            requireExists(explicitFile, "--config");
            report.accept("Reading settings from " + explicitFile.getAbsolutePath() + " (--config)");
            return explicitFile;
        }
        final String property = System.getProperty("config.file");
        if (property != null && !property.isBlank()) {
            final File file = new File(property).getAbsoluteFile();
            requireExists(file, "-Dconfig.file");
            report.accept("Reading settings from " + file.getAbsolutePath() + " (-Dconfig.file)");
            return file;
        }
        if (DEFAULT_FILE.exists()) {
            report.accept("Reading settings from " + DEFAULT_FILE.getAbsolutePath());
            return DEFAULT_FILE;
        }
        report.accept("No " + DEFAULT_FILE.getPath() + " in the working directory, using built-in settings");
        return null;
    }

    static Config loadFromFile(final File file) {
        return layered(ConfigFactory.parseFile(file));
    }

    static Config loadDefaults() {
        return layered(ConfigFactory.empty());
    }

    // reference.conf stays unresolved until the end so its substitutions see overrides
    private static Config layered(final Config fileLayer) {
        return ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(fileLayer)
                .withFallback(ConfigFactory.defaultReferenceUnresolved())
                .resolve();
    }

    /**
     * Checks the resolver chain and the timeouts.
     *
     * @param config The resolved settings.
     * @return The same settings.
     * @throws ConfigException.BadValue If a value is outside its allowed range.
     */
    public static Config validate(final Config config) {
        final List<String> order = config.getStringList(RESOLVER + "order");
        if (order.isEmpty()) {
            throw new ConfigException.BadValue(RESOLVER + "order", "at least one resolver is required");
        }
        final Set<String> seen = new HashSet<>();
        for (String name : order) {
            if (!RESOLVER_NAMES.contains(name)) {
                throw new ConfigException.BadValue(RESOLVER + "order",
                        "unknown resolver '" + name + "', expected one of filesystem, virtual, url");
            }
            if (!seen.add(name)) {
                throw new ConfigException.BadValue(RESOLVER + "order", "resolver '" + name + "' is listed twice");
            }
        }
        for (String extension : config.getStringList(RESOLVER + "extensions")) {
            if (extension.length() < 2 || extension.charAt(0) != '.') {
                throw new ConfigException.BadValue(RESOLVER + "extensions",
                        "'" + extension + "' must start with a dot");
            }
        }
        if (config.getLong(RESOLVER + "url.cache.maximum-size") <= 0) {
            throw new ConfigException.BadValue(RESOLVER + "url.cache.maximum-size", "must be positive");
        }
        requirePositive(config, RESOLVER + "url.connect-timeout");
        requirePositive(config, "machlink.cli.load-timeout");
        return config;
    }

    private static void requirePositive(final Config config, final String path) {
        final Duration duration = config.getDuration(path);
        if (duration.isZero() || duration.isNegative()) {
            throw new ConfigException.BadValue(path, "must be a positive duration, was " + duration);
        }
    }

    private static void requireExists(final File file, final String origin) {
        if (!file.exists()) {
            throw new IllegalArgumentException(
                    "Settings file given with " + origin + " not found: " + file.getAbsolutePath());
        }
    }
}
