package org.machlink.compiler.frontend.module.resolve;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the configured resolver chain from the {@code machlink.resolver} section.
 */
public final class ModuleResolvers {

    private static final String PREFIX = "machlink.resolver.";

    private ModuleResolvers() {
    }

    /**
     * Creates a composite resolver with a logging {@link ResolutionListener}.
     *
     * @param config     The resolved application config.
     * @param fileSystem The virtual filesystem for {@code virtual} entries of the order list.
     * @return The composite resolver, in the configured order.
     * @throws ConfigException.BadValue If the order list names an unknown resolver.
     */
    public static CompositeModuleResolver fromConfig(Config config, VirtualFileSystem fileSystem) {
        return fromConfig(config, fileSystem, ResolutionListener.logging());
    }

    public static CompositeModuleResolver fromConfig(Config config, VirtualFileSystem fileSystem,
                                                     ResolutionListener listener) {
        List<String> extensions = config.getStringList(PREFIX + "extensions");
        List<ModuleResolver> resolvers = new ArrayList<>();
        for (String name : config.getStringList(PREFIX + "order")) {
            switch (name) {
                case "filesystem" -> resolvers.add(new FileSystemResolver(extensions, listener));
                case "virtual" -> resolvers.add(new VirtualFsResolver(fileSystem, extensions, listener));
                case "url" -> resolvers.add(new UrlResolver(createFetcher(config), createCache(config), listener));
                default -> throw new ConfigException.BadValue(PREFIX + "order", "Unknown resolver '" + name + "'");
            }
        }
        return new CompositeModuleResolver(resolvers);
    }

    public static UrlFetcher createFetcher(Config config) {
        Duration connectTimeout = config.getDuration(PREFIX + "url.connect-timeout");
        boolean followRedirects = config.getBoolean(PREFIX + "url.follow-redirects");
        return new HttpUrlFetcher(connectTimeout, followRedirects);
    }

    public static ModuleCache createCache(Config config) {
        return new ModuleCache(config.getLong(PREFIX + "url.cache.maximum-size"));
    }
}
