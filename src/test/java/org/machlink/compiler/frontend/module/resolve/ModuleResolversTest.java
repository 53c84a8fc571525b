package org.machlink.compiler.frontend.module.resolve;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class ModuleResolversTest {

    @Test
    void defaultOrderFromReferenceConfig() {
        CompositeModuleResolver composite = ModuleResolvers.fromConfig(ConfigFactory.load(), new VirtualFileSystem());

        assertThat(composite.getResolvers())
                .extracting(r -> r.getClass().getSimpleName())
                .containsExactly("FileSystemResolver", "VirtualFsResolver", "UrlResolver");
    }

    @Test
    void orderIsConfigurable() {
        Config config = ConfigFactory.parseString("machlink.resolver.order = [url, virtual]")
                .withFallback(ConfigFactory.load());

        assertThat(ModuleResolvers.fromConfig(config, new VirtualFileSystem()).getResolvers())
                .extracting(r -> r.getClass().getSimpleName())
                .containsExactly("UrlResolver", "VirtualFsResolver");
    }

    @Test
    void unknownResolverIsRejected() {
        Config config = ConfigFactory.parseString("machlink.resolver.order = [ftp]")
                .withFallback(ConfigFactory.load());

        assertThatThrownBy(() -> ModuleResolvers.fromConfig(config, new VirtualFileSystem()))
                .isInstanceOf(ConfigException.BadValue.class)
                .hasMessageContaining("ftp");
    }
}
