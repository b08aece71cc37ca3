package com.ciaagent.providers;

import com.ciaagent.observability.MetricsConfig;
import com.ciaagent.shared.config.CiaConfig;
import com.ciaagent.shared.config.OAuthSettings;
import com.ciaagent.shared.config.ReliabilityConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ProviderChainTest {

    @TempDir
    Path tempDir;

    private CiaConfig config(String inline, String file) {
        return new CiaConfig(new ReliabilityConfig(1, false, 1_000, false), file, inline,
                OAuthSettings.defaults(), Map.of());
    }

    @Test
    void wrapsWithReliabilityOnlyWhenNoSchema() {
        var provider = ProviderChain.decorate(new FakeProvider(), config(null, null), new MetricsConfig());

        assertInstanceOf(ReliableProvider.class, provider);
        assertEquals("reliable-fake", provider.id());
    }

    @Test
    void addsSchemaEnforcementOutermost() {
        var provider = ProviderChain.decorate(new FakeProvider(),
                config("{\"type\":\"object\"}", null), new MetricsConfig());

        assertInstanceOf(SchemaValidatingProvider.class, provider);
        assertEquals("reliable-fake", provider.id());
    }

    @Test
    void missingSchemaFileIsAConfigError() {
        var missing = tempDir.resolve("nope.json").toString();

        var ex = assertThrows(UncheckedIOException.class,
                () -> ProviderChain.decorate(new FakeProvider(), config(null, missing), new MetricsConfig()));
        assertTrue(ex.getMessage().startsWith("Configuration error: schema"));
    }
}
