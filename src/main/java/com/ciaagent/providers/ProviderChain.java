package com.ciaagent.providers;

import com.ciaagent.observability.MetricsConfig;
import com.ciaagent.shared.config.CiaConfig;
import com.ciaagent.shared.errors.CommonErrors;
import com.ciaagent.shared.validation.SchemaValidator;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Stacks the decorators over a base provider: retries innermost, schema
 * enforcement outermost so that each schema retry gets the full retry policy.
 */
public final class ProviderChain {

    private ProviderChain() {}

    public static ModelProvider decorate(ModelProvider base, CiaConfig config, MetricsConfig metrics) {
        var reliability = config.reliability();
        ModelProvider provider = new ReliableProvider(base, reliability, metrics);
        var schema = loadSchema(config);
        if (schema != null) {
            provider = new SchemaValidatingProvider(provider, schema, reliability.retries(),
                    reliability.backoff(), reliability.retryTimeoutMs());
        }
        return provider;
    }

    static JsonNode loadSchema(CiaConfig config) {
        try {
            return SchemaValidator.loadSchema(config.schemaInline(), config.schemaFile());
        } catch (IOException e) {
            throw new UncheckedIOException(
                    CommonErrors.invalidConfig("schema", e.getMessage()).summary(), e);
        }
    }
}
