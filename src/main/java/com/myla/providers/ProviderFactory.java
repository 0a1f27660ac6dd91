package com.myla.providers;

import com.myla.shared.config.MylaConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;

/**
 * Builds the configured primary provider and its fallbacks, wrapped for retry.
 */
public final class ProviderFactory {

    private static final Logger log = LoggerFactory.getLogger(ProviderFactory.class);

    private ProviderFactory() {}

    public static ModelProvider fromConfig(MylaConfig config) {
        var ids = new LinkedHashSet<String>();
        ids.add(config.primaryProvider());
        ids.addAll(config.fallbackProviders());

        var providers = new ArrayList<ModelProvider>();
        for (var id : ids) {
            // the configured model names a model of the primary provider only
            var model = id.equals(config.primaryProvider()) ? config.model() : null;
            providers.add(create(id, config, model));
        }
        return new ReliableProvider(providers, new RetryPolicy(2, 500));
    }

    static ModelProvider create(String id, MylaConfig config, String model) {
        var key = config.apiKeys().getOrDefault(id, "");
        switch (id) {
            case "anthropic":
                warnIfMissing(id, key);
                return new AnthropicProvider(key, model != null ? model : "claude-3-5-sonnet-20241022");
            case "openai":
                warnIfMissing(id, key);
                return OpenAiCompatibleProvider.openAi(key, model != null ? model : "gpt-4o");
            case "ollama":
                return OpenAiCompatibleProvider.ollama(model != null ? model : "qwen3:4b");
            default:
                throw new IllegalArgumentException("Unknown provider '" + id + "', expected anthropic, openai or ollama");
        }
    }

    private static void warnIfMissing(String id, String key) {
        if (key.isBlank()) {
            log.warn("{} API key not configured. Set api-keys.{} in ~/.myla/config.yaml", id, id);
        }
    }
}
