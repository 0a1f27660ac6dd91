package com.myla.providers;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Decorator: retry per provider, then fall back to the next provider in order.
 */
public class ReliableProvider implements ModelProvider {

    private static final Logger log = LoggerFactory.getLogger(ReliableProvider.class);

    private final List<ModelProvider> providers;
    private final RetryPolicy retryPolicy;

    public ReliableProvider(List<ModelProvider> providers, RetryPolicy retryPolicy) {
        if (providers.isEmpty()) throw new IllegalArgumentException("At least one provider is required");
        this.providers = List.copyOf(providers);
        this.retryPolicy = retryPolicy;
    }

    @Override
    public String id() {
        return "reliable(" + providers.get(0).id() + ")";
    }

    @Override
    public ChatResponse chat(ChatRequest request) {
        var failures = new ArrayList<String>();
        for (int i = 0; i < providers.size(); i++) {
            var provider = providers.get(i);
            try {
                var resp = retryPolicy.execute(() -> provider.chat(request));
                if (i > 0) log.info("Recovered via provider={}", provider.id());
                return resp;
            } catch (RuntimeException e) {
                failures.add(provider.id() + ": " + rootMessage(e));
                log.warn("Provider {} failed, trying next", provider.id());
            }
        }
        throw new ModelException("All providers failed:\n" + String.join("\n", failures));
    }

    private static String rootMessage(Throwable t) {
        while (t.getCause() != null) t = t.getCause();
        return t.getMessage();
    }
}
