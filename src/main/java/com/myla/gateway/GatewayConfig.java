package com.myla.gateway;

import com.myla.agent.AgentOrchestrator;
import com.myla.agent.OrchestratorContext;
import com.myla.providers.ModelProvider;
import com.myla.providers.ProviderFactory;
import com.myla.shared.config.MylaConfig;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the engine into the web layer. The config object itself is registered by {@link MylaApp}.
 */
@Configuration
public class GatewayConfig {

    @Bean(destroyMethod = "close")
    public OrchestratorContext orchestratorContext(MylaConfig config) {
        var context = OrchestratorContext.create(config);
        context.start();
        return context;
    }

    @Bean
    public ModelProvider modelProvider(MylaConfig config) {
        return ProviderFactory.fromConfig(config);
    }

    @Bean
    public AgentOrchestrator agentOrchestrator(OrchestratorContext context, ModelProvider provider) {
        return context.orchestrator(provider);
    }
}
