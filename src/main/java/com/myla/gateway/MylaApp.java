package com.myla.gateway;

import com.myla.agent.AgentOrchestrator;
import com.myla.agent.OrchestratorContext;
import com.myla.agents.ConnectionReport;
import com.myla.channels.ChannelRegistry;
import com.myla.channels.CliAdapter;
import com.myla.shared.config.ConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

@SpringBootApplication(scanBasePackages = "com.myla.gateway")
public class MylaApp {

    private static final Logger log = LoggerFactory.getLogger(MylaApp.class);

    public static void main(String[] args) {
        var config = ConfigLoader.load();

        var app = new SpringApplication(MylaApp.class);
        app.setDefaultProperties(Map.of("server.port", config.serverPort()));
        app.addInitializers(c -> c.getBeanFactory().registerSingleton("mylaConfig", config));
        var ctx = app.run(args);
        log.info("Myla gateway listening on port {}", config.serverPort());

        if (Boolean.parseBoolean(System.getenv().getOrDefault("MYLA_CLI", "true"))) {
            startCli(ctx);
        }
    }

    private static void startCli(ConfigurableApplicationContext ctx) {
        var orchestrator = ctx.getBean(AgentOrchestrator.class);
        var context = ctx.getBean(OrchestratorContext.class);

        var registry = new ChannelRegistry(ctx::close);
        var cli = new CliAdapter(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)),
            System.out);
        cli.onStop(() -> registry.closed(cli.id()));

        registry.open(cli, msg -> {
            if ("/agents".equals(msg.content().trim())) {
                registry.reply(msg.channelId(), ConnectionReport.render(context.connector().connections()));
                return;
            }
            registry.reply(msg.channelId(), orchestrator.submit(msg.content(), List.of()));
        });
    }
}
