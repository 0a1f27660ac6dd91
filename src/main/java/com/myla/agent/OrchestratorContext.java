package com.myla.agent;

import com.myla.agents.AgentConnector;
import com.myla.agents.ChannelLauncher;
import com.myla.coordination.Coordinator;
import com.myla.coordination.tools.CoordinatorTools;
import com.myla.mcp.McpClient;
import com.myla.observability.MetricsConfig;
import com.myla.providers.ModelProvider;
import com.myla.routing.IntentRouter;
import com.myla.shared.config.MylaConfig;
import com.myla.shared.config.OrchestratorSettings;
import com.myla.tools.CatalogBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Process-wide state shared by every request: agent connections, the coordinator, the worker pool
 * and metrics. Created once at startup and closed at shutdown.
 */
public class OrchestratorContext implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorContext.class);

    private final MylaConfig config;
    private final OrchestratorSettings settings;
    private final MetricsConfig metrics;
    private final ExecutorService executor;
    private final AgentConnector connector;
    private final Coordinator coordinator;

    public OrchestratorContext(MylaConfig config, ChannelLauncher launcher, MetricsConfig metrics) {
        this.config = config;
        this.settings = config.orchestrator();
        this.metrics = metrics;
        this.executor = Executors.newCachedThreadPool(daemonThreads());
        this.connector = new AgentConnector(launcher, executor,
            TimeUnit.SECONDS.toMillis(settings.connectTimeoutSeconds()), metrics);
        this.coordinator = new Coordinator(Clock.systemUTC(), Duration.ofHours(settings.unreadWindowHours()));
    }

    public static OrchestratorContext create(MylaConfig config) {
        var launcher = McpClient.launcher(TimeUnit.SECONDS.toMillis(config.orchestrator().requestTimeoutSeconds()));
        return new OrchestratorContext(config, launcher, new MetricsConfig());
    }

    /**
     * Connects the configured agents and registers the in-process coordinator,
     * unless an external agent already serves that id.
     */
    public void start() {
        connector.initializeAll(config.agents());
        var coordinatorId = settings.coordinatorId();
        if (connector.isReady(coordinatorId)) {
            log.info("Coordinator {} provided by a configured agent", coordinatorId);
            return;
        }
        connector.registerLocal(coordinatorId, CoordinatorTools.channel(coordinator),
            List.of("coordination", "workflows", "messaging"));
    }

    public AgentOrchestrator orchestrator(ModelProvider provider) {
        var router = new IntentRouter(config.routing(), settings.defaultAgents(), settings.coordinatorId());
        var catalogBuilder = new CatalogBuilder(connector, executor,
            TimeUnit.SECONDS.toMillis(settings.requestTimeoutSeconds()));
        var loop = new OrchestrationLoop(provider, executor, metrics, settings.temperature(), settings.maxTokens());
        return new DefaultAgentOrchestrator(router, catalogBuilder, loop, coordinator, settings.maxIterations());
    }

    public MylaConfig config() { return config; }
    public OrchestratorSettings settings() { return settings; }
    public MetricsConfig metrics() { return metrics; }
    public ExecutorService executor() { return executor; }
    public AgentConnector connector() { return connector; }
    public Coordinator coordinator() { return coordinator; }

    @Override
    public void close() {
        connector.close();
        executor.shutdownNow();
        log.info("Orchestrator context closed");
    }

    private static ThreadFactory daemonThreads() {
        var seq = new AtomicInteger(1);
        return task -> {
            var thread = new Thread(task, "myla-worker-" + seq.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };
    }
}
