package com.pagewatch.service;

import com.pagewatch.core.bus.EventBus;
import com.pagewatch.core.model.Job;
import com.pagewatch.core.model.JobStatus;
import com.pagewatch.core.model.LatestChange;
import com.pagewatch.core.model.SystemStatus;
import com.pagewatch.monitor.annotation.OpenRouterAnnotator;
import com.pagewatch.monitor.config.EngineConfig;
import com.pagewatch.monitor.site.HttpPageFetcher;
import com.pagewatch.service.config.ConfigLoader;
import com.pagewatch.service.http.HttpClientFactory;
import com.pagewatch.service.runtime.JobRegistry;
import com.pagewatch.service.runtime.MonitorService;
import com.pagewatch.service.runtime.SchedulerService;
import com.pagewatch.service.store.JsonFileJobStore;
import com.pagewatch.service.store.JsonlEventStore;

import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.logging.LogManager;
import java.util.logging.Logger;

public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());
    static final String ANNOTATION_KEY_ENV = "PAGEWATCH_ANNOTATION_KEY";

    private Main() {
    }

    public static void main(String[] args) throws InterruptedException {
        configureLogging();
        List<String> arguments = Arrays.asList(args);
        Path configDir = Path.of(arguments.stream()
                .filter(arg -> !arg.startsWith("--"))
                .findFirst()
                .orElse("config"));
        EngineConfig config = ConfigLoader.loadEngine(configDir);
        Path stateDir = Path.of(config.stateDir());

        Clock clock = Clock.systemUTC();
        EventBus eventBus = new EventBus();
        JsonlEventStore eventStore = new JsonlEventStore(stateDir.resolve("events.jsonl"));
        eventBus.subscribeAll(eventStore::append);

        HttpClient httpClient = HttpClientFactory.create(Duration.ofSeconds(10));
        JobRegistry registry = new JobRegistry(
                new JsonFileJobStore(stateDir),
                eventBus,
                clock,
                config.ledgerCapacity(),
                config.failureThreshold()
        );
        SchedulerService scheduler = new SchedulerService(
                registry,
                new HttpPageFetcher(httpClient, clock),
                clock,
                config.fetchTimeout()
        );
        MonitorService service = new MonitorService(
                registry,
                scheduler,
                new OpenRouterAnnotator(httpClient, config.annotation()),
                config.minimumInterval()
        );

        List<Job> resumed = service.restore(config.resumeRunningJobs());
        if (!resumed.isEmpty()) {
            LOGGER.info("Resumed " + resumed.size() + " jobs without annotation");
        }
        if (arguments.contains("--start-all")) {
            service.startAll(annotationKey(System.getenv()));
        }
        if (arguments.contains("--latest")) {
            for (LatestChange latest : service.latestChanges()) {
                LOGGER.info(latest.jobName() + " (" + latest.url() + ") " + latest.change().detectedAt()
                        + ": " + latest.change().description());
            }
        }
        SystemStatus status = service.systemStatus();
        LOGGER.info("Monitoring " + status.totalJobs() + " jobs; running=" + status.count(JobStatus.RUNNING)
                + " error=" + status.count(JobStatus.ERROR));

        CountDownLatch shutdownLatch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            service.shutdown();
            shutdownLatch.countDown();
        }));

        shutdownLatch.await();
    }

    static String annotationKey(Map<String, String> environment) {
        String key = environment.get(ANNOTATION_KEY_ENV);
        return key == null || key.isBlank() ? null : key.trim();
    }

    private static void configureLogging() {
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading logging.properties", e);
        }
    }
}
