package org.javai.resilience.demo;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.javai.resilience.Action;
import org.javai.resilience.PolicyPipeline;
import org.javai.resilience.config.ResilienceConfig;
import org.javai.resilience.ops.CompositeResilienceListener;
import org.javai.resilience.ops.log4j.Log4jResilienceListener;
import org.javai.resilience.ops.metrics.MetricsResilienceListener;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Random;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs a flaky simulated action through a pipeline every 250ms and logs what happens.
 *
 * <p>Usage: {@code ResilienceDemo [config.json] [iterations]}. Without a file the
 * {@code resilience.json} classpath resource is used; without an iteration count the demo
 * runs until interrupted.
 */
public final class ResilienceDemo {

    static final long PACE_MILLIS = 250;

    private static final Logger LOG = LogManager.getLogger(ResilienceDemo.class);

    private final PolicyPipeline pipeline;
    private final Action primary;
    private final Stopwatch stopwatch;
    private final AtomicLong primaryRuns = new AtomicLong();
    private final AtomicLong fallbackRuns = new AtomicLong();

    ResilienceDemo(ResilienceConfig config, Random random, Stopwatch stopwatch) {
        this.stopwatch = stopwatch;
        this.primary = new SimulatedAction(random, message -> {
            primaryRuns.incrementAndGet();
            log(message);
        });
        Action fallbackAction = () -> {
            fallbackRuns.incrementAndGet();
            log("! Fallback Action");
        };
        this.pipeline = PolicyPipeline.of(
                "primary-action",
                config,
                fallbackAction,
                CompositeResilienceListener.of(
                        new Log4jResilienceListener(),
                        new MetricsResilienceListener("demo")));
    }

    public static void main(String[] args) throws InterruptedException {
        ResilienceConfig config = args.length > 0 ? loadFile(Path.of(args[0])) : ResilienceConfig.fromClasspath("resilience.json");
        long iterations = args.length > 1 ? Long.parseLong(args[1]) : Long.MAX_VALUE;

        ResilienceDemo demo = new ResilienceDemo(config, new Random(), Stopwatch.start());
        LOG.info("Starting with {}", config);
        demo.run(iterations, PACE_MILLIS);
        LOG.info("Finished: {} primary runs, {} fallback runs", demo.primaryRuns(), demo.fallbackRuns());
    }

    void run(long iterations, long paceMillis) throws InterruptedException {
        for (long i = 0; i < iterations; i++) {
            pipeline.execute(primary);
            Thread.sleep(paceMillis);
        }
    }

    long primaryRuns() {
        return primaryRuns.get();
    }

    long fallbackRuns() {
        return fallbackRuns.get();
    }

    PolicyPipeline pipeline() {
        return pipeline;
    }

    private void log(String message) {
        LOG.info(stopwatch.stamp(message));
    }

    private static ResilienceConfig loadFile(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return ResilienceConfig.fromJson(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read " + path, e);
        }
    }
}
