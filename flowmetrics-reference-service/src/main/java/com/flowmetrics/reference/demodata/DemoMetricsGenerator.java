package com.flowmetrics.reference.demodata;

import com.flowmetrics.model.MetricKinds;
import com.flowmetrics.model.TaskOutcome;
import com.flowmetrics.service.core.ingest.MetricsRecorder;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Random;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Simulates a small swarm: every run each selected agent completes a few tasks, then reports its own success rate
 * and latency, and the swarm reports health and throughput. Disabled unless {@code demo-data.metrics.enabled}.
 */
@Component
@Slf4j
class DemoMetricsGenerator {

    private static final TaskOutcome[] FAILURES = {TaskOutcome.FAILURE, TaskOutcome.TIMEOUT, TaskOutcome.CANCELLED};

    private final DemoMetricsGeneratorProperties properties;
    private final MetricsRecorder recorder;
    private final Clock clock;

    @Autowired
    DemoMetricsGenerator(DemoMetricsGeneratorProperties properties, MetricsRecorder recorder) {
        this(properties, recorder, Clock.systemUTC());
    }

    DemoMetricsGenerator(DemoMetricsGeneratorProperties properties, MetricsRecorder recorder, Clock clock) {
        this.properties = properties;
        this.recorder = recorder;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "#{@demoMetricsGeneratorProperties.runEvery.toMillis()}")
    public void scheduledRun() {
        runOnce();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void startupRun() {
        runOnce();
    }

    /** @return number of records accepted by the recorder */
    int runOnce() {
        if (!properties.isEnabled()) {
            return 0;
        }
        Instant now = clock.instant();
        long runEverySeconds = Math.max(1L, properties.getRunEvery().toSeconds());
        Random random = randomForRun(now, runEverySeconds);

        int agents = properties.getAgents();
        int[] completed = new int[agents];
        int[] succeeded = new int[agents];
        long[] totalDuration = new long[agents];
        int accepted = 0;
        int tasks = properties.getTasksPerRun();

        for (int i = 0; i < tasks; i++) {
            int agent = random.nextInt(agents);
            long durationMs = sampleDuration(random);
            boolean failed = random.nextDouble() < properties.getFailureRate();
            TaskOutcome outcome = failed ? FAILURES[random.nextInt(FAILURES.length)] : TaskOutcome.SUCCESS;
            long tokens = 200 + random.nextInt(4_000);
            long files = random.nextInt(6);
            boolean ok = recorder.recordTask(
                    "task-" + UUID.randomUUID(),
                    agentId(agent),
                    durationMs,
                    outcome,
                    tokens,
                    files,
                    Map.of("swarm_id", properties.getSwarmId(), "model", random.nextBoolean() ? "large" : "small"),
                    now);
            accepted += ok ? 1 : 0;
            completed[agent]++;
            succeeded[agent] += failed ? 0 : 1;
            totalDuration[agent] += durationMs;
        }

        int healthyAgents = 0;
        for (int agent = 0; agent < agents; agent++) {
            if (completed[agent] == 0) {
                continue;
            }
            double successRate = (double) succeeded[agent] / completed[agent];
            double latency = (double) totalDuration[agent] / completed[agent];
            accepted += recorder.recordAgentMetric(agentId(agent), MetricKinds.SUCCESS_RATE, successRate, null, now)
                    ? 1
                    : 0;
            accepted += recorder.recordAgentMetric(agentId(agent), MetricKinds.LATENCY, latency, null, now) ? 1 : 0;
            if (successRate >= 0.5) {
                healthyAgents++;
            }
        }

        double health = (double) healthyAgents / agents;
        double throughput = tasks / (double) runEverySeconds;
        accepted += recorder.recordSwarmMetric(properties.getSwarmId(), MetricKinds.HEALTH, health, null, now) ? 1 : 0;
        accepted += recorder.recordSwarmMetric(properties.getSwarmId(), MetricKinds.THROUGHPUT, throughput, null, now)
                ? 1
                : 0;

        if (log.isDebugEnabled()) {
            log.debug("Demo metrics run complete tasks={} accepted={} health={}", tasks, accepted, health);
        }
        return accepted;
    }

    /** With a seed, every run inside the same {@code run-every} window draws the same sequence. */
    Random randomForRun(Instant now, long runEverySeconds) {
        Long seed = properties.getSeed();
        if (seed == null) {
            return new Random();
        }
        return new Random(seed ^ (now.getEpochSecond() / runEverySeconds));
    }

    private long sampleDuration(Random random) {
        // log-normal around the configured mean, clipped to a day
        double sigma = 0.6;
        double mu = Math.log(properties.getMeanDurationMs()) - sigma * sigma / 2;
        double sample = Math.exp(mu + sigma * random.nextGaussian());
        return Math.min(86_400_000L, Math.max(1L, Math.round(sample)));
    }

    private static String agentId(int index) {
        return "agent-" + (index + 1);
    }
}
