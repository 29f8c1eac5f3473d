package com.flowmetrics.reference.demodata;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component("demoMetricsGeneratorProperties")
@ConfigurationProperties(prefix = "demo-data.metrics")
public class DemoMetricsGeneratorProperties {

    private boolean enabled;
    private Duration runEvery = Duration.ofSeconds(5);
    private int agents = 4;
    private String swarmId = "swarm-demo";
    private int tasksPerRun = 8;
    private double failureRate = 0.1;
    private long meanDurationMs = 2_000;
    private Long seed;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Duration getRunEvery() {
        return runEvery;
    }

    public void setRunEvery(Duration runEvery) {
        this.runEvery = runEvery;
    }

    public int getAgents() {
        return agents;
    }

    public void setAgents(int agents) {
        this.agents = Math.max(1, agents);
    }

    public String getSwarmId() {
        return swarmId;
    }

    public void setSwarmId(String swarmId) {
        this.swarmId = swarmId;
    }

    public int getTasksPerRun() {
        return tasksPerRun;
    }

    public void setTasksPerRun(int tasksPerRun) {
        this.tasksPerRun = Math.max(0, tasksPerRun);
    }

    public double getFailureRate() {
        return failureRate;
    }

    public void setFailureRate(double failureRate) {
        this.failureRate = Math.min(1.0, Math.max(0.0, failureRate));
    }

    public long getMeanDurationMs() {
        return meanDurationMs;
    }

    public void setMeanDurationMs(long meanDurationMs) {
        this.meanDurationMs = Math.max(1, meanDurationMs);
    }

    public Long getSeed() {
        return seed;
    }

    public void setSeed(Long seed) {
        this.seed = seed;
    }
}
