package com.arenabox.sandbox;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "arenabox.sandbox")
public class SandboxProperties {

    private Duration staleAfter = Duration.ofHours(2);
    private Duration revertCooldown = Duration.ofMinutes(5);
    private int portRangeMin = 30000;
    private int portRangeMax = 60000;
    private int portAllocationAttempts = 100;
    private int killBatchSize = 100;
    private boolean sweepEnabled = false;
    private Duration sweepInterval = Duration.ofMinutes(10);

    public Duration getStaleAfter() { return staleAfter; }
    public void setStaleAfter(Duration staleAfter) { this.staleAfter = staleAfter; }
    public Duration getRevertCooldown() { return revertCooldown; }
    public void setRevertCooldown(Duration revertCooldown) { this.revertCooldown = revertCooldown; }
    public int getPortRangeMin() { return portRangeMin; }
    public void setPortRangeMin(int portRangeMin) { this.portRangeMin = portRangeMin; }
    public int getPortRangeMax() { return portRangeMax; }
    public void setPortRangeMax(int portRangeMax) { this.portRangeMax = portRangeMax; }
    public int getPortAllocationAttempts() { return portAllocationAttempts; }
    public void setPortAllocationAttempts(int portAllocationAttempts) { this.portAllocationAttempts = portAllocationAttempts; }
    public int getKillBatchSize() { return killBatchSize; }
    public void setKillBatchSize(int killBatchSize) { this.killBatchSize = killBatchSize; }
    public boolean isSweepEnabled() { return sweepEnabled; }
    public void setSweepEnabled(boolean sweepEnabled) { this.sweepEnabled = sweepEnabled; }
    public Duration getSweepInterval() { return sweepInterval; }
    public void setSweepInterval(Duration sweepInterval) { this.sweepInterval = sweepInterval; }
}
