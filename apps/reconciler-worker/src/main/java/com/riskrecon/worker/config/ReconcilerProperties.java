package com.riskrecon.worker.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "reconciler")
public class ReconcilerProperties {
  private boolean enabled = true;
  private Duration pollInterval = Duration.ofSeconds(2);
  private int latencyWindow = 50;
  private Duration venueTimeout = Duration.ofSeconds(5);
  private int errorMessageMaxLength = 300;

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public Duration getPollInterval() {
    return pollInterval;
  }

  public void setPollInterval(Duration pollInterval) {
    this.pollInterval = pollInterval;
  }

  public int getLatencyWindow() {
    return latencyWindow;
  }

  public void setLatencyWindow(int latencyWindow) {
    this.latencyWindow = latencyWindow;
  }

  public Duration getVenueTimeout() {
    return venueTimeout;
  }

  public void setVenueTimeout(Duration venueTimeout) {
    this.venueTimeout = venueTimeout;
  }

  public int getErrorMessageMaxLength() {
    return errorMessageMaxLength;
  }

  public void setErrorMessageMaxLength(int errorMessageMaxLength) {
    this.errorMessageMaxLength = errorMessageMaxLength;
  }
}
