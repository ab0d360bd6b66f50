package com.riskrecon.worker.config;

import com.riskrecon.domain.risk.RiskParameters;
import java.math.BigDecimal;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "risk")
public class RiskProperties {
  private BigDecimal initialBalance = new BigDecimal("10000");
  private int eventCapacity = 1000;
  private int historyCapacity = 1000;
  private Parameters parameters = new Parameters();
  private DailyReset dailyReset = new DailyReset();

  public BigDecimal getInitialBalance() {
    return initialBalance;
  }

  public void setInitialBalance(BigDecimal initialBalance) {
    this.initialBalance = initialBalance;
  }

  public int getEventCapacity() {
    return eventCapacity;
  }

  public void setEventCapacity(int eventCapacity) {
    this.eventCapacity = eventCapacity;
  }

  public int getHistoryCapacity() {
    return historyCapacity;
  }

  public void setHistoryCapacity(int historyCapacity) {
    this.historyCapacity = historyCapacity;
  }

  public Parameters getParameters() {
    return parameters;
  }

  public void setParameters(Parameters parameters) {
    this.parameters = parameters;
  }

  public DailyReset getDailyReset() {
    return dailyReset;
  }

  public void setDailyReset(DailyReset dailyReset) {
    this.dailyReset = dailyReset;
  }

  public static class Parameters {
    private BigDecimal maxPositionFraction = new BigDecimal("0.05");
    private BigDecimal maxDailyLossFraction = new BigDecimal("0.02");
    private BigDecimal stopLossFraction = new BigDecimal("0.02");
    private BigDecimal takeProfitFraction = new BigDecimal("0.06");
    private int maxOpenPositions = 3;
    private BigDecimal minRiskRewardRatio = new BigDecimal("2.0");
    private BigDecimal maxCorrelatedExposureFraction = new BigDecimal("0.3");
    private BigDecimal emergencyStopLossFraction = new BigDecimal("0.10");
    private boolean paperTrading = false;
    private boolean volatilityAdjustment = true;

    public RiskParameters toRiskParameters() {
      return new RiskParameters(
          maxPositionFraction,
          maxDailyLossFraction,
          stopLossFraction,
          takeProfitFraction,
          maxOpenPositions,
          minRiskRewardRatio,
          maxCorrelatedExposureFraction,
          emergencyStopLossFraction,
          paperTrading,
          volatilityAdjustment);
    }

    public BigDecimal getMaxPositionFraction() {
      return maxPositionFraction;
    }

    public void setMaxPositionFraction(BigDecimal maxPositionFraction) {
      this.maxPositionFraction = maxPositionFraction;
    }

    public BigDecimal getMaxDailyLossFraction() {
      return maxDailyLossFraction;
    }

    public void setMaxDailyLossFraction(BigDecimal maxDailyLossFraction) {
      this.maxDailyLossFraction = maxDailyLossFraction;
    }

    public BigDecimal getStopLossFraction() {
      return stopLossFraction;
    }

    public void setStopLossFraction(BigDecimal stopLossFraction) {
      this.stopLossFraction = stopLossFraction;
    }

    public BigDecimal getTakeProfitFraction() {
      return takeProfitFraction;
    }

    public void setTakeProfitFraction(BigDecimal takeProfitFraction) {
      this.takeProfitFraction = takeProfitFraction;
    }

    public int getMaxOpenPositions() {
      return maxOpenPositions;
    }

    public void setMaxOpenPositions(int maxOpenPositions) {
      this.maxOpenPositions = maxOpenPositions;
    }

    public BigDecimal getMinRiskRewardRatio() {
      return minRiskRewardRatio;
    }

    public void setMinRiskRewardRatio(BigDecimal minRiskRewardRatio) {
      this.minRiskRewardRatio = minRiskRewardRatio;
    }

    public BigDecimal getMaxCorrelatedExposureFraction() {
      return maxCorrelatedExposureFraction;
    }

    public void setMaxCorrelatedExposureFraction(BigDecimal maxCorrelatedExposureFraction) {
      this.maxCorrelatedExposureFraction = maxCorrelatedExposureFraction;
    }

    public BigDecimal getEmergencyStopLossFraction() {
      return emergencyStopLossFraction;
    }

    public void setEmergencyStopLossFraction(BigDecimal emergencyStopLossFraction) {
      this.emergencyStopLossFraction = emergencyStopLossFraction;
    }

    public boolean isPaperTrading() {
      return paperTrading;
    }

    public void setPaperTrading(boolean paperTrading) {
      this.paperTrading = paperTrading;
    }

    public boolean isVolatilityAdjustment() {
      return volatilityAdjustment;
    }

    public void setVolatilityAdjustment(boolean volatilityAdjustment) {
      this.volatilityAdjustment = volatilityAdjustment;
    }
  }

  public static class DailyReset {
    private boolean enabled = true;
    private String cron = "0 0 0 * * *";
    private String zone = "UTC";

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getCron() {
      return cron;
    }

    public void setCron(String cron) {
      this.cron = cron;
    }

    public String getZone() {
      return zone;
    }

    public void setZone(String zone) {
      this.zone = zone;
    }
  }
}
