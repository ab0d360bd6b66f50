package com.riskrecon.worker.api;

import com.riskrecon.worker.reconcile.PositionReconciler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class HealthController {
  private final PositionReconciler positionReconciler;

  public HealthController(PositionReconciler positionReconciler) {
    this.positionReconciler = positionReconciler;
  }

  @GetMapping("/health")
  public HealthResponse health() {
    return HealthResponse.from(positionReconciler.currentSnapshot());
  }
}
