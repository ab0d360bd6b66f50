package com.riskrecon.worker.api;

import com.riskrecon.worker.reconcile.CycleOutcome;
import com.riskrecon.worker.reconcile.PositionReconciler;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/reconciler")
public class ReconcilerController {
  private final PositionReconciler positionReconciler;

  public ReconcilerController(PositionReconciler positionReconciler) {
    this.positionReconciler = positionReconciler;
  }

  @GetMapping("/positions")
  public List<TrackedPositionResponse> positions() {
    return positionReconciler.trackedPositions().stream()
        .map(TrackedPositionResponse::from)
        .toList();
  }

  @PostMapping("/cycles")
  public CycleRunResponse runCycle() {
    CycleOutcome outcome = positionReconciler.runCycle();
    return new CycleRunResponse(outcome.value(), positionReconciler.currentSnapshot().cycle());
  }
}
