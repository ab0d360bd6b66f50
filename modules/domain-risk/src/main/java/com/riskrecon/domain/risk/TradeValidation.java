package com.riskrecon.domain.risk;

import java.util.List;

public record TradeValidation(boolean valid, List<String> reasons) {
  public TradeValidation {
    reasons = reasons == null ? List.of() : List.copyOf(reasons);
  }
}
