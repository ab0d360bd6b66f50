package com.riskrecon.worker.api;

import com.riskrecon.domain.risk.TradeValidation;
import java.util.List;

public record TradeValidationResponse(boolean valid, List<String> reasons) {
  public static TradeValidationResponse from(TradeValidation validation) {
    return new TradeValidationResponse(validation.valid(), validation.reasons());
  }
}
