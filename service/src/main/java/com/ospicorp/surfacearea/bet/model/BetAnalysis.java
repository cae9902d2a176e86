package com.ospicorp.surfacearea.bet.model;

import com.ospicorp.surfacearea.isotherm.model.IsothermDataset;
import com.ospicorp.surfacearea.isotherm.model.IsothermQualityReport;
import java.util.List;

// answer and summary are null when the mask leaves no valid range
public record BetAnalysis(
    IsothermDataset dataset,
    IsothermQualityReport quality,
    IntervalResult result,
    ValidityMask mask,
    SurfaceAreaAnswer answer,
    SurfaceAreaSummary summary,
    List<Diagnostic> diagnostics
) {

  public BetAnalysis {
    diagnostics = List.copyOf(diagnostics);
  }

  public boolean hasAnswer() {
    return answer != null;
  }
}
