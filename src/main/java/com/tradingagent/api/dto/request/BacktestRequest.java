package com.tradingagent.api.dto.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for replaying one strategy over one symbol's recent history. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BacktestRequest {

    /** Strategy name, e.g. "mean_reversion" or "momentum". */
    @NotBlank
    private String strategy;

    @NotBlank
    private String symbol;

    /** Calendar days of history to replay. */
    @Min(30)
    @Max(3650)
    @Builder.Default
    private int lookbackDays = 730;
}
