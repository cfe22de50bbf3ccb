package com.funnelanalytics.api;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrackEventRequest {

    @NotBlank
    @Size(max = 255)
    private String sessionId;

    @NotBlank
    @Size(max = 255)
    private String step;

    @NotNull
    @Min(0)
    private Integer stepNumber;

    private Map<String, Object> metadata;
}
