package com.vibecoding.karmadadashboard.model.overview;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class MetricsDashboard {
    @NotBlank
    private String name;
    @NotBlank
    private String url;
}
