package com.vibecoding.karmadadashboard.model.overview;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class GpuSummary {
    private long totalGPU;
    private List<GpuPool> gpuPools = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class GpuPool {
        private String model;
        private long count;
    }
}
