package com.vibecoding.karmadadashboard.model.overview;

import com.vibecoding.karmadadashboard.model.cluster.NodeSummary;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 노드 / CPU(코어) / 메모리(바이트) / Pod 요약
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MemberClusterStatus {
    private NodeSummary nodeSummary = new NodeSummary();
    private CpuSummary cpuSummary = new CpuSummary();
    private MemorySummary memorySummary = new MemorySummary();
    private PodSummary podSummary = new PodSummary();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CpuSummary {
        private long totalCPU;
        private double allocatedCPU;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MemorySummary {
        private long totalMemory;
        private double allocatedMemory;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PodSummary {
        private long totalPod;
        private long allocatedPod;
    }
}
