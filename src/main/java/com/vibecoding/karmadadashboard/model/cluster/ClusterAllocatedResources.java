package com.vibecoding.karmadadashboard.model.cluster;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 클러스터 자원 할당 현황. capacity 는 CPU 코어 / 메모리 바이트, fraction 은 백분율
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClusterAllocatedResources {
    private long cpuCapacity;
    private double cpuFraction;
    private long memoryCapacity;
    private double memoryFraction;
    private long allocatedPods;
    private long podCapacity;
    private double podFraction;
}
