package com.vibecoding.karmadadashboard.model.cluster;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class NodeSummary {
    private int totalNum;
    private int readyNum;
}
