package com.vibecoding.karmadadashboard.model.cluster;

import com.vibecoding.karmadadashboard.model.ListMeta;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ClusterList {
    private ListMeta listMeta;
    private List<Cluster> clusters = new ArrayList<>();
    private List<String> errors = new ArrayList<>();
}
