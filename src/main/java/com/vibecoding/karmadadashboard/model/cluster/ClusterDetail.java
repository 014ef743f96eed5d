package com.vibecoding.karmadadashboard.model.cluster;

import io.fabric8.kubernetes.api.model.Taint;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
public class ClusterDetail extends Cluster {
    private List<Taint> taints = new ArrayList<>();
}
