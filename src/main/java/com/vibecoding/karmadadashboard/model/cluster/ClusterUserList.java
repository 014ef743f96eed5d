package com.vibecoding.karmadadashboard.model.cluster;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ClusterUserList {
    private List<ClusterUser> users = new ArrayList<>();
    private List<String> errors = new ArrayList<>();
}
