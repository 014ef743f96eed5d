package com.vibecoding.karmadadashboard.model.crd;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ApiVersionInfo {
    private String group;
    private List<String> versions;
    private String cluster;
}
