package com.vibecoding.karmadadashboard.model;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

import java.util.Map;

@Data
public class NamespaceRequest {
    @NotBlank
    private String name;
    private Map<String, String> labels;
    private boolean skipAutoPropagation;
}
