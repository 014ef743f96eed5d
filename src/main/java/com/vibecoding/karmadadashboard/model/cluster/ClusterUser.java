package com.vibecoding.karmadadashboard.model.cluster;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ClusterUser {
    private String username;
    private String displayName;
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private String email;
    private List<String> roles = new ArrayList<>();
}
