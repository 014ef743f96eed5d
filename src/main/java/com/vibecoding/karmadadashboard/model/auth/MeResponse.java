package com.vibecoding.karmadadashboard.model.auth;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MeResponse {
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private String name;
    private boolean authenticated;
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private String role;
    private boolean initToken;
}
