package com.vibecoding.karmadadashboard.model.cluster;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ClusterUsersRequest {
    private List<UserRoles> users;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class UserRoles {
        private String username;
        private List<String> roles;
    }
}
