package com.vibecoding.karmadadashboard.model.overview;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Karmada API 서버 버전과 karmada-controller-manager 상태
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class KarmadaInfo {

    public static final String STATUS_RUNNING = "running";
    public static final String STATUS_UNKNOWN = "unknown";

    private Version version;
    private String status;
    private String createTime;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Version {
        private String gitVersion;
        private String gitCommit;
        private String gitTreeState;
        private String buildDate;
    }
}
