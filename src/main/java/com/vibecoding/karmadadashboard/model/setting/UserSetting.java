package com.vibecoding.karmadadashboard.model.setting;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * 사용자별 UI 설정. password 와 clusterPermissions 는 요청에서만 사용하고 저장하지 않는다
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonIgnoreProperties(ignoreUnknown = true)
public class UserSetting {
    @JsonInclude(JsonInclude.Include.ALWAYS)
    private String username;
    private String displayName;
    private String theme;
    private String language;
    private String dateFormat;
    private String timeFormat;
    private Map<String, String> preferences;
    private DashboardSettings dashboard;
    private String password;
    private List<ClusterPermission> clusterPermissions;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static class DashboardSettings {
        private String defaultView;
        private int refreshInterval;
        private List<String> pinnedClusters;
        private List<String> hiddenWidgets;
        private Map<String, WidgetPosition> widgetLayout;

        public DashboardSettings(String defaultView, int refreshInterval) {
            this.defaultView = defaultView;
            this.refreshInterval = refreshInterval;
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class WidgetPosition {
        private int row;
        private int column;
        private int width;
        private int height;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ClusterPermission {
        private String cluster;
        private List<String> roles;
    }
}
