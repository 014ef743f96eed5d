package com.vibecoding.karmadadashboard.model.cluster;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 라벨 / taint 전체 교체. null 인 목록은 그대로 둔다
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PutClusterRequest {
    private List<LabelItem> labels;
    private List<TaintItem> taints;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class LabelItem {
        private String key;
        private String value;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TaintItem {
        private String key;
        private String value;
        private String effect;
    }
}
