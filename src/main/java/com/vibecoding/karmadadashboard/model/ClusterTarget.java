package com.vibecoding.karmadadashboard.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * 요청이 향하는 클러스터: Karmada 컨트롤 플레인, 관리 클러스터, 또는 멤버 클러스터
 */
@Getter
@EqualsAndHashCode
public final class ClusterTarget {

    public static final String MGMT_CLUSTER_NAME = "mgmt-cluster";
    public static final String KARMADA_CLUSTER_NAME = "karmada";

    public enum Scope {
        KARMADA,
        MGMT,
        MEMBER
    }

    private static final ClusterTarget KARMADA = new ClusterTarget(Scope.KARMADA, KARMADA_CLUSTER_NAME);
    private static final ClusterTarget MGMT = new ClusterTarget(Scope.MGMT, MGMT_CLUSTER_NAME);

    private final Scope scope;
    private final String clusterName;

    private ClusterTarget(Scope scope, String clusterName) {
        this.scope = scope;
        this.clusterName = clusterName;
    }

    public static ClusterTarget karmada() {
        return KARMADA;
    }

    public static ClusterTarget mgmt() {
        return MGMT;
    }

    /**
     * "mgmt-cluster" 는 관리 클러스터를 가리킨다
     */
    public static ClusterTarget member(String clusterName) {
        if (MGMT_CLUSTER_NAME.equals(clusterName)) {
            return MGMT;
        }
        return new ClusterTarget(Scope.MEMBER, clusterName);
    }

    @Override
    public String toString() {
        return scope == Scope.MEMBER ? "member/" + clusterName : clusterName;
    }
}
