package com.vibecoding.karmadadashboard.model;

import com.vibecoding.karmadadashboard.exception.BadRequestException;
import io.fabric8.kubernetes.api.model.ConfigMap;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.Namespace;
import io.fabric8.kubernetes.api.model.Node;
import io.fabric8.kubernetes.api.model.PersistentVolume;
import io.fabric8.kubernetes.api.model.PersistentVolumeClaim;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.api.model.apps.DaemonSet;
import io.fabric8.kubernetes.api.model.apps.Deployment;
import io.fabric8.kubernetes.api.model.apps.ReplicaSet;
import io.fabric8.kubernetes.api.model.apps.StatefulSet;
import io.fabric8.kubernetes.api.model.batch.v1.CronJob;
import io.fabric8.kubernetes.api.model.batch.v1.Job;
import io.fabric8.kubernetes.api.model.networking.v1.Ingress;

/**
 * 목록/상세 API 가 지원하는 네이티브 리소스 종류
 */
public enum ResourceKind {

    CONFIGMAP("configmap", "ConfigMap", ConfigMap.class, true, "items"),
    CRONJOB("cronjob", "CronJob", CronJob.class, true, "items"),
    DAEMONSET("daemonset", "DaemonSet", DaemonSet.class, true, "daemonSets"),
    DEPLOYMENT("deployment", "Deployment", Deployment.class, true, "deployments"),
    INGRESS("ingress", "Ingress", Ingress.class, true, "items"),
    JOB("job", "Job", Job.class, true, "jobs"),
    NAMESPACE("namespace", "Namespace", Namespace.class, false, "namespaces"),
    NODE("node", "Node", Node.class, false, "nodes"),
    PERSISTENTVOLUME("persistentvolume", "PersistentVolume", PersistentVolume.class, false, "items"),
    PERSISTENTVOLUMECLAIM("persistentvolumeclaim", "PersistentVolumeClaim", PersistentVolumeClaim.class, true, "items"),
    POD("pod", "Pod", Pod.class, true, "pods"),
    REPLICASET("replicaset", "ReplicaSet", ReplicaSet.class, true, "replicaSets"),
    SECRET("secret", "Secret", Secret.class, true, "secrets"),
    SERVICE("service", "Service", Service.class, true, "services"),
    STATEFULSET("statefulset", "StatefulSet", StatefulSet.class, true, "statefulSets");

    /**
     * URL 경로 변수 정규식. 다른 고정 경로(/cluster, /overview ...)와 겹치지 않도록 종류를 제한한다.
     */
    public static final String PATH_REGEX = "configmap|cronjob|daemonset|deployment|ingress|job|namespace|node"
        + "|persistentvolume|persistentvolumeclaim|pod|replicaset|secret|service|statefulset";

    private final String path;
    private final String kind;
    private final Class<? extends HasMetadata> type;
    private final boolean namespaced;
    private final String listField;

    ResourceKind(String path, String kind, Class<? extends HasMetadata> type, boolean namespaced, String listField) {
        this.path = path;
        this.kind = kind;
        this.type = type;
        this.namespaced = namespaced;
        this.listField = listField;
    }

    public static ResourceKind fromPath(String path) {
        for (ResourceKind value : values()) {
            if (value.path.equalsIgnoreCase(path)) {
                return value;
            }
        }
        throw new BadRequestException("unsupported resource kind: " + path);
    }

    public String getPath() {
        return path;
    }

    public String getKind() {
        return kind;
    }

    public Class<? extends HasMetadata> getType() {
        return type;
    }

    public boolean isNamespaced() {
        return namespaced;
    }

    public String getListField() {
        return listField;
    }
}
