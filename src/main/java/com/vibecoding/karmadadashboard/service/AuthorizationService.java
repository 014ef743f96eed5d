package com.vibecoding.karmadadashboard.service;

import com.vibecoding.karmadadashboard.exception.AuthorizationException;
import com.vibecoding.karmadadashboard.fga.RelationshipAuthorizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import static com.vibecoding.karmadadashboard.fga.RelationshipAuthorizer.DASHBOARD_ID;
import static com.vibecoding.karmadadashboard.fga.RelationshipAuthorizer.RELATION_ADMIN;
import static com.vibecoding.karmadadashboard.fga.RelationshipAuthorizer.RELATION_MEMBER;
import static com.vibecoding.karmadadashboard.fga.RelationshipAuthorizer.RELATION_OWNER;
import static com.vibecoding.karmadadashboard.fga.RelationshipAuthorizer.TYPE_CLUSTER;
import static com.vibecoding.karmadadashboard.fga.RelationshipAuthorizer.TYPE_DASHBOARD;

/**
 * OpenFGA 기반 대시보드 / 클러스터 권한 확인. authorizer 빈이 없으면 FGA 비활성
 */
@Service
public class AuthorizationService {

    private static final Logger log = LoggerFactory.getLogger(AuthorizationService.class);

    private final RelationshipAuthorizer authorizer;

    public AuthorizationService(ObjectProvider<RelationshipAuthorizer> authorizer) {
        this(authorizer.getIfAvailable());
    }

    AuthorizationService(RelationshipAuthorizer authorizer) {
        this.authorizer = authorizer;
    }

    public boolean isEnabled() {
        return authorizer != null;
    }

    public boolean isDashboardAdmin(String username) {
        return requireAuthorizer().check(username, RELATION_ADMIN, TYPE_DASHBOARD, DASHBOARD_ID);
    }

    public boolean hasClusterRelation(String username, String relation, String clusterName) {
        return requireAuthorizer().check(username, relation, TYPE_CLUSTER, clusterName);
    }

    /**
     * 대시보드 admin 이거나 클러스터 owner / member 이면 접근 가능
     */
    public boolean hasClusterAccess(String username, String clusterName) {
        return isDashboardAdmin(username)
            || hasClusterRelation(username, RELATION_OWNER, clusterName)
            || hasClusterRelation(username, RELATION_MEMBER, clusterName);
    }

    public void grantDashboardAdmin(String username) {
        requireAuthorizer().writeTuple(username, RELATION_ADMIN, TYPE_DASHBOARD, DASHBOARD_ID);
    }

    public void revokeDashboardAdmin(String username) {
        requireAuthorizer().deleteTuple(username, RELATION_ADMIN, TYPE_DASHBOARD, DASHBOARD_ID);
    }

    public void grantClusterRelation(String username, String relation, String clusterName) {
        requireAuthorizer().writeTuple(username, relation, TYPE_CLUSTER, clusterName);
    }

    public void revokeClusterRelation(String username, String relation, String clusterName) {
        requireAuthorizer().deleteTuple(username, relation, TYPE_CLUSTER, clusterName);
    }

    /**
     * 튜플이 이미 있거나 없어서 실패하는 쓰기는 경고만 남긴다
     */
    public boolean tryWrite(String username, String relation, String objectType, String objectId) {
        if (!isEnabled()) {
            return false;
        }
        try {
            authorizer.writeTuple(username, relation, objectType, objectId);
            return true;
        } catch (AuthorizationException e) {
            log.warn("Failed to write tuple {} {} {}:{}: {}", username, relation, objectType, objectId, e.getMessage());
            return false;
        }
    }

    public boolean tryDelete(String username, String relation, String objectType, String objectId) {
        if (!isEnabled()) {
            return false;
        }
        try {
            authorizer.deleteTuple(username, relation, objectType, objectId);
            return true;
        } catch (AuthorizationException e) {
            log.debug("Tuple not deleted {} {} {}:{}: {}", username, relation, objectType, objectId, e.getMessage());
            return false;
        }
    }

    private RelationshipAuthorizer requireAuthorizer() {
        if (authorizer == null) {
            throw new AuthorizationException("Authorization service unavailable");
        }
        return authorizer;
    }
}
