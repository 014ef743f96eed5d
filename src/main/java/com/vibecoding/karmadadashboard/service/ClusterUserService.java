package com.vibecoding.karmadadashboard.service;

import com.vibecoding.karmadadashboard.exception.AuthorizationException;
import com.vibecoding.karmadadashboard.exception.DashboardAuthException;
import com.vibecoding.karmadadashboard.model.auth.User;
import com.vibecoding.karmadadashboard.model.cluster.ClusterUser;
import com.vibecoding.karmadadashboard.model.cluster.ClusterUserList;
import com.vibecoding.karmadadashboard.model.cluster.ClusterUsersRequest;
import com.vibecoding.karmadadashboard.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static com.vibecoding.karmadadashboard.fga.RelationshipAuthorizer.RELATION_ADMIN;
import static com.vibecoding.karmadadashboard.fga.RelationshipAuthorizer.RELATION_MEMBER;
import static com.vibecoding.karmadadashboard.fga.RelationshipAuthorizer.RELATION_OWNER;
import static com.vibecoding.karmadadashboard.fga.RelationshipAuthorizer.TYPE_CLUSTER;

/**
 * 클러스터별 사용자 역할 (대시보드 admin, owner, member) 조회 및 변경
 */
@Service
@RequiredArgsConstructor
public class ClusterUserService {

    private static final Logger log = LoggerFactory.getLogger(ClusterUserService.class);

    static final Set<String> OWNER_ROLES = Set.of("owner", "admin");
    static final Set<String> MEMBER_ROLES = Set.of("member", "read", "write");

    private final ClusterService clusterService;
    private final UserRepository userRepository;
    private final AuthorizationService authorizationService;

    /**
     * 호출자는 클러스터 접근 권한이 있어야 한다 (401 / 403)
     */
    public ClusterUserList getClusterUsers(String caller, String clusterName) {
        requireCaller(caller);
        if (authorizationService.isEnabled() && !checkAccess(caller, clusterName)) {
            throw DashboardAuthException.forbidden("forbidden: insufficient permissions to view cluster users");
        }
        return listClusterUsers(clusterName);
    }

    /**
     * etcd 사용자마다 FGA 관계를 확인. FGA 가 꺼져 있으면 빈 목록
     */
    public ClusterUserList listClusterUsers(String clusterName) {
        clusterService.getClusterResource(clusterName);
        ClusterUserList result = new ClusterUserList();
        if (!authorizationService.isEnabled()) {
            log.debug("OpenFGA is disabled, no cluster users: {}", clusterName);
            return result;
        }

        for (User user : userRepository.list()) {
            String username = user.getUsername();
            List<String> roles = new ArrayList<>();
            try {
                if (authorizationService.isDashboardAdmin(username)) {
                    roles.add(RELATION_ADMIN);
                }
                if (authorizationService.hasClusterRelation(username, RELATION_OWNER, clusterName)) {
                    roles.add(RELATION_OWNER);
                }
                if (authorizationService.hasClusterRelation(username, RELATION_MEMBER, clusterName)) {
                    roles.add(RELATION_MEMBER);
                }
            } catch (AuthorizationException e) {
                log.error("Failed to check cluster roles: {} {}", username, clusterName, e);
                result.getErrors().add(e.getMessage());
                continue;
            }
            if (!roles.isEmpty()) {
                result.getUsers().add(new ClusterUser(username, user.getEmail(), user.getEmail(), roles));
            }
        }
        return result;
    }

    /**
     * 대시보드 admin 또는 클러스터 owner 만 변경 가능. admin 사용자의 역할은 건드리지 않는다
     */
    public ClusterUserList updateClusterUsers(String caller, String clusterName, ClusterUsersRequest request) {
        requireCaller(caller);
        if (!authorizationService.isEnabled()) {
            throw new DashboardAuthException(HttpStatus.INTERNAL_SERVER_ERROR, "Authorization service unavailable");
        }
        boolean allowed;
        try {
            allowed = authorizationService.isDashboardAdmin(caller)
                || authorizationService.hasClusterRelation(caller, RELATION_OWNER, clusterName);
        } catch (AuthorizationException e) {
            log.error("Failed to check access permission: {} {}", caller, clusterName, e);
            throw new DashboardAuthException(HttpStatus.INTERNAL_SERVER_ERROR, "failed to check permissions", e);
        }
        if (!allowed) {
            throw DashboardAuthException.forbidden("forbidden: insufficient permissions to manage cluster users");
        }

        if (request == null || request.getUsers() == null || request.getUsers().isEmpty()) {
            throw new DashboardAuthException(HttpStatus.BAD_REQUEST, "users list cannot be empty");
        }
        for (ClusterUsersRequest.UserRoles update : request.getUsers()) {
            for (String role : roles(update)) {
                if (!OWNER_ROLES.contains(role) && !MEMBER_ROLES.contains(role)) {
                    throw new DashboardAuthException(HttpStatus.BAD_REQUEST, "invalid role: " + role);
                }
            }
        }

        ClusterUserList current = listClusterUsers(clusterName);
        Set<String> dashboardAdmins = new HashSet<>();
        for (ClusterUser user : current.getUsers()) {
            if (user.getRoles().contains(RELATION_ADMIN)) {
                dashboardAdmins.add(user.getUsername());
            }
        }

        for (ClusterUsersRequest.UserRoles update : request.getUsers()) {
            String username = update.getUsername();
            if (dashboardAdmins.contains(username)) {
                log.info("Skipping dashboard admin: {}", username);
                continue;
            }
            authorizationService.tryDelete(username, RELATION_OWNER, TYPE_CLUSTER, clusterName);
            authorizationService.tryDelete(username, RELATION_MEMBER, TYPE_CLUSTER, clusterName);
            for (String role : roles(update)) {
                String relation = OWNER_ROLES.contains(role) ? RELATION_OWNER : RELATION_MEMBER;
                authorizationService.tryWrite(username, relation, TYPE_CLUSTER, clusterName);
            }
        }
        log.info("Cluster users updated: {} by {}", clusterName, caller);
        return listClusterUsers(clusterName);
    }

    private boolean checkAccess(String caller, String clusterName) {
        try {
            return authorizationService.hasClusterAccess(caller, clusterName);
        } catch (AuthorizationException e) {
            log.error("Failed to check access permission: {} {}", caller, clusterName, e);
            throw new DashboardAuthException(HttpStatus.INTERNAL_SERVER_ERROR, "failed to check permissions", e);
        }
    }

    private static List<String> roles(ClusterUsersRequest.UserRoles update) {
        return update.getRoles() != null ? update.getRoles() : List.of();
    }

    private static void requireCaller(String caller) {
        if (caller == null || caller.isEmpty()) {
            throw DashboardAuthException.unauthorized("unauthorized");
        }
    }
}
