package com.vibecoding.karmadadashboard.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vibecoding.karmadadashboard.exception.DashboardAuthException;
import com.vibecoding.karmadadashboard.exception.K8sResourceNotFoundException;
import com.vibecoding.karmadadashboard.fga.InMemoryRelationshipAuthorizer;
import com.vibecoding.karmadadashboard.model.cluster.ClusterUser;
import com.vibecoding.karmadadashboard.model.cluster.ClusterUserList;
import com.vibecoding.karmadadashboard.model.cluster.ClusterUsersRequest;
import com.vibecoding.karmadadashboard.repository.InMemoryKeyValueStore;
import com.vibecoding.karmadadashboard.repository.UserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ClusterUserServiceTest {

    private static final String CLUSTER = "member1";

    private ClusterService clusterService;
    private InMemoryRelationshipAuthorizer authorizer;
    private ClusterUserService service;

    @BeforeEach
    void setUp() {
        clusterService = mock(ClusterService.class);
        UserRepository userRepository =
            new UserRepository(new InMemoryKeyValueStore(), new ObjectMapper(), new BCryptPasswordEncoder(4));
        userRepository.create("admin", "pw", null, "admin");
        userRepository.create("olivia", "pw", "olivia@example.com", "basic_user");
        userRepository.create("mike", "pw", null, "basic_user");
        userRepository.create("nobody", "pw", null, "basic_user");

        authorizer = new InMemoryRelationshipAuthorizer();
        authorizer.writeTuple("admin", "admin", "dashboard", "dashboard");
        authorizer.writeTuple("olivia", "owner", "cluster", CLUSTER);
        authorizer.writeTuple("mike", "member", "cluster", CLUSTER);

        service = new ClusterUserService(clusterService, userRepository, new AuthorizationService(authorizer));
    }

    private static ClusterUser find(ClusterUserList list, String username) {
        return list.getUsers().stream()
            .filter(u -> u.getUsername().equals(username))
            .findFirst()
            .orElse(null);
    }

    @Test
    void listsUsersWithAnyRelation() {
        ClusterUserList list = service.getClusterUsers("mike", CLUSTER);

        assertEquals(3, list.getUsers().size());
        assertEquals(List.of("admin"), find(list, "admin").getRoles());
        assertEquals(List.of("owner"), find(list, "olivia").getRoles());
        assertEquals("olivia@example.com", find(list, "olivia").getDisplayName());
        assertEquals(List.of("member"), find(list, "mike").getRoles());
    }

    @Test
    void viewingRequiresClusterAccess() {
        DashboardAuthException ex = assertThrows(DashboardAuthException.class,
            () -> service.getClusterUsers("nobody", CLUSTER));

        assertEquals(HttpStatus.FORBIDDEN, ex.getStatus());
    }

    @Test
    void anonymousCallerIsUnauthorized() {
        DashboardAuthException ex = assertThrows(DashboardAuthException.class,
            () -> service.getClusterUsers(null, CLUSTER));

        assertEquals(HttpStatus.UNAUTHORIZED, ex.getStatus());
    }

    @Test
    void missingClusterPropagates() {
        when(clusterService.getClusterResource("ghost"))
            .thenThrow(new K8sResourceNotFoundException("cluster", null, "ghost"));

        assertThrows(K8sResourceNotFoundException.class, () -> service.listClusterUsers("ghost"));
    }

    @Test
    void ownerReplacesRoles() {
        ClusterUsersRequest request = new ClusterUsersRequest(List.of(
            new ClusterUsersRequest.UserRoles("mike", List.of("write")),
            new ClusterUsersRequest.UserRoles("nobody", List.of("admin"))));

        ClusterUserList list = service.updateClusterUsers("olivia", CLUSTER, request);

        assertEquals(List.of("member"), find(list, "mike").getRoles());
        assertEquals(List.of("owner"), find(list, "nobody").getRoles());
    }

    @Test
    void emptyRolesRevokeAccess() {
        ClusterUsersRequest request = new ClusterUsersRequest(List.of(
            new ClusterUsersRequest.UserRoles("mike", List.of())));

        service.updateClusterUsers("admin", CLUSTER, request);

        assertFalse(authorizer.check("mike", "member", "cluster", CLUSTER));
    }

    @Test
    void dashboardAdminIsNeverModified() {
        ClusterUsersRequest request = new ClusterUsersRequest(List.of(
            new ClusterUsersRequest.UserRoles("admin", List.of("member"))));

        service.updateClusterUsers("olivia", CLUSTER, request);

        assertFalse(authorizer.check("admin", "member", "cluster", CLUSTER));
        assertTrue(authorizer.check("admin", "admin", "dashboard", "dashboard"));
    }

    @Test
    void memberCannotManageUsers() {
        ClusterUsersRequest request = new ClusterUsersRequest(List.of(
            new ClusterUsersRequest.UserRoles("nobody", List.of("member"))));

        DashboardAuthException ex = assertThrows(DashboardAuthException.class,
            () -> service.updateClusterUsers("mike", CLUSTER, request));

        assertEquals(HttpStatus.FORBIDDEN, ex.getStatus());
    }

    @Test
    void invalidRoleIsRejectedBeforeAnyWrite() {
        ClusterUsersRequest request = new ClusterUsersRequest(List.of(
            new ClusterUsersRequest.UserRoles("nobody", List.of("member")),
            new ClusterUsersRequest.UserRoles("mike", List.of("superuser"))));

        DashboardAuthException ex = assertThrows(DashboardAuthException.class,
            () -> service.updateClusterUsers("admin", CLUSTER, request));

        assertEquals(HttpStatus.BAD_REQUEST, ex.getStatus());
        assertEquals("invalid role: superuser", ex.getMessage());
        assertFalse(authorizer.check("nobody", "member", "cluster", CLUSTER));
    }

    @Test
    void emptyUpdateIsBadRequest() {
        DashboardAuthException ex = assertThrows(DashboardAuthException.class,
            () -> service.updateClusterUsers("admin", CLUSTER, new ClusterUsersRequest(List.of())));

        assertEquals("users list cannot be empty", ex.getMessage());
    }
}
