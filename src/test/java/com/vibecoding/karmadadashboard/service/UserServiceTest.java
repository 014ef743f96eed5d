package com.vibecoding.karmadadashboard.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vibecoding.karmadadashboard.exception.BadRequestException;
import com.vibecoding.karmadadashboard.exception.StoreException;
import com.vibecoding.karmadadashboard.fga.InMemoryRelationshipAuthorizer;
import com.vibecoding.karmadadashboard.model.auth.CreateUserRequest;
import com.vibecoding.karmadadashboard.model.auth.UpdateUserRequest;
import com.vibecoding.karmadadashboard.model.auth.UserInfo;
import com.vibecoding.karmadadashboard.repository.InMemoryKeyValueStore;
import com.vibecoding.karmadadashboard.repository.UserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class UserServiceTest {

    private UserRepository userRepository;
    private InMemoryRelationshipAuthorizer authorizer;
    private UserService userService;

    @BeforeEach
    void setUp() {
        userRepository = new UserRepository(new InMemoryKeyValueStore(), new ObjectMapper(), new BCryptPasswordEncoder(4));
        authorizer = new InMemoryRelationshipAuthorizer();
        userService = new UserService(userRepository, new AuthorizationService(authorizer));
    }

    private boolean isFgaAdmin(String username) {
        return authorizer.check(username, "admin", "dashboard", "dashboard");
    }

    @Test
    void createAdminWritesTuple() {
        UserInfo info = userService.createUser(new CreateUserRequest("carol", "carol@example.com", "pw", List.of("admin")));

        assertEquals("carol", info.getId());
        assertEquals("admin", info.getRole());
        assertTrue(info.isEnabled());
        assertTrue(info.getCreatedTimestamp() > 0);
        assertTrue(isFgaAdmin("carol"));
    }

    @Test
    void createWithoutRolesIsBasicUser() {
        UserInfo info = userService.createUser(new CreateUserRequest("dave", null, "pw", null));

        assertEquals("basic_user", info.getRole());
        assertFalse(isFgaAdmin("dave"));
    }

    @Test
    void demotionRemovesAdminTuple() {
        userService.createUser(new CreateUserRequest("carol", null, "pw", List.of("admin")));

        UserInfo updated = userService.updateUser("carol", new UpdateUserRequest("new@example.com", List.of("basic_user")));

        assertEquals("basic_user", updated.getRole());
        assertEquals("new@example.com", updated.getEmail());
        assertFalse(isFgaAdmin("carol"));
    }

    @Test
    void promotionToleratesExistingTuple() {
        userService.createUser(new CreateUserRequest("carol", null, "pw", List.of("admin")));

        UserInfo updated = userService.updateUser("carol", new UpdateUserRequest(null, List.of("admin")));

        assertEquals("admin", updated.getRole());
        assertTrue(isFgaAdmin("carol"));
    }

    @Test
    void adminUserCannotBeDeleted() {
        BadRequestException ex = assertThrows(BadRequestException.class, () -> userService.deleteUser("admin"));
        assertEquals("cannot delete the admin user", ex.getMessage());
    }

    @Test
    void deleteRemovesUserAndTuple() {
        userService.createUser(new CreateUserRequest("carol", null, "pw", List.of("admin")));

        userService.deleteUser("carol");

        assertFalse(userRepository.exists("carol"));
        assertFalse(isFgaAdmin("carol"));
        assertThrows(StoreException.class, () -> userService.deleteUser("carol"));
    }

    @Test
    void resetPasswordChangesCredentials() {
        userService.createUser(new CreateUserRequest("erin", null, "old", null));

        userService.resetPassword("erin", "new");

        assertTrue(userRepository.verifyPassword("erin", "new"));
    }

    @Test
    void rolesAreFixed() {
        assertEquals(2, userService.listRoles().size());
        assertEquals("admin", userService.listRoles().get(0).getName());
    }
}
