package com.vibecoding.karmadadashboard.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vibecoding.karmadadashboard.exception.StoreException;
import com.vibecoding.karmadadashboard.model.auth.User;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class UserRepositoryTest {

    private InMemoryKeyValueStore store;
    private UserRepository repository;

    @BeforeEach
    void setUp() {
        store = new InMemoryKeyValueStore();
        repository = new UserRepository(store, new ObjectMapper(), new BCryptPasswordEncoder(4));
    }

    @Test
    void createStoresHashedPassword() {
        User user = repository.create("alice", "secret", "alice@example.com", "basic_user");

        assertNotEquals("secret", user.getPasswordHash());
        assertTrue(store.get(UserRepository.USER_KEY_PREFIX + "alice").isPresent());
        assertTrue(repository.verifyPassword("alice", "secret"));
        assertFalse(repository.verifyPassword("alice", "wrong"));
    }

    @Test
    void createRejectsDuplicateUser() {
        repository.create("alice", "secret", null, "basic_user");

        StoreException ex = assertThrows(StoreException.class,
            () -> repository.create("alice", "other", null, "basic_user"));
        assertEquals("user alice already exists", ex.getMessage());
    }

    @Test
    void getMissingUserFails() {
        StoreException ex = assertThrows(StoreException.class, () -> repository.get("ghost"));
        assertEquals("user ghost not found", ex.getMessage());
    }

    @Test
    void verifyFailsWhenHashIsEmpty() {
        store.put(UserRepository.USER_KEY_PREFIX + "bob", "{\"username\":\"bob\",\"passwordHash\":\"\"}");

        assertThrows(StoreException.class, () -> repository.verifyPassword("bob", "x"));
    }

    @Test
    void listSkipsUnparseableEntries() {
        repository.create("alice", "secret", null, "admin");
        store.put(UserRepository.USER_KEY_PREFIX + "broken", "not-json");

        List<User> users = repository.list();

        assertEquals(1, users.size());
        assertEquals("alice", users.get(0).getUsername());
    }

    @Test
    void updatePasswordReplacesHash() {
        repository.create("alice", "secret", null, "basic_user");

        repository.updatePassword("alice", "changed");

        assertTrue(repository.verifyPassword("alice", "changed"));
        assertFalse(repository.verifyPassword("alice", "secret"));
    }
}
