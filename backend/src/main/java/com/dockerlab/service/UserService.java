package com.dockerlab.service;

import com.dockerlab.exception.EmailAlreadyRegisteredException;
import com.dockerlab.exception.InvalidRequestException;
import com.dockerlab.exception.UserNotFoundException;
import com.dockerlab.model.User;
import com.dockerlab.model.UserPatch;
import com.dockerlab.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

// ========== User Service ==========
@Service
@RequiredArgsConstructor
@Slf4j
public class UserService {

    private final UserRepository userRepository;

    public List<User> getAllUsers() {
        return userRepository.findAll();
    }

    public User getUserById(long id) {
        return userRepository.findById(id)
            .orElseThrow(() -> new UserNotFoundException(id));
    }

    @Transactional
    public User createUser(String name, String email) {
        User saved;
        try {
            saved = userRepository.insert(name, email);
        } catch (DuplicateKeyException e) {
            throw new EmailAlreadyRegisteredException(email, e);
        }

        log.info("Created user: {} (ID: {})", saved.getEmail(), saved.getId());
        return saved;
    }

    @Transactional
    public User updateUser(long id, UserPatch patch) {
        if (patch.isEmpty()) {
            throw new InvalidRequestException("At least one field (name or email) is required for an update");
        }

        User updated;
        try {
            updated = userRepository.update(id, patch)
                .orElseThrow(() -> new UserNotFoundException(id));
        } catch (DuplicateKeyException e) {
            throw new EmailAlreadyRegisteredException(patch.email().orElse(""), e);
        }

        log.info("Updated user: {} (fields: name={}, email={})",
            id, patch.name().isPresent(), patch.email().isPresent());
        return updated;
    }

    @Transactional
    public User deleteUser(long id) {
        User deleted = userRepository.deleteById(id)
            .orElseThrow(() -> new UserNotFoundException(id));

        log.info("Deleted user: {}", id);
        return deleted;
    }
}
