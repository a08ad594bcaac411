package com.clinicmate.backend.support;

import java.time.Clock;
import java.time.OffsetDateTime;

import com.clinicmate.backend.modules.auth.domain.ClinicUser;
import com.clinicmate.backend.modules.auth.domain.Role;
import com.clinicmate.backend.modules.auth.domain.RoleAssignment;
import com.clinicmate.backend.modules.auth.infrastructure.persistence.ClinicUserRepository;

import jakarta.persistence.EntityManager;

import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
@Transactional
public class TestUserFactory {

    private final ClinicUserRepository clinicUserRepository;
    private final EntityManager entityManager;
    private final PasswordEncoder passwordEncoder;
    private final Clock clock;

    public TestUserFactory(
            ClinicUserRepository clinicUserRepository,
            EntityManager entityManager,
            PasswordEncoder passwordEncoder,
            Clock clock
    ) {
        this.clinicUserRepository = clinicUserRepository;
        this.entityManager = entityManager;
        this.passwordEncoder = passwordEncoder;
        this.clock = clock;
    }

    public ClinicUser ensureUser(String email, String rawPassword, String... roleCodes) {
        ClinicUser user = clinicUserRepository.findByEmailIgnoreCase(email)
                .orElseGet(ClinicUser::new);
        user.setEmail(email);
        user.setFirstName("Test");
        user.setLastName(email.substring(0, email.indexOf('@')));
        user.setPasswordHash(passwordEncoder.encode(rawPassword));
        user.setActive(true);
        ClinicUser saved = clinicUserRepository.save(user);
        for (String roleCode : roleCodes) {
            grantRole(saved, roleCode);
        }
        return saved;
    }

    public void grantRole(ClinicUser user, String roleCode) {
        Role role = entityManager.find(Role.class, roleCode);
        if (role == null) {
            throw new IllegalArgumentException("Unknown role " + roleCode);
        }
        RoleAssignment assignment = new RoleAssignment();
        assignment.setUser(user);
        assignment.setRole(role);
        assignment.setValidFrom(OffsetDateTime.now(clock).minusDays(1));
        entityManager.persist(assignment);
    }
}
