package com.clinicmate.backend.modules.auth.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

import com.clinicmate.backend.modules.auth.domain.ClinicUser;
import com.clinicmate.backend.modules.auth.domain.PasswordHistory;
import com.clinicmate.backend.modules.auth.infrastructure.persistence.PasswordHistoryRepository;
import com.nulabinc.zxcvbn.Strength;
import com.nulabinc.zxcvbn.Zxcvbn;

import org.springframework.data.domain.PageRequest;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

/**
 * Strength and reuse rules for new passwords.
 */
@Service
@Transactional(noRollbackFor = ResponseStatusException.class)
public class PasswordPolicyService {

    private final PasswordHistoryRepository passwordHistoryRepository;
    private final PasswordEncoder passwordEncoder;
    private final AuthPolicyProperties properties;
    private final Clock clock;
    private final Zxcvbn zxcvbn = new Zxcvbn();

    public PasswordPolicyService(
            PasswordHistoryRepository passwordHistoryRepository,
            PasswordEncoder passwordEncoder,
            AuthPolicyProperties properties,
            Clock clock
    ) {
        this.passwordHistoryRepository = passwordHistoryRepository;
        this.passwordEncoder = passwordEncoder;
        this.properties = properties;
        this.clock = clock;
    }

    public void assertStrong(String password, ClinicUser user) {
        AuthPolicyProperties.Password policy = properties.password();
        if (password == null || password.length() < policy.minLength()) {
            throw new AuthException(AuthErrorCode.WEAK_PASSWORD,
                    "Password must be at least " + policy.minLength() + " characters long");
        }

        Strength strength = zxcvbn.measure(password, userInputs(user));
        if (strength.getScore() < policy.minScore()) {
            List<String> suggestions = strength.getFeedback().getSuggestions();
            String detail = suggestions == null || suggestions.isEmpty()
                    ? AuthErrorCode.WEAK_PASSWORD.defaultMessage()
                    : AuthErrorCode.WEAK_PASSWORD.defaultMessage() + ": " + String.join(" ", suggestions);
            throw new AuthException(AuthErrorCode.WEAK_PASSWORD, detail);
        }
    }

    /**
     * Rejects the current password and the last {@code history-depth} ones.
     */
    @Transactional(readOnly = true, noRollbackFor = ResponseStatusException.class)
    public void assertNotReused(String password, ClinicUser user) {
        if (passwordEncoder.matches(password, user.getPasswordHash())) {
            throw new AuthException(AuthErrorCode.PASSWORD_REUSE);
        }
        List<String> recent = passwordHistoryRepository.findRecentHashes(
                user.getId(), PageRequest.of(0, properties.password().historyDepth()));
        for (String hash : recent) {
            if (passwordEncoder.matches(password, hash)) {
                throw new AuthException(AuthErrorCode.PASSWORD_REUSE);
            }
        }
    }

    public void recordPreviousPassword(ClinicUser user, String previousHash) {
        passwordHistoryRepository.save(new PasswordHistory(user, previousHash, OffsetDateTime.now(clock)));
    }

    private static List<String> userInputs(ClinicUser user) {
        List<String> inputs = new ArrayList<>();
        if (user == null) {
            return inputs;
        }
        addIfPresent(inputs, user.getEmail());
        if (user.getEmail() != null && user.getEmail().contains("@")) {
            addIfPresent(inputs, user.getEmail().substring(0, user.getEmail().indexOf('@')));
        }
        addIfPresent(inputs, user.getFirstName());
        addIfPresent(inputs, user.getLastName());
        addIfPresent(inputs, user.getEmployeeId());
        return inputs;
    }

    private static void addIfPresent(List<String> inputs, String value) {
        if (value != null && !value.isBlank()) {
            inputs.add(value);
        }
    }
}
