package com.lawcheck.config;

import com.lawcheck.conflict.ConflictDetector;
import com.lawcheck.constraint.ConstraintBackend;
import com.lawcheck.constraint.ConstraintBackends;
import com.lawcheck.principle.Principles;
import com.lawcheck.verify.StatuteVerifier;
import com.lawcheck.verify.VerificationCache;
import com.lawcheck.verify.VerifierSettings;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.HashSet;

@Configuration
@EnableConfigurationProperties(VerifierProperties.class)
public class VerifierConfiguration {

    @Bean
    public ConstraintBackend constraintBackend(VerifierProperties properties) {
        VerifierSettings settings = properties.toSettings();
        return ConstraintBackends.create(properties.getSolver(), properties.getSolverTimeout(), settings.limits());
    }

    @Bean
    public VerificationCache verificationCache(VerifierProperties properties) {
        return new VerificationCache(properties.getCache().getMaximumSize());
    }

    /**
     * Verifier with the configured built-in principles and the default
     * conflict rules. The cache is handed over only when enabled.
     */
    @Bean
    public StatuteVerifier statuteVerifier(ConstraintBackend backend,
                                           VerificationCache cache,
                                           VerifierProperties properties) {
        return new StatuteVerifier(
            backend,
            properties.toSettings(),
            properties.getCache().isEnabled() ? cache : null,
            Principles.defaults(properties.getPrinciples(), new HashSet<>(properties.getProtectedAttributes())),
            ConflictDetector.defaultRules());
    }
}
