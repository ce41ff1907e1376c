package com.zerodayguardian.passwordrisk;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Zero-Day Guardian Password Risk Engine.
 *
 * <p>
 * Spring Boot application that scores password risk from structural
 * heuristics, checks an offline breach corpus, optionally queries the Have I
 * Been Pwned range API using k-anonymity, and proposes stronger
 * replacements. Runs as an HTTP service by default, or as a one-shot CLI
 * under the {@code cli} profile.
 * </p>
 *
 * @author Naveed Gung
 */
@SpringBootApplication
public class PasswordRiskApplication {

    public static void main(String[] args) {
        SpringApplication.run(PasswordRiskApplication.class, args);
    }
}
