package com.z254.butterfly.drift.attribution;

import com.z254.butterfly.drift.config.DriftProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Decides whether a changer identity belongs to automation or to a human.
 * <p>
 * The automation account pattern is anchored at the start of the full raw
 * identity, e.g. {@code ^svc-.*} matches {@code svc-terraform@proj.iam}.
 */
@Component
public class ChangerClassifier {

    private final Pattern automationAccountPattern;

    @Autowired
    public ChangerClassifier(DriftProperties properties) {
        this(properties.getAutomationAccountPattern());
    }

    ChangerClassifier(String automationAccountPattern) {
        this.automationAccountPattern = Pattern.compile(automationAccountPattern);
    }

    /**
     * Classify a changer identity.
     *
     * @param identity the raw identity from the audit log
     * @return the classification, empty when no login can be derived
     */
    public Optional<Classification> classify(String identity) {
        return extractLogin(identity)
                .map(login -> new Classification(login, isAutomation(identity)));
    }

    /**
     * Short login, the part of the identity before {@code @}.
     * Empty when that part is blank.
     */
    public Optional<String> extractLogin(String identity) {
        if (identity == null) {
            return Optional.empty();
        }
        int at = identity.indexOf('@');
        String login = at >= 0 ? identity.substring(0, at) : identity;
        return login.isBlank() ? Optional.empty() : Optional.of(login);
    }

    public boolean isAutomation(String identity) {
        return identity != null && automationAccountPattern.matcher(identity).lookingAt();
    }

    public record Classification(String login, boolean automation) {

        public boolean manual() {
            return !automation;
        }
    }
}
