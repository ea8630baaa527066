package io.aegis.core.middleware;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds credentials in free text. Informational matches (public keys, e-mail addresses) are
 * redacted but do not count as secrets.
 */
public final class SecretsDetector {
    private static final List<SecretPattern> PATTERNS = List.of(
        new SecretPattern("AWS_KEY", Pattern.compile("AKIA[0-9A-Z]{16,}"), true),
        new SecretPattern("JWT", Pattern.compile("eyJ[A-Za-z0-9_-]*\\.eyJ[A-Za-z0-9_-]*\\.[A-Za-z0-9_-]*"), true),
        new SecretPattern("PRIVATE_KEY", Pattern.compile("-----BEGIN\\s+(?:RSA\\s+)?PRIVATE\\s+KEY-----"), true),
        new SecretPattern("DB_URL", Pattern.compile("(?i)(?:mongodb|mysql|postgresql)://[^\\s'\"]+"), true),
        new SecretPattern("GITHUB_TOKEN", Pattern.compile("ghp_[A-Za-z0-9]{20,}"), true),
        new SecretPattern("SLACK_TOKEN", Pattern.compile("xoxb-[0-9]+-[0-9]+-[A-Za-z0-9]+"), true),
        new SecretPattern("STRIPE_KEY", Pattern.compile("sk[_-](?:test|live)?[_-]?[A-Za-z0-9]{10,}"), true),
        new SecretPattern(
            "API_KEY",
            Pattern.compile("(?i)(?:api_key|apikey|secret_key|access_token|auth_token)[=:][A-Za-z0-9_-]{20,}"),
            true
        ),
        new SecretPattern("PASSWORD", Pattern.compile("(?i)(?:password|passwd|pwd|pass)[=:][A-Za-z0-9!@#$%^&*()_+=\\-]{8,}"), true),
        new SecretPattern("SSH_PUBLIC_KEY", Pattern.compile("ssh-(?:rsa|dss|ed25519)\\s+[A-Za-z0-9+/]+={0,3}"), false),
        new SecretPattern("EMAIL", Pattern.compile("(?i)[a-z0-9._%+-]+@[a-z0-9.-]+\\.[a-z]{2,}"), false)
    );

    public boolean containsSecrets(String input) {
        if (input == null || input.isBlank()) {
            return false;
        }
        return PATTERNS.stream().anyMatch(pattern -> pattern.secret() && pattern.regex().matcher(input).find());
    }

    public List<String> findings(String input) {
        if (input == null || input.isBlank()) {
            return List.of();
        }
        return PATTERNS.stream()
            .filter(pattern -> pattern.regex().matcher(input).find())
            .map(SecretPattern::label)
            .toList();
    }

    public String redact(String input) {
        if (input == null || input.isBlank()) {
            return input == null ? "" : input;
        }
        String out = input;
        for (SecretPattern pattern : PATTERNS) {
            out = pattern.regex().matcher(out).replaceAll(Matcher.quoteReplacement("[REDACTED_" + pattern.label() + "]"));
        }
        return out;
    }

    private record SecretPattern(String label, Pattern regex, boolean secret) {
    }
}
