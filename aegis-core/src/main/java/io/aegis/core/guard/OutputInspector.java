package io.aegis.core.guard;

import java.util.List;
import java.util.Optional;

/**
 * Post-execution scan of process output for signatures that indicate the command hit
 * something it should not have touched.
 */
public final class OutputInspector {
    private final List<Signature> signatures;

    public OutputInspector(List<Signature> signatures) {
        this.signatures = signatures == null ? List.of() : List.copyOf(signatures);
    }

    public static OutputInspector sandboxDefaults() {
        return new OutputInspector(List.of(
            Signature.of("Permission denied"),
            Signature.of("Operation not permitted"),
            Signature.of("Device or resource busy"),
            Signature.of("No such file or directory"),
            Signature.of("Segmentation fault"),
            Signature.of("Bus error"),
            Signature.of("Illegal instruction")
        ));
    }

    public static OutputInspector safetyDefaults() {
        return new OutputInspector(List.of(
            Signature.of("Permission denied", "root"),
            Signature.of("Operation not permitted"),
            Signature.of("Device or resource busy")
        ));
    }

    public Optional<Signature> inspect(String output) {
        if (output == null || output.isEmpty()) {
            return Optional.empty();
        }
        return signatures.stream().filter(signature -> signature.matches(output)).findFirst();
    }

    public List<Signature> signatures() {
        return signatures;
    }

    /**
     * Matches when every fragment occurs somewhere in the output.
     */
    public record Signature(List<String> fragments) {

        public Signature {
            fragments = fragments == null ? List.of() : List.copyOf(fragments);
        }

        public static Signature of(String... fragments) {
            return new Signature(List.of(fragments));
        }

        public boolean matches(String output) {
            return !fragments.isEmpty() && fragments.stream().allMatch(output::contains);
        }

        public String describe() {
            return String.join(" + ", fragments);
        }
    }
}
