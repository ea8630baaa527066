package io.aegis.core.confirmation;

/**
 * Channel that shows a confirmation prompt to a human and returns the raw answer.
 */
@FunctionalInterface
public interface ConfirmationPort {

    /**
     * Blocks until the human answers.
     *
     * @param prompt text produced by {@link ConfirmationManager#getConfirmationPrompt}
     * @return the answer as typed, or {@code null} when no answer could be obtained
     */
    String requestConfirmation(String prompt);

    static ConfirmationPort answering(String answer) {
        return prompt -> answer;
    }
}
