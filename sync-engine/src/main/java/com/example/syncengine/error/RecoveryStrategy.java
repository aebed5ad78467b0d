package com.example.syncengine.error;

/**
 * A suggested way out of a failure.
 *
 * @param automatic true when the system can apply it without the user
 */
public record RecoveryStrategy(
        RecoveryAction action,
        String label,
        String description,
        boolean automatic
) {

    public static RecoveryStrategy auto(RecoveryAction action, String label, String description) {
        return new RecoveryStrategy(action, label, description, true);
    }

    public static RecoveryStrategy manual(RecoveryAction action, String label, String description) {
        return new RecoveryStrategy(action, label, description, false);
    }
}
