package by.greenmobile.retainingwall.controller;

import java.util.List;

/**
 * Запрос не прошёл проверку диапазонов; до движка не доходит.
 */
public class InvalidDesignRequestException extends RuntimeException {

    private final List<String> violations;

    public InvalidDesignRequestException(List<String> violations) {
        super("Invalid design request: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
