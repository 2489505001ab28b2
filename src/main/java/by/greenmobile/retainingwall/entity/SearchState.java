package by.greenmobile.retainingwall.entity;

/**
 * Состояние перебора кандидатов: SEARCHING -> CONVERGED | INFEASIBLE.
 */
public enum SearchState {
    SEARCHING,
    CONVERGED,
    INFEASIBLE
}
