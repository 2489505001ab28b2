package by.greenmobile.retainingwall.entity;

public enum InfeasibilityReason {
    /** Все кандидаты в пределах геометрических ограничений не прошли проверку устойчивости. */
    NO_STABLE_CANDIDATE,
    /** Уже минимальный фундамент шире практического максимума. */
    FOOTING_LIMIT_EXCEEDED,
    /** Исчерпан лимит итераций до того, как найден устойчивый кандидат. */
    ITERATION_LIMIT_REACHED
}
