package by.greenmobile.retainingwall.entity;

/** Проверки устойчивости подпорной стенки. */
public enum StabilityCheck {
    OVERTURNING,
    SLIDING,
    BEARING
}
