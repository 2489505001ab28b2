package by.greenmobile.retainingwall.entity;

import lombok.Value;

/**
 * Один участок стенки (снизу вверх). Дюймы.
 */
@Value
public class WallSection {
    int heightAboveFooting;
    int width;
}
