package by.greenmobile.retainingwall.service;

/**
 * Расчёт не уложился в таймаут вызывающей стороны.
 */
public class DesignTimeoutException extends RuntimeException {

    public DesignTimeoutException(long timeoutMs, Throwable cause) {
        super("Design run exceeded " + timeoutMs + " ms", cause);
    }
}
