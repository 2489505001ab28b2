package by.greenmobile.retainingwall.controller;

public class DesignNotFoundException extends RuntimeException {

    public DesignNotFoundException(String requestId) {
        super("No design result for request id " + requestId);
    }
}
