package org.carball.queryopt.driver;

/**
 * Raised by a {@link DatabaseDriver} when a statement cannot be executed.
 */
public class DriverException extends RuntimeException {

    public DriverException(String message) {
        super(message);
    }

    public DriverException(String message, Throwable cause) {
        super(message, cause);
    }
}
