package space.ketterling.airsense.service;

/**
 * An unexpected internal fault while producing a forecast. The cause is kept for logs
 * but is not shown to API callers.
 */
public class ServiceUnavailableException extends RuntimeException {
    public ServiceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
