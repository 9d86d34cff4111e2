package com.warden.controlplane.domain;

/**
 * Failure of a control-plane operation.
 *
 * <p>User-visible exceptions carry a message the caller can act on and is shown as is. Other
 * exceptions carry a short outer message; the cause is logged and never returned.
 */
public class ServiceException extends RuntimeException {

    private final ErrorKind kind;
    private final boolean userVisible;

    public ServiceException(ErrorKind kind, String message, boolean userVisible, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.userVisible = userVisible;
    }

    public static ServiceException authFailed(String message) {
        return new ServiceException(ErrorKind.AUTH_FAILED, message, true, null);
    }

    public static ServiceException forbidden(String message) {
        return new ServiceException(ErrorKind.FORBIDDEN, message, true, null);
    }

    public static ServiceException badRequest(String message) {
        return new ServiceException(ErrorKind.BAD_REQUEST, message, true, null);
    }

    public static ServiceException badRequest(String message, Throwable cause) {
        return new ServiceException(ErrorKind.BAD_REQUEST, message, true, cause);
    }

    public static ServiceException notFound(String message) {
        return new ServiceException(ErrorKind.NOT_FOUND, message, true, null);
    }

    public static ServiceException conflict(String message) {
        return new ServiceException(ErrorKind.CONFLICT, message, true, null);
    }

    public static ServiceException precondition(String message) {
        return new ServiceException(ErrorKind.PRECONDITION, message, true, null);
    }

    public static ServiceException exhausted(String message) {
        return new ServiceException(ErrorKind.EXHAUSTED, message, true, null);
    }

    public static ServiceException unavailable(String message) {
        return new ServiceException(ErrorKind.UNAVAILABLE, message, true, null);
    }

    public static ServiceException internal(String message) {
        return new ServiceException(ErrorKind.INTERNAL, message, false, null);
    }

    public static ServiceException internal(String message, Throwable cause) {
        return new ServiceException(ErrorKind.INTERNAL, message, false, cause);
    }

    public static ServiceException unknown(String message, Throwable cause) {
        return new ServiceException(ErrorKind.UNKNOWN, message, false, cause);
    }

    public ErrorKind kind() {
        return kind;
    }

    public boolean userVisible() {
        return userVisible;
    }
}
