package io.wafgate.core.error;

/**
 * The native request could not be projected into a {@code RequestView}. No
 * transaction is created for such a request.
 */
public final class RequestConversionException extends WafException {

    private static final long serialVersionUID = 1L;

    public RequestConversionException(String message) {
        super(message, Scope.REQUEST);
    }

    public RequestConversionException(String message, Throwable cause) {
        super(message, cause, Scope.REQUEST);
    }
}
