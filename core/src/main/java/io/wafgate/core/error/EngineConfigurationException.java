package io.wafgate.core.error;

/**
 * Thrown by an {@code InspectionEngineFactory} when it rejects the assembled
 * engine settings (bad rule syntax, unsupported option, and so on).
 */
public final class EngineConfigurationException extends InitializationException {

    private static final long serialVersionUID = 1L;

    public EngineConfigurationException(String message) {
        super(message);
    }

    public EngineConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
