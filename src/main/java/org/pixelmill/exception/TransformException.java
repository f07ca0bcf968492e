package org.pixelmill.exception;

/**
 * A transform stage rejected its input. Carries the name of the stage that failed.
 */
public class TransformException extends Exception {

    private final String stageName;

    public TransformException(final String stageName, final Throwable cause) {
        super("Stage " + stageName + " failed: " + cause.getMessage(), cause);
        this.stageName = stageName;
    }

    public String getStageName() {
        return stageName;
    }
}
