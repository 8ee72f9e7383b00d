package win.ixuni.gcsmock.core.exception;

/**
 * Upload destination given as something other than a plain object name
 */
public class UnsupportedDestinationTypeException extends GcsMockException {

    public UnsupportedDestinationTypeException(Class<?> destinationType) {
        super("UnsupportedDestinationType",
                "Type " + destinationType.getSimpleName()
                        + " for `destination` option is not supported, use a String object name instead",
                400);
    }
}
