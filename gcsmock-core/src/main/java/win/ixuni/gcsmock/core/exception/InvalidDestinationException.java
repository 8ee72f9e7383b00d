package win.ixuni.gcsmock.core.exception;

/**
 * Copy destination is neither a name, a bucket nor a file of the same storage
 */
public class InvalidDestinationException extends GcsMockException {

    public InvalidDestinationException(String message) {
        super("InvalidDestination", message, 400);
    }
}
