package win.ixuni.gcsmock.core.exception;

import lombok.Getter;

/**
 * Object not found exception
 */
@Getter
public class ObjectNotFoundException extends GcsMockException {

    private final String bucketName;
    private final String objectName;

    public ObjectNotFoundException(String bucketName, String objectName) {
        super("NoSuchKey", "No such file: " + bucketName + "/" + objectName, 404);
        this.bucketName = bucketName;
        this.objectName = objectName;
    }
}
