package win.ixuni.gcsmock.core.util;

import win.ixuni.gcsmock.core.model.SignedUrlConfig;

/**
 * Storage request validation utility class
 */
public class StorageValidationUtils {

    /**
     * Verify a bucket name
     *
     * @param name bucket name
     * @return 错误信息，如果验证通过返回 null
     */
    public static String validateBucketName(String name) {
        if (name == null || name.isEmpty()) {
            return "Bucket name must not be empty";
        }
        return null;
    }

    /**
     * Verify an object name
     *
     * @param name object name
     * @return 错误信息，如果验证通过返回 null
     */
    public static String validateObjectName(String name) {
        if (name == null || name.isEmpty()) {
            return "Object name must not be empty";
        }
        return null;
    }

    /**
     * Verify a signed URL configuration
     *
     * @param config signed URL configuration
     * @return 错误信息，如果验证通过返回 null
     */
    public static String validateSignedUrlConfig(SignedUrlConfig config) {
        if (config == null) {
            return "Signed URL config is required";
        }
        if (config.getAction() == null) {
            return "Signed URL action is required";
        }
        if (config.getExpires() == null) {
            return "Signed URL expiration is required";
        }
        return null;
    }
}
