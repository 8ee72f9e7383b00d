package win.ixuni.gcsmock.core.model;

import lombok.Builder;
import lombok.Value;

/**
 * Upload options
 */
@Value
@Builder
public class UploadOptions {

    /**
     * Destination object name
     * <p>
     * Typed as {@link Object} because the real client also accepts a file handle here.
     * Only {@link String} names are supported; anything else fails the upload.
     * When {@code null}, the base name of the source file is used.
     */
    Object destination;

    /**
     * Applied with setMetadata semantics after the contents are stored
     */
    ObjectMetadata metadata;
}
