package win.ixuni.gcsmock.core.model;

import lombok.Builder;
import lombok.Value;

/**
 * Save options
 */
@Value
@Builder
public class SaveOptions {

    /**
     * Replaces the whole stored metadata when set (no merge)
     */
    ObjectMetadata metadata;

    public static SaveOptions withMetadata(ObjectMetadata metadata) {
        return SaveOptions.builder().metadata(metadata).build();
    }
}
