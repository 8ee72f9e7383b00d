package win.ixuni.gcsmock.core.model;

import lombok.Builder;
import lombok.Value;

/**
 * Copy options
 */
@Value
@Builder
public class CopyOptions {

    /**
     * Overlaid on the source metadata before it is written to the destination
     */
    ObjectMetadata metadata;
}
