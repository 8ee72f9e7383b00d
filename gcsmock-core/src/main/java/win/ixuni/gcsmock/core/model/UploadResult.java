package win.ixuni.gcsmock.core.model;

import lombok.Value;
import win.ixuni.gcsmock.core.api.GcsFile;

/**
 * Upload result
 */
@Value
public class UploadResult {

    GcsFile file;

    ObjectMetadata metadata;
}
