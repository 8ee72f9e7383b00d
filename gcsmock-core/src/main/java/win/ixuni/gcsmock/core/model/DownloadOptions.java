package win.ixuni.gcsmock.core.model;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;

/**
 * Download options
 */
@Value
@Builder
public class DownloadOptions {

    /**
     * Local file the downloaded bytes are also written to (overwritten if present)
     */
    Path destination;

    public static DownloadOptions toFile(Path destination) {
        return DownloadOptions.builder().destination(destination).build();
    }
}
