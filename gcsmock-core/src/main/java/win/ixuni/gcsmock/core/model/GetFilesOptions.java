package win.ixuni.gcsmock.core.model;

import lombok.Builder;
import lombok.Value;

/**
 * Listing / bulk delete query
 */
@Value
@Builder
public class GetFilesOptions {

    /**
     * Name prefix filter, {@code null} or empty matches every file
     */
    String prefix;

    public static GetFilesOptions withPrefix(String prefix) {
        return GetFilesOptions.builder().prefix(prefix).build();
    }

    public String getPrefixOrEmpty() {
        return prefix != null ? prefix : "";
    }
}
