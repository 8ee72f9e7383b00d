package win.ixuni.gcsmock.core.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Signed URL configuration
 * <p>
 * Only validated; the generated URL does not depend on it.
 */
@Value
@Builder
public class SignedUrlConfig {

    SignedUrlAction action;

    Instant expires;

    String contentType;
}
