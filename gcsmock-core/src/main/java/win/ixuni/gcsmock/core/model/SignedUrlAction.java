package win.ixuni.gcsmock.core.model;

/**
 * Action a signed URL grants
 */
public enum SignedUrlAction {
    READ,
    WRITE,
    DELETE,
    RESUMABLE
}
