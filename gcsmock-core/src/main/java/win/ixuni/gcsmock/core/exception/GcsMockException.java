package win.ixuni.gcsmock.core.exception;

import lombok.Getter;

/**
 * gcs-mock base exception
 * <p>
 * Carries the error code and HTTP status the real service would answer with.
 */
@Getter
public class GcsMockException extends RuntimeException {

    public static final String IO_ERROR = "IOError";

    private final String errorCode;
    private final int httpStatus;

    public GcsMockException(String errorCode, String message, int httpStatus) {
        super(message);
        this.errorCode = errorCode;
        this.httpStatus = httpStatus;
    }

    public GcsMockException(String errorCode, String message, int httpStatus, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.httpStatus = httpStatus;
    }

    /**
     * 本地文件读写失败（upload 源文件 / download 目标文件）
     */
    public static GcsMockException ioError(String message, Throwable cause) {
        return new GcsMockException(IO_ERROR, message, 500, cause);
    }
}
