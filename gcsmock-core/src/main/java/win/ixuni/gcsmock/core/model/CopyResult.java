package win.ixuni.gcsmock.core.model;

import lombok.Value;
import win.ixuni.gcsmock.core.api.GcsFile;

/**
 * 复制结果：目标文件及其实际存储的元数据
 */
@Value
public class CopyResult {

    GcsFile file;

    ObjectMetadata metadata;
}
