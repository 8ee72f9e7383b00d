package win.ixuni.gcsmock.core.io;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Local file access used by upload (byte source) and download-to-file (byte sink)
 */
public interface FileTransfer {

    /**
     * Read a whole local file
     *
     * @param source file to read
     * @return file bytes
     * @throws IOException if the file cannot be read
     */
    byte[] readAllBytes(Path source) throws IOException;

    /**
     * Write bytes to a local file, replacing it if it exists
     *
     * @param destination file to write
     * @param data        bytes to write
     * @throws IOException if the file cannot be written
     */
    void writeAllBytes(Path destination, byte[] data) throws IOException;
}
