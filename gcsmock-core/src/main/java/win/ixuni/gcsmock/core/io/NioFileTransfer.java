package win.ixuni.gcsmock.core.io;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * {@link FileTransfer} backed by {@link Files}
 */
@Slf4j
public class NioFileTransfer implements FileTransfer {

    @Override
    public byte[] readAllBytes(Path source) throws IOException {
        byte[] data = Files.readAllBytes(source);
        log.debug("Read {} bytes from {}", data.length, source);
        return data;
    }

    @Override
    public void writeAllBytes(Path destination, byte[] data) throws IOException {
        Files.write(destination, data,
                StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING,
                StandardOpenOption.WRITE);
        log.debug("Wrote {} bytes to {}", data.length, destination);
    }
}
