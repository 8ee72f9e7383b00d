package win.ixuni.gcsmock.memory.stream;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.util.function.Consumer;

/**
 * Write stream that buffers everything and hands the bytes over on close
 * <p>
 * Nothing is committed if the stream is never closed.
 */
public class MockWriteStream extends OutputStream {

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final Consumer<byte[]> onClose;
    private boolean closed;

    public MockWriteStream(Consumer<byte[]> onClose) {
        this.onClose = onClose;
    }

    @Override
    public synchronized void write(int b) throws IOException {
        ensureOpen();
        buffer.write(b);
    }

    @Override
    public synchronized void write(byte[] b, int off, int len) throws IOException {
        ensureOpen();
        buffer.write(b, off, len);
    }

    /**
     * Commit the buffered bytes; later calls do nothing
     */
    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        onClose.accept(buffer.toByteArray());
    }

    public synchronized boolean isWritable() {
        return !closed;
    }

    /**
     * Drain a reactive source into this stream, then close it
     *
     * @param content content stream
     * @return completion signal; on error the stream stays open and nothing is committed
     */
    public Mono<Void> writeFrom(Flux<ByteBuffer> content) {
        return content
                .doOnNext(this::append)
                .then(Mono.fromRunnable(this::close));
    }

    private synchronized void append(ByteBuffer buf) {
        if (closed) {
            throw new IllegalStateException("Write stream is already closed");
        }
        byte[] bytes = new byte[buf.remaining()];
        buf.get(bytes);
        buffer.write(bytes, 0, bytes.length);
    }

    private void ensureOpen() throws IOException {
        if (closed) {
            throw new IOException("Write stream is already closed");
        }
    }
}
