package tether.core.execution;

import tether.core.sink.MessageLevel;
import tether.core.util.ObjectChecker;

import java.io.ByteArrayOutputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

/**
 * An output stream that buffers what is written to it and hands the buffered text to a
 * {@link ResultForwardingListener} as one output chunk every time it is flushed.
 */
final class ForwardingOutputStream extends OutputStream {
    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final ResultForwardingListener listener;
    private final MessageLevel level;

    ForwardingOutputStream(ResultForwardingListener listener, MessageLevel level) {
        ObjectChecker.assertNonNull(listener, level);
        this.listener = listener;
        this.level = level;
    }

    @Override
    public synchronized void write(int b) {
        this.buffer.write(b);
    }

    @Override
    public synchronized void write(byte[] bytes, int offset, int length) {
        this.buffer.write(bytes, offset, length);
    }

    @Override
    public synchronized void flush() {
        if (this.buffer.size() == 0) {
            return;
        }
        String chunk = new String(this.buffer.toByteArray(), StandardCharsets.UTF_8);
        this.buffer.reset();
        this.listener.testOutput(this.level, chunk);
    }

    @Override
    public void close() {
        flush();
    }
}
