// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hypertag.sexp.reader;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import hypertag.util.condition.ConditionContext;
import hypertag.util.condition.exception.IOExceptionCondition;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A buffered input stream of bytes with single-byte lookahead, as needed by the {@link Reader}.
 * <p>
 * I/O errors are signaled as a fatal {@link IOExceptionCondition}.
 */
public final class ByteStream {
    /**
     * Initializes a new byte stream reading from the given input stream, which doesn't need to be buffered.
     */
    public ByteStream(final @NotNull InputStream stream) {
        this.stream = stream;
        buffer = new byte[streamBufferCapacity];
        position = 0;
        bufferSize = 0;
    }

    /**
     * Returns a byte stream over the UTF-8 encoding of the given text.
     */
    public static ByteStream of(final @NotNull String text) {
        return new ByteStream(new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8)));
    }

    /**
     * Returns {@code true} iff the stream has no more bytes.
     * <p>
     * Once this returns {@code false}, {@link #peek()} and {@link #discardPeek()} may be called; after discarding,
     * this method has to be called again.
     */
    public boolean reachedEnd() {
        return position >= bufferSize && refill().hitEof();
    }

    /**
     * Returns the current byte without advancing. Only valid after {@link #reachedEnd()} returned {@code false}.
     */
    public byte peek() {
        assert position < bufferSize;
        return buffer[position];
    }

    /**
     * Advances past the current byte. Only valid after {@link #reachedEnd()} returned {@code false}.
     */
    public void discardPeek() {
        if (buffer[position] == '\n') {
            lineNumber += 1;
        }
        position += 1;
    }

    /**
     * The line of the current byte, counting from 1.
     */
    public int lineNumber() {
        return lineNumber;
    }

    @NotNull HitEof skipToLineFeed() {
        while (true) {
            if (position < bufferSize) {
                final var lineFeedPosition = findLineFeed();
                if (lineFeedPosition != -1) {
                    position = lineFeedPosition;
                    return HitEof.NO;
                }
            }
            if (refill().hitEof()) {
                return HitEof.YES;
            }
        }
    }

    private int findLineFeed() {
        for (int i = position; i < bufferSize; i += 1) {
            if (buffer[i] == '\n') {
                return i;
            }
        }
        return -1;
    }

    @SuppressWarnings("ArrayEquality")
    private @NotNull HitEof refill() {
        if (buffer == endOfInputMarker) {
            return HitEof.YES;
        }
        final var currentStream = stream;
        if (currentStream != null) {
            final int numberOfBytesRead;
            try {
                numberOfBytesRead = currentStream.read(buffer);
            } catch (final IOException e) {
                throw ConditionContext.error(new IOExceptionCondition(e));
            }
            if (numberOfBytesRead > 0) {
                position = 0;
                bufferSize = numberOfBytesRead;
                return HitEof.NO;
            }
        }
        // End of input: let the stream and buffer go, and never try to read again.
        stream = null;
        buffer = endOfInputMarker;
        position = 0;
        bufferSize = 0;
        return HitEof.YES;
    }

    private static final int streamBufferCapacity = 8192;
    private static final byte[] endOfInputMarker = new byte[0];

    private @Nullable InputStream stream;
    private byte @NotNull [] buffer;
    private int position;
    private int bufferSize;
    private int lineNumber = 1;
}
