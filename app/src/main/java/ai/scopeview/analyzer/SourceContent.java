package ai.scopeview.analyzer;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Wrapper for a source text and its UTF-8 bytes. Provides safe substring extraction by UTF-8 byte offsets and
 * byte-offset to line/column conversion, and avoids repeated String.getBytes(StandardCharsets.UTF_8) allocations
 * across pipeline stages. The bytes never leave this class.
 *
 * <p>The text is kept exactly as given, including any byte order mark, so that the concrete syntax tree can reproduce
 * it byte for byte.
 */
public final class SourceContent {
    private static final Logger log = LogManager.getLogger(SourceContent.class);

    private final String text;
    private final byte[] utf8Bytes;
    private final int byteLength;
    private volatile int[] lineStarts;

    private SourceContent(String text, byte[] utf8Bytes, int byteLength) {
        this.text = text;
        this.utf8Bytes = utf8Bytes;
        this.byteLength = byteLength;
    }

    /** Creates a SourceContent wrapper for the provided source text. */
    public static SourceContent of(String src) {
        Objects.requireNonNull(src, "src");
        byte[] bytes = src.getBytes(StandardCharsets.UTF_8);
        return new SourceContent(src, bytes, bytes.length);
    }

    /**
     * Safely extracts a substring using UTF-8 byte offsets [startByte, endByte).
     *
     * <p>Behavior:
     *
     * <ul>
     *   <li>If startByte < 0 or endByte < startByte, returns empty string and logs a warning.
     *   <li>If startByte >= underlying byte length returns empty string (logs a warning unless the range is empty).
     *   <li>If endByte > byte length, endByte is truncated to byte length (logs at debug).
     *   <li>Zero-length ranges return the empty string.
     * </ul>
     */
    public String substringFromBytes(int startByte, int endByte) {
        if (startByte < 0 || endByte < startByte) {
            log.warn(
                    "Requested bytes outside valid range for source text (length: {} bytes): startByte={}, endByte={}",
                    byteLength,
                    startByte,
                    endByte);
            return "";
        }

        int len = endByte - startByte;
        if (len == 0) return "";

        if (startByte >= byteLength) {
            log.warn("Start byte offset {} exceeds source byte length {}", startByte, byteLength);
            return "";
        }

        if (endByte > byteLength) {
            log.debug("End byte offset {} exceeds source byte length {}, truncating", endByte, byteLength);
            endByte = byteLength;
        }

        return new String(utf8Bytes, startByte, endByte - startByte, StandardCharsets.UTF_8);
    }

    /** Zero-based line containing the byte offset. */
    public int lineOf(int byteOffset) {
        int[] starts = lineStarts();
        int clamped = Math.max(0, Math.min(byteOffset, byteLength));
        int idx = Arrays.binarySearch(starts, clamped);
        return idx >= 0 ? idx : -idx - 2;
    }

    /** Zero-based UTF-8 byte column of the byte offset within its line. */
    public int columnOf(int byteOffset) {
        int clamped = Math.max(0, Math.min(byteOffset, byteLength));
        return clamped - lineStarts()[lineOf(clamped)];
    }

    /** Range covering the byte span [startByte, endByte). */
    public SourceRange rangeOf(int startByte, int endByte) {
        return new SourceRange(lineOf(startByte), columnOf(startByte), lineOf(endByte), columnOf(endByte));
    }

    private int[] lineStarts() {
        var starts = lineStarts;
        if (starts == null) {
            int count = 1;
            for (byte b : utf8Bytes) {
                if (b == '\n') count++;
            }
            starts = new int[count];
            int line = 1;
            for (int i = 0; i < byteLength; i++) {
                if (utf8Bytes[i] == '\n') {
                    starts[line++] = i + 1;
                }
            }
            lineStarts = starts;
        }
        return starts;
    }

    public String text() {
        return text;
    }

    public int byteLength() {
        return byteLength;
    }

    @Override
    public boolean equals(@Nullable Object obj) {
        if (obj == this) return true;
        if (obj == null || obj.getClass() != this.getClass()) return false;
        var that = (SourceContent) obj;
        return Objects.equals(this.text, that.text) && this.byteLength == that.byteLength;
    }

    @Override
    public int hashCode() {
        return Objects.hash(text, byteLength);
    }

    @Override
    public String toString() {
        return "SourceContent[byteLength=" + byteLength + ']';
    }
}
