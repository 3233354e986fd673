package alpha.framedhttp.internal;

import java.nio.ByteBuffer;
import java.util.Arrays;

import static java.lang.System.arraycopy;
import static java.util.Objects.checkFromIndexSize;

/**
 * A growable accumulation buffer of bytes not yet consumed.<p>
 * 
 * Bytes are appended at the end and consumed from the front. Consuming bytes
 * only advances a read offset. When the consumed region grows larger than half
 * of the backing array, the unread bytes are moved to the front of the array
 * ("compaction"). The backing array grows by doubling (minimum 32 bytes)
 * whenever an append does not fit. Together, this bounds the memory used at
 * about twice the size of the unread bytes.<p>
 * 
 * The invariant {@code offset() + length() <= capacity()} always holds, and no
 * operation ever changes the order of the unread bytes.<p>
 * 
 * The buffer is owned by one connection and is not thread-safe.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class ByteBuf
{
    /** The smallest backing array allocated. */
    static final int MIN_CAPACITY = 32;
    
    private static final byte[] NONE = {};
    
    private byte[] data;
    private int offset, length;
    
    ByteBuf() {
        data = NONE;
    }
    
    /**
     * {@return the number of unread bytes}
     */
    int length() {
        return length;
    }
    
    /**
     * {@return {@code true} if there are no unread bytes}
     */
    boolean isEmpty() {
        return length == 0;
    }
    
    /**
     * {@return the size of the backing array}
     */
    int capacity() {
        return data.length;
    }
    
    /**
     * {@return the position of the first unread byte in the backing array}
     */
    int offset() {
        return offset;
    }
    
    /**
     * Appends the remaining bytes of the given buffer.<p>
     * 
     * The buffer's position is advanced to its limit.
     * 
     * @param src bytes to append
     */
    void append(ByteBuffer src) {
        final int n = src.remaining();
        ensureWritable(n);
        src.get(data, offset + length, n);
        length += n;
    }
    
    /**
     * Appends all bytes of the given array.
     * 
     * @param src bytes to append
     */
    void append(byte[] src) {
        ensureWritable(src.length);
        arraycopy(src, 0, data, offset + length, src.length);
        length += src.length;
    }
    
    /**
     * Returns the byte at the given index of the unread region.
     * 
     * @param index relative to the first unread byte
     * @return the byte
     * @throws IndexOutOfBoundsException if the index is out of range
     */
    byte get(int index) {
        checkFromIndexSize(index, 1, length);
        return data[offset + index];
    }
    
    /**
     * Finds the first occurrence of a byte sequence in the unread region.
     * 
     * @param seq to look for (not empty)
     * @return index relative to the first unread byte, or -1 if not found
     */
    int indexOf(byte[] seq) {
        final int end = offset + length - seq.length;
        outer: for (int i = offset; i <= end; ++i) {
            for (int j = 0; j < seq.length; ++j) {
                if (data[i + j] != seq[j]) {
                    continue outer;
                }
            }
            return i - offset;
        }
        return -1;
    }
    
    /**
     * Finds the first occurrence of a byte in the unread region.
     * 
     * @param b to look for
     * @return index relative to the first unread byte, or -1 if not found
     */
    int indexOf(byte b) {
        for (int i = offset, end = offset + length; i < end; ++i) {
            if (data[i] == b) {
                return i - offset;
            }
        }
        return -1;
    }
    
    /**
     * Returns a copy of the first {@code n} unread bytes.<p>
     * 
     * Nothing is consumed.
     * 
     * @param n number of bytes
     * @return a new array
     * @throws IndexOutOfBoundsException if {@code n} is negative or larger
     *         than the length
     */
    byte[] copyOf(int n) {
        checkFromIndexSize(0, n, length);
        return Arrays.copyOfRange(data, offset, offset + n);
    }
    
    /**
     * Copies and consumes the first {@code n} unread bytes.
     * 
     * @param n number of bytes
     * @return a buffer of the bytes taken
     * @throws IndexOutOfBoundsException if {@code n} is negative or larger
     *         than the length
     */
    ByteBuffer take(int n) {
        var b = ByteBuffer.wrap(copyOf(n));
        consume(n);
        return b;
    }
    
    /**
     * Returns a read-only view of the unread bytes.<p>
     * 
     * The view is invalidated by the next mutating operation.
     * 
     * @return a read-only view
     */
    ByteBuffer view() {
        return ByteBuffer.wrap(data, offset, length).slice().asReadOnlyBuffer();
    }
    
    /**
     * Consumes the first {@code n} unread bytes.
     * 
     * @param n number of bytes
     * @throws IndexOutOfBoundsException if {@code n} is negative or larger
     *         than the length
     */
    void consume(int n) {
        checkFromIndexSize(0, n, length);
        offset += n;
        length -= n;
        if (length == 0) {
            offset = 0;
        } else if (offset > data.length / 2) {
            compact();
        }
    }
    
    private void compact() {
        arraycopy(data, offset, data, 0, length);
        offset = 0;
    }
    
    private void ensureWritable(int n) {
        final int need = Math.addExact(length, n);
        if (offset + need <= data.length) {
            return;
        }
        if (need <= data.length) {
            compact();
            return;
        }
        int cap = Math.max(data.length, MIN_CAPACITY);
        while (cap < need) {
            cap = Math.multiplyExact(cap, 2);
        }
        var grown = new byte[cap];
        arraycopy(data, offset, grown, 0, length);
        data = grown;
        offset = 0;
    }
    
    @Override
    public String toString() {
        return ByteBuf.class.getSimpleName() + "{" +
                "offset=" + offset +
                ", length=" + length +
                ", capacity=" + data.length + '}';
    }
}
