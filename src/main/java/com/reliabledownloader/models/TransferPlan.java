package com.reliabledownloader.models;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Ranges one attempt fetches, in order. Chunked plans are generated lazily so a large resource with a
 * small chunk size does not materialize every range up front.
 *
 * @param totalLength declared length of the resource, or -1 when unknown
 * @param chunkSize span of each range in a ranged plan
 */
public record TransferPlan(
        boolean ranged,
        long totalLength,
        long chunkSize
) implements Iterable<ByteRange> {

    public TransferPlan {
        if (ranged && totalLength <= 0) {
            throw new IllegalArgumentException("A ranged plan needs a known, positive length");
        }
        if (ranged && chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive: " + chunkSize);
        }
    }

    public static TransferPlan chunked(long totalLength, long chunkSize) {
        return new TransferPlan(true, totalLength, chunkSize);
    }

    public static TransferPlan fullStream(long declaredLength) {
        return new TransferPlan(false, declaredLength < 0 ? -1 : declaredLength, 0);
    }

    public long rangeCount() {
        if (!ranged) {
            return 1;
        }
        return (totalLength + chunkSize - 1) / chunkSize;
    }

    /**
     * Bytes the given range must deliver, or -1 when only the end of the stream bounds it.
     */
    public long expectedLength(ByteRange range) {
        return range.isOpenEnded() ? totalLength : range.length();
    }

    @Override
    public Iterator<ByteRange> iterator() {
        if (!ranged) {
            return new Iterator<>() {
                private boolean consumed;

                @Override
                public boolean hasNext() {
                    return !consumed;
                }

                @Override
                public ByteRange next() {
                    if (consumed) {
                        throw new NoSuchElementException();
                    }
                    consumed = true;
                    return ByteRange.wholeStream();
                }
            };
        }
        return new Iterator<>() {
            private long next = 0;

            @Override
            public boolean hasNext() {
                return next < totalLength;
            }

            @Override
            public ByteRange next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                long start = next;
                long end = start + Math.min(chunkSize, totalLength - start) - 1;
                next = end + 1;
                return new ByteRange(start, end);
            }
        };
    }
}
