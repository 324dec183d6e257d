package com.reliabledownloader.models;

// inclusive; OPEN_END reads to the end of the stream
public record ByteRange(
        long start,
        long end
) {
    public static final long OPEN_END = -1;

    public ByteRange {
        if (start < 0) {
            throw new IllegalArgumentException("start must not be negative: " + start);
        }
        if (end != OPEN_END && end < start) {
            throw new IllegalArgumentException("end " + end + " is before start " + start);
        }
    }

    public static ByteRange wholeStream() {
        return new ByteRange(0, OPEN_END);
    }

    public boolean isOpenEnded() {
        return end == OPEN_END;
    }

    public long length() {
        return isOpenEnded() ? -1 : end - start + 1;
    }

    @Override
    public String toString() {
        return "bytes=" + start + "-" + (isOpenEnded() ? "" : end);
    }
}
