package com.lucidchart.imagediff;

import java.util.Objects;

/** Pixel counters of a difference run: non-background pixels on either side, and differing pixels. */
public class DiffCounts {
    public static final DiffCounts ZERO = new DiffCounts(0, 0, 0);

    public final long left;
    public final long right;
    public final long diff;

    private DiffCounts(long left, long right, long diff) {
        this.left = left;
        this.right = right;
        this.diff = diff;
    }

    public static DiffCounts apply(long left, long right, long diff) {
        return new DiffCounts(left, right, diff);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DiffCounts)) return false;
        DiffCounts counts = (DiffCounts) o;
        return left == counts.left &&
                right == counts.right &&
                diff == counts.diff;
    }

    @Override
    public int hashCode() {
        return Objects.hash(left, right, diff);
    }

    @Override
    public String toString() {
        return "left " + left + " right " + right + " diff " + diff;
    }
}
