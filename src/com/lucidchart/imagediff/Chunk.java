package com.lucidchart.imagediff;

import java.util.Objects;

/** A rectangular piece of an image, [startX, endX) x [startY, endY), handled by a single worker. */
public class Chunk {
    public final int startX;
    public final int endX;
    public final int startY;
    public final int endY;

    private Chunk(int startX, int endX, int startY, int endY) {
        this.startX = startX;
        this.endX = endX;
        this.startY = startY;
        this.endY = endY;
    }

    //*** FACTORY METHODS ***

    public static Chunk apply(int startX, int endX, int startY, int endY) {
        return new Chunk(startX, endX, startY, endY);
    }


    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Chunk)) return false;
        Chunk chunk = (Chunk) o;
        return startX == chunk.startX &&
                endX == chunk.endX &&
                startY == chunk.startY &&
                endY == chunk.endY;
    }

    @Override
    public int hashCode() {
        return Objects.hash(startX, endX, startY, endY);
    }

    @Override
    public String toString() {
        return "Chunk[x " + startX + ".." + endX + ", y " + startY + ".." + endY + "]";
    }
}
