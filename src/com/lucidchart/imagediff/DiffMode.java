package com.lucidchart.imagediff;

/** How per-channel differences are rendered into an output pixel */
public enum DiffMode {

    /** Any red, green or blue difference becomes white, everything else black */
    BW ("bw", "Black-and-White"),
    /** The averaged red, green and blue difference, scaled, as a single gray intensity */
    GRAY ("gray", "Grayscale"),
    /** Red, green and blue differences scaled independently */
    COLOR ("color", "Color");

    public final String key;
    public final String text;

    DiffMode(String key, String text) {
        this.key = key;
        this.text = text;
    }

    /** Obtain a DiffMode from string.  Anything unrecognized, null included, renders as COLOR. */
    public static DiffMode parseMode(String mode) {
        if (mode == null) return COLOR;
        switch (mode.trim().toLowerCase()) {
            case "bw": return DiffMode.BW;
            case "gray": return DiffMode.GRAY;
            case "color": return DiffMode.COLOR;
            default:
                return COLOR;
        }
    }
}
