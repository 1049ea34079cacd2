package com.lucidchart.imagediff;

/** Raised when a difference run cannot complete: an image cannot be read or written, or a chunk worker failed. */
public class ImageDiffException extends RuntimeException {

    public ImageDiffException(String message) {
        super(message);
    }

    public ImageDiffException(String message, Throwable cause) {
        super(message, cause);
    }
}
