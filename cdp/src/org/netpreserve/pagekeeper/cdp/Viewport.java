package org.netpreserve.pagekeeper.cdp;

/**
 * Window geometry a page is emulated with.
 */
public record Viewport(int width, int height, double deviceScaleFactor, boolean mobile) {
    public Viewport {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Viewport must have a positive size: " + width + "x" + height);
        }
        if (deviceScaleFactor <= 0) deviceScaleFactor = 1;
    }

    public Viewport(int width, int height) {
        this(width, height, 1, false);
    }
}
