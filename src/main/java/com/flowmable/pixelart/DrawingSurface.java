package com.flowmable.pixelart;

/**
 * Minimal drawing target for {@link PixelArtRenderer}. Coordinates are in
 * pixels; alpha is a fraction in [0, 1].
 */
public interface DrawingSurface {

    void setFill(int r, int g, int b, double alpha);

    void fillRect(double x, double y, double width, double height);

    void setStroke(int r, int g, int b, double alpha, double lineWidth);

    void strokeRect(double x, double y, double width, double height);
}
