package com.flowmable.pixelart;

import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.geom.Rectangle2D;

/**
 * {@link DrawingSurface} backed by a {@link Graphics2D}. The caller owns the
 * graphics context and disposes it.
 */
public class Graphics2DSurface implements DrawingSurface {

    private final Graphics2D g2;
    private Color fill = Color.BLACK;
    private Color stroke = Color.BLACK;
    private BasicStroke strokeShape = new BasicStroke(1f);

    public Graphics2DSurface(Graphics2D g2) {
        this.g2 = g2;
        g2.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
        g2.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
        g2.setRenderingHint(RenderingHints.KEY_STROKE_CONTROL, RenderingHints.VALUE_STROKE_PURE);
    }

    @Override
    public void setFill(int r, int g, int b, double alpha) {
        fill = color(r, g, b, alpha);
    }

    @Override
    public void fillRect(double x, double y, double width, double height) {
        g2.setColor(fill);
        g2.fill(new Rectangle2D.Double(x, y, width, height));
    }

    @Override
    public void setStroke(int r, int g, int b, double alpha, double lineWidth) {
        stroke = color(r, g, b, alpha);
        strokeShape = new BasicStroke((float) lineWidth);
    }

    @Override
    public void strokeRect(double x, double y, double width, double height) {
        g2.setColor(stroke);
        g2.setStroke(strokeShape);
        g2.draw(new Rectangle2D.Double(x, y, width, height));
    }

    private static Color color(int r, int g, int b, double alpha) {
        int a = (int) Math.round(Math.max(0.0, Math.min(1.0, alpha)) * 255);
        return new Color(r, g, b, a);
    }
}
