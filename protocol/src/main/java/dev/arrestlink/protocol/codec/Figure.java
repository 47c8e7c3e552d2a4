package dev.arrestlink.protocol.codec;

import java.awt.Graphics2D;

/**
 * Something that can paint itself onto a raster of fixed size. {@link FigureCodec#encode(Figure)}
 * takes ownership and closes the figure once rendered.
 */
public interface Figure extends AutoCloseable {

    int width();

    int height();

    void paint(Graphics2D graphics);

    @Override
    default void close() {
    }
}
