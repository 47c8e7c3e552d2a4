package dev.arrestlink.protocol.codec;

import dev.arrestlink.protocol.ProtocolException;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Base64;
import javax.imageio.ImageIO;

/**
 * Carries a rendered {@link Figure} inside an envelope payload as base64 PNG.
 */
public final class FigureCodec {

    static final String FORMAT = "png";

    private FigureCodec() {
    }

    /**
     * Render, compress and encode. The drawing surface, the raster and the figure are released on
     * every path, including failures.
     */
    public static String encode(Figure figure) throws ProtocolException {
        try (figure) {
            BufferedImage image = new BufferedImage(figure.width(), figure.height(), BufferedImage.TYPE_INT_ARGB);
            try {
                Graphics2D graphics = image.createGraphics();
                try {
                    graphics.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
                    figure.paint(graphics);
                } finally {
                    graphics.dispose();
                }
                ByteArrayOutputStream out = new ByteArrayOutputStream();
                if (!ImageIO.write(image, FORMAT, out)) {
                    throw ProtocolException.malformed("No " + FORMAT + " writer available", null);
                }
                return Base64.getEncoder().encodeToString(out.toByteArray());
            } finally {
                image.flush();
            }
        } catch (ProtocolException e) {
            throw e;
        } catch (IOException e) {
            throw ProtocolException.malformed("Cannot render figure", e);
        }
    }

    public static BufferedImage decode(String encoded) throws ProtocolException {
        if (encoded == null) {
            throw ProtocolException.malformed("No encoded figure", null);
        }
        byte[] bytes;
        try {
            bytes = Base64.getDecoder().decode(encoded);
        } catch (IllegalArgumentException e) {
            throw ProtocolException.malformed("Encoded figure is not valid base64", e);
        }
        BufferedImage image;
        try {
            image = ImageIO.read(new ByteArrayInputStream(bytes));
        } catch (IOException e) {
            throw ProtocolException.malformed("Encoded figure is not a readable image", e);
        }
        if (image == null) {
            throw ProtocolException.malformed("Encoded figure is not a readable image", null);
        }
        return image;
    }
}
