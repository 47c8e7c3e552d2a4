package dev.arrestlink.protocol.codec;

import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Graphics2D;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Vertical bar chart of labelled counts, e.g. arrests per area. Bars are scaled to the largest
 * value; labels are kept for callers that render a legend next to the image.
 */
public final class BarChartFigure implements Figure {

    private static final int MARGIN = 20;
    private static final Color[] PALETTE = {
        new Color(0x1f77b4), new Color(0xff7f0e), new Color(0x2ca02c), new Color(0xd62728), new Color(0x9467bd)
    };

    private final int width;
    private final int height;
    private final Map<String, Double> values;

    public BarChartFigure(int width, int height, Map<String, ? extends Number> values) {
        if (width <= 2 * MARGIN || height <= 2 * MARGIN) {
            throw new IllegalArgumentException("Chart must be larger than " + (2 * MARGIN) + "px each way");
        }
        this.width = width;
        this.height = height;
        this.values = new LinkedHashMap<>();
        values.forEach((label, value) -> {
            if (value == null || value.doubleValue() < 0) {
                throw new IllegalArgumentException("Bar '" + label + "' needs a non-negative value");
            }
            this.values.put(label, value.doubleValue());
        });
    }

    @Override
    public int width() {
        return width;
    }

    @Override
    public int height() {
        return height;
    }

    public List<String> labels() {
        return new ArrayList<>(values.keySet());
    }

    @Override
    public void paint(Graphics2D graphics) {
        graphics.setColor(Color.WHITE);
        graphics.fillRect(0, 0, width, height);

        int plotWidth = width - 2 * MARGIN;
        int plotHeight = height - 2 * MARGIN;
        int baseline = height - MARGIN;

        graphics.setColor(Color.DARK_GRAY);
        graphics.setStroke(new BasicStroke(1.5f));
        graphics.drawLine(MARGIN, MARGIN, MARGIN, baseline);
        graphics.drawLine(MARGIN, baseline, width - MARGIN, baseline);

        if (values.isEmpty()) {
            return;
        }
        double max = values.values().stream().mapToDouble(Double::doubleValue).max().orElse(0);
        int slot = plotWidth / values.size();
        int barWidth = Math.max(1, (int) (slot * 0.7));
        int index = 0;
        for (double value : values.values()) {
            int barHeight = max == 0 ? 0 : (int) Math.round(value / max * plotHeight);
            int x = MARGIN + index * slot + (slot - barWidth) / 2;
            graphics.setColor(PALETTE[index % PALETTE.length]);
            graphics.fillRect(x, baseline - barHeight, barWidth, barHeight);
            index++;
        }
    }
}
