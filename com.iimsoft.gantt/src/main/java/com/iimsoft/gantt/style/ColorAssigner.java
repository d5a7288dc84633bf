package com.iimsoft.gantt.style;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Assigns a visually distinct color to every resource.
 *
 * The first hue comes from {@code hueSeed} (any value in [0,1)); every following hue is the
 * previous one plus the golden ratio conjugate, mod 1. Saturation and value are fixed at 0.5.
 * See https://martin.ankerl.com/2009/12/09/how-to-create-random-colors-programmatically/
 */
public class ColorAssigner {

    public static final double GOLDEN_RATIO_CONJUGATE = 0.618033988749895;
    public static final double SATURATION = 0.5;
    public static final double VALUE = 0.5;

    private final DoubleSupplier hueSeed;

    /** 生产环境：从进程级随机数取一次初始色相。 */
    public ColorAssigner() {
        this(() -> ThreadLocalRandom.current().nextDouble());
    }

    public ColorAssigner(DoubleSupplier hueSeed) {
        this.hueSeed = hueSeed;
    }

    public static ColorAssigner fixedHue(double hue) {
        return new ColorAssigner(() -> hue);
    }

    public ResourcePalette assign(int resourceCount) {
        if (resourceCount < 0) {
            throw new IllegalArgumentException("resourceCount must be >= 0: " + resourceCount);
        }
        List<ResourceColor> colors = new ArrayList<>(resourceCount);
        if (resourceCount == 0) {
            return new ResourcePalette(colors);
        }
        double h = normalizeHue(hueSeed.getAsDouble());
        for (int i = 0; i < resourceCount; i++) {
            colors.add(new ResourceColor(i, h, hsvToRgb(h, SATURATION, VALUE)));
            h = (h + GOLDEN_RATIO_CONJUGATE) % 1.0;
        }
        return new ResourcePalette(colors);
    }

    /**
     * Six-sector HSV to packed 0xRRGGBB conversion; each channel is {@code (int) (c * 256)},
     * clamped to 255.
     */
    public static int hsvToRgb(double h, double s, double v) {
        int hi = (int) (h * 6.0);
        double f = h * 6.0 - hi;
        double p = v * (1.0 - s);
        double q = v * (1.0 - f * s);
        double t = v * (1.0 - (1.0 - f) * s);

        switch (hi) {
            case 0:
                return rgb(v, t, p);
            case 1:
                return rgb(q, v, p);
            case 2:
                return rgb(p, v, t);
            case 3:
                return rgb(p, q, v);
            case 4:
                return rgb(t, p, v);
            default:
                return rgb(v, p, q);
        }
    }

    private static int rgb(double r, double g, double b) {
        return channel(r) << 16 | channel(g) << 8 | channel(b);
    }

    private static int channel(double c) {
        return Math.min(255, Math.max(0, (int) (c * 256.0)));
    }

    private static double normalizeHue(double h) {
        double n = h % 1.0;
        return n < 0 ? n + 1.0 : n;
    }
}
