package com.grale.harvester.harvest.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

public final class ByteSizes {
    private static final String[] UNITS = {"B", "KB", "MB", "GB", "TB", "PB", "EB", "ZB", "YB"};
    private static final double KIBI = 1024.0;

    private ByteSizes() {
    }

    public static String humanReadable(long sizeBytes) {
        double size = sizeBytes;
        int unit = 0;
        while (size >= KIBI && unit < UNITS.length - 1) {
            size /= KIBI;
            unit++;
        }
        BigDecimal rounded = BigDecimal.valueOf(size).setScale(2, RoundingMode.HALF_UP).stripTrailingZeros();
        if (rounded.scale() < 0) {
            rounded = rounded.setScale(0);
        }
        return rounded.toPlainString() + "(" + UNITS[unit] + ")";
    }
}
