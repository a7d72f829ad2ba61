package com.example.webanalyzer.service;

import java.time.Duration;

/**
 * Текстовая запись длительности: {@code 850ns}, {@code 1.5µs}, {@code 150ms}, {@code 1.25s},
 * {@code 2m3.5s}, {@code 1h0m0s}. Нулевая длительность: {@code 0s}.
 */
public final class DurationFormatter {

    private static final long NANOS_PER_MICRO = 1_000L;
    private static final long NANOS_PER_MILLI = 1_000_000L;
    private static final long NANOS_PER_SECOND = 1_000_000_000L;

    private DurationFormatter() {
    }

    public static String format(Duration duration) {
        if (duration == null || duration.isZero()) {
            return "0s";
        }
        String sign = duration.isNegative() ? "-" : "";
        Duration abs = duration.abs();
        long nanos = abs.getNano();

        if (abs.getSeconds() == 0) {
            if (nanos < NANOS_PER_MICRO) {
                return sign + nanos + "ns";
            }
            if (nanos < NANOS_PER_MILLI) {
                return sign + withFraction(nanos, NANOS_PER_MICRO, 3) + "µs";
            }
            return sign + withFraction(nanos, NANOS_PER_MILLI, 6) + "ms";
        }

        long totalSeconds = abs.getSeconds();
        long hours = totalSeconds / 3600;
        long minutes = (totalSeconds % 3600) / 60;
        long seconds = totalSeconds % 60;
        String secondsPart = seconds + fraction(nanos, 9) + "s";

        if (hours > 0) {
            return sign + hours + "h" + minutes + "m" + secondsPart;
        }
        if (minutes > 0) {
            return sign + minutes + "m" + secondsPart;
        }
        return sign + secondsPart;
    }

    private static String withFraction(long nanos, long unit, int digits) {
        return (nanos / unit) + fraction(nanos % unit, digits);
    }

    // дробная часть без хвостовых нулей
    private static String fraction(long remainder, int digits) {
        if (remainder == 0) {
            return "";
        }
        String text = String.format("%0" + digits + "d", remainder);
        int end = text.length();
        while (end > 0 && text.charAt(end - 1) == '0') {
            end--;
        }
        return "." + text.substring(0, end);
    }
}
