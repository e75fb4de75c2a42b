package com.llmorch.core.util;

import io.fabric8.kubernetes.api.model.Quantity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.OptionalLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsing and formatting of platform resource quantities.
 * <p>
 * Canonical units: CPU in millicores, memory and storage in bytes, GPU as an
 * integer count. Parsing is delegated to the fabric8 {@link Quantity} so the
 * notation matches what the platform itself accepts ({@code 2000m}, {@code 2},
 * {@code 8Gi}, {@code 1G}, {@code 1e3}).
 * </p>
 */
public final class Quantities {
    private static final Logger log = LoggerFactory.getLogger(Quantities.class);

    private static final long KI = 1024L;
    private static final long MI = KI * 1024;
    private static final long GI = MI * 1024;

    private static final Pattern BANDWIDTH = Pattern.compile("^\\s*([0-9]+(?:\\.[0-9]+)?)\\s*([kmgt]?)(?:bps|b|bit/s)?\\s*$",
            Pattern.CASE_INSENSITIVE);

    private Quantities() {
    }

    /**
     * @return the numerical amount, or empty when blank, malformed or negative
     */
    public static Optional<BigDecimal> parse(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        try {
            BigDecimal amount = new Quantity(text.trim()).getNumericalAmount();
            return amount.signum() < 0 ? Optional.empty() : Optional.of(amount);
        } catch (IllegalArgumentException | ArithmeticException e) {
            return Optional.empty();
        }
    }

    /**
     * @return true when the text parses and its byte amount fits a {@code long}
     */
    public static boolean isValid(String text) {
        return bytes(text).isPresent();
    }

    /**
     * @return true when the text parses and its millicore amount fits a {@code long}
     */
    public static boolean isValidCpu(String text) {
        return cpuMillis(text).isPresent();
    }

    public static OptionalLong cpuMillis(String text) {
        return parse(text)
                .map(cores -> exactLong(cores.movePointRight(3)))
                .orElse(OptionalLong.empty());
    }

    public static OptionalLong bytes(String text) {
        return parse(text)
                .map(Quantities::exactLong)
                .orElse(OptionalLong.empty());
    }

    /**
     * Integer counts (GPUs). Fractions are rejected.
     */
    public static OptionalInt count(String text) {
        if (text == null || text.isBlank()) {
            return OptionalInt.empty();
        }
        try {
            int value = Integer.parseInt(text.trim());
            return value < 0 ? OptionalInt.empty() : OptionalInt.of(value);
        } catch (NumberFormatException e) {
            return OptionalInt.empty();
        }
    }

    /**
     * Parses a CPU quantity, falling back to {@code defaultMillis}. A present
     * but unparseable value is logged.
     */
    public static long cpuMillisOrDefault(String text, long defaultMillis, String field) {
        OptionalLong parsed = cpuMillis(text);
        if (parsed.isPresent()) {
            return parsed.getAsLong();
        }
        warnIfPresent(text, field, defaultMillis + "m");
        return defaultMillis;
    }

    public static long bytesOrDefault(String text, long defaultBytes, String field) {
        OptionalLong parsed = bytes(text);
        if (parsed.isPresent()) {
            return parsed.getAsLong();
        }
        warnIfPresent(text, field, String.valueOf(defaultBytes));
        return defaultBytes;
    }

    public static int countOrDefault(String text, int defaultCount, String field) {
        OptionalInt parsed = count(text);
        if (parsed.isPresent()) {
            return parsed.getAsInt();
        }
        warnIfPresent(text, field, String.valueOf(defaultCount));
        return defaultCount;
    }

    /**
     * Formats millicores the way the platform prints them: {@code 2} or {@code 2400m}.
     */
    public static String formatCpu(long millis) {
        return millis % 1000 == 0 ? String.valueOf(millis / 1000) : millis + "m";
    }

    /**
     * Formats bytes with the largest exact binary suffix.
     */
    public static String formatBytes(long bytes) {
        if (bytes != 0 && bytes % GI == 0) {
            return bytes / GI + "Gi";
        }
        if (bytes != 0 && bytes % MI == 0) {
            return bytes / MI + "Mi";
        }
        if (bytes != 0 && bytes % KI == 0) {
            return bytes / KI + "Ki";
        }
        return String.valueOf(bytes);
    }

    /**
     * Parses a bandwidth label such as {@code 25Gbps}, {@code 10G} or {@code 500Mbps}
     * into gigabits per second.
     */
    public static Optional<Double> bandwidthGbps(String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher m = BANDWIDTH.matcher(text);
        if (!m.matches()) {
            return Optional.empty();
        }
        double value = Double.parseDouble(m.group(1));
        switch (m.group(2).toLowerCase(Locale.ROOT)) {
            case "k":
                return Optional.of(value / 1_000_000);
            case "m":
                return Optional.of(value / 1_000);
            case "t":
                return Optional.of(value * 1_000);
            case "g":
                return Optional.of(value);
            default:
                // bare numbers are taken as Gbps
                return Optional.of(value);
        }
    }

    private static OptionalLong exactLong(BigDecimal amount) {
        try {
            return OptionalLong.of(amount.setScale(0, RoundingMode.CEILING).longValueExact());
        } catch (ArithmeticException e) {
            // beyond the long range
            return OptionalLong.empty();
        }
    }

    private static void warnIfPresent(String text, String field, String fallback) {
        if (text != null && !text.isBlank()) {
            log.warn("Unparseable quantity '{}' for {}, using default {}", text, field, fallback);
        }
    }
}
