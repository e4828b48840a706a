package com.motionbake.codegen.model;

import java.util.Locale;
import java.util.Map;

/**
 * ARGB color with 8 bits per channel.
 *
 * The name is the well-known color name when there is one, otherwise the
 * {@code AARRGGBB} hex digits. Names are used both in comments and in generated
 * identifiers, so they only ever contain letters and digits.
 */
public record Color(int a, int r, int g, int b) {

    private static final Map<Integer, String> KNOWN_NAMES = Map.ofEntries(
            Map.entry(0x00FFFFFF, "Transparent"),
            Map.entry(0xFF000000, "Black"),
            Map.entry(0xFFFFFFFF, "White"),
            Map.entry(0xFFFF0000, "Red"),
            Map.entry(0xFF008000, "Green"),
            Map.entry(0xFF00FF00, "Lime"),
            Map.entry(0xFF0000FF, "Blue"),
            Map.entry(0xFFFFFF00, "Yellow"),
            Map.entry(0xFF00FFFF, "Cyan"),
            Map.entry(0xFFFF00FF, "Magenta"),
            Map.entry(0xFF808080, "Gray"),
            Map.entry(0xFFC0C0C0, "Silver"),
            Map.entry(0xFF800000, "Maroon"),
            Map.entry(0xFF000080, "Navy"),
            Map.entry(0xFF008080, "Teal"),
            Map.entry(0xFF800080, "Purple"),
            Map.entry(0xFF808000, "Olive"),
            Map.entry(0xFFFFA500, "Orange"));

    public Color {
        checkChannel("a", a);
        checkChannel("r", r);
        checkChannel("g", g);
        checkChannel("b", b);
    }

    public static Color fromArgb(int a, int r, int g, int b) {
        return new Color(a, r, g, b);
    }

    public static Color fromArgb(int argb) {
        return new Color((argb >>> 24) & 0xFF, (argb >>> 16) & 0xFF, (argb >>> 8) & 0xFF, argb & 0xFF);
    }

    public int toArgb() {
        return (a << 24) | (r << 16) | (g << 8) | b;
    }

    public String getName() {
        String known = KNOWN_NAMES.get(toArgb());
        return known != null ? known : String.format(Locale.ROOT, "%08X", toArgb());
    }

    private static void checkChannel(String channel, int value) {
        if (value < 0 || value > 0xFF) {
            throw new IllegalArgumentException("Color channel " + channel + " out of range: " + value);
        }
    }
}
