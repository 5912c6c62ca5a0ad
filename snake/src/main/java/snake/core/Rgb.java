package snake.core;

import java.util.HexFormat;

public record Rgb(int r, int g, int b) {
    public Rgb {
        if (r < 0 || r > 255 || g < 0 || g > 255 || b < 0 || b > 255)
            throw new IllegalArgumentException("RGB component out of range: " + r + "," + g + "," + b);
    }

    /** Parses {@code #RRGGBB} (the leading '#' is optional). */
    public static Rgb parse(String hex) {
        String s = hex.startsWith("#") ? hex.substring(1) : hex;
        if (s.length() != 6 || !s.chars().allMatch(HexFormat::isHexDigit))
            throw new IllegalArgumentException("Expected #RRGGBB, got '" + hex + "'");
        int v = HexFormat.fromHexDigits(s);
        return new Rgb((v >> 16) & 0xFF, (v >> 8) & 0xFF, v & 0xFF);
    }
}
