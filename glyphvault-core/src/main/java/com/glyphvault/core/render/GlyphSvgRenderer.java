package com.glyphvault.core.render;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Deterministic SVG identifiers for glyphs.
 *
 * Colors come from the tail of the id: the last six hex digits give the
 * primary color, the six before them the secondary. Ids without the
 * {@code 0x} prefix get the fixed palette.
 */
public class GlyphSvgRenderer {

    public static final String DEFAULT_PRIMARY = "#4ecdc4";
    public static final String DEFAULT_SECONDARY = "#ffe66d";
    public static final String DEFAULT_BADGE_LABEL = "Verified";

    private static final Pattern HEX = Pattern.compile("[0-9a-fA-F]{6}");
    private static final int SHORT_ID_LENGTH = 10;

    /**
     * Primary and secondary color of a glyph, as {@code #rrggbb}.
     */
    public record GlyphColors(String primary, String secondary) {}

    public GlyphColors colors(String glyphId) {
        Objects.requireNonNull(glyphId, "Glyph id cannot be null");
        if (!glyphId.startsWith("0x")) {
            return new GlyphColors(DEFAULT_PRIMARY, DEFAULT_SECONDARY);
        }
        String primary = glyphId.length() >= 8 ? hexColor(glyphId.substring(glyphId.length() - 6)) : null;
        String secondary = glyphId.length() > 12
                ? hexColor(glyphId.substring(glyphId.length() - 12, glyphId.length() - 6))
                : null;
        return new GlyphColors(
                primary != null ? primary : DEFAULT_PRIMARY,
                secondary != null ? secondary : DEFAULT_SECONDARY);
    }

    public String renderIcon(String glyphId) {
        return renderIcon(glyphId, 100);
    }

    /**
     * Square icon: gradient disc in the glyph's colors with a ring, a "G"
     * mark and a check mark.
     */
    public String renderIcon(String glyphId, int size) {
        requirePositive(size);
        GlyphColors colors = colors(glyphId);
        String gradientId = "grad_" + escapeXml(tail(glyphId, 8));
        double s = size;
        return """
                <svg viewBox="0 0 %1$s %1$s" xmlns="http://www.w3.org/2000/svg">
                  <defs>
                    <linearGradient id="%2$s" x1="0%%" y1="0%%" x2="100%%" y2="100%%">
                      <stop offset="0%%" style="stop-color:%3$s;stop-opacity:0.9" />
                      <stop offset="100%%" style="stop-color:%4$s;stop-opacity:0.9" />
                    </linearGradient>
                    <filter id="glow">
                      <feGaussianBlur stdDeviation="2" result="coloredBlur"/>
                      <feMerge>
                        <feMergeNode in="coloredBlur"/>
                        <feMergeNode in="SourceGraphic"/>
                      </feMerge>
                    </filter>
                  </defs>
                  <circle cx="%5$s" cy="%5$s" r="%6$s" fill="url(#%2$s)" filter="url(#glow)" />
                  <circle cx="%5$s" cy="%5$s" r="%7$s" fill="none" stroke="white" stroke-width="2" opacity="0.5" />
                  <text x="%5$s" y="%8$s" text-anchor="middle" fill="white" font-size="%6$s" font-weight="bold" font-family="Arial, sans-serif" filter="url(#glow)">G</text>
                  <path d="M %9$s %10$s L %11$s %12$s L %13$s %14$s" stroke="white" stroke-width="3" fill="none" stroke-linecap="round" opacity="0.8" />
                </svg>
                """.formatted(
                number(s), gradientId, colors.primary(), colors.secondary(),
                number(s / 2), number(s * 0.4), number(s * 0.25), number(s / 2 + 8),
                number(s * 0.7), number(s * 0.25), number(s * 0.75), number(s * 0.3),
                number(s * 0.85), number(s * 0.2));
    }

    public String renderBadge(String glyphId) {
        return renderBadge(glyphId, DEFAULT_BADGE_LABEL, 200);
    }

    /**
     * Wide badge with a label and the id shortened to its first ten
     * characters.
     */
    public String renderBadge(String glyphId, String label, int size) {
        requirePositive(size);
        Objects.requireNonNull(label, "Label cannot be null");
        GlyphColors colors = colors(glyphId);
        double s = size;
        return """
                <svg viewBox="0 0 %1$s %2$s" xmlns="http://www.w3.org/2000/svg">
                  <defs>
                    <linearGradient id="badge-grad" x1="0%%" y1="0%%" x2="100%%" y2="0%%">
                      <stop offset="0%%" style="stop-color:%3$s;stop-opacity:1" />
                      <stop offset="100%%" style="stop-color:%4$s;stop-opacity:1" />
                    </linearGradient>
                  </defs>
                  <rect x="0" y="0" width="%1$s" height="%2$s" rx="15" fill="url(#badge-grad)" />
                  <circle cx="%5$s" cy="%6$s" r="%7$s" fill="white" opacity="0.3" />
                  <text x="%5$s" y="%8$s" text-anchor="middle" fill="white" font-size="%9$s" font-weight="bold">G</text>
                  <text x="%10$s" y="%11$s" text-anchor="middle" fill="white" font-size="%12$s" font-weight="bold">%13$s</text>
                  <text x="%10$s" y="%14$s" text-anchor="middle" fill="white" font-size="%15$s" opacity="0.8">%16$s</text>
                </svg>
                """.formatted(
                number(s), number(s / 2), DEFAULT_PRIMARY, colors.primary(),
                number(s / 6), number(s / 4), number(s / 8), number(s / 4 + 8), number(s / 10),
                number(s / 2 + 20), number(s / 4 - 5), number(s / 12), escapeXml(label),
                number(s / 4 + 15), number(s / 20), escapeXml(shortId(glyphId)));
    }

    static String shortId(String glyphId) {
        return glyphId.length() > SHORT_ID_LENGTH ? glyphId.substring(0, SHORT_ID_LENGTH) + "..." : glyphId;
    }

    static String escapeXml(String text) {
        StringBuilder escaped = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '&' -> escaped.append("&amp;");
                case '<' -> escaped.append("&lt;");
                case '>' -> escaped.append("&gt;");
                case '"' -> escaped.append("&quot;");
                case '\'' -> escaped.append("&apos;");
                default -> escaped.append(c);
            }
        }
        return escaped.toString();
    }

    private static String hexColor(String digits) {
        return HEX.matcher(digits).matches() ? "#" + digits.toLowerCase() : null;
    }

    private static String tail(String text, int length) {
        return text.length() > length ? text.substring(text.length() - length) : text;
    }

    private static String number(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).stripTrailingZeros().toPlainString();
    }

    private static void requirePositive(int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("Size must be positive");
        }
    }
}
