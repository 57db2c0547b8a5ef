package com.assetmetrics.history.util;

/**
 * Decodes metric names sent by OpenTSDB dashboards.
 *
 * OpenTSDB only allows letters, digits, '-', '_', '.' and '/' in metric names, so
 * upstream names such as {@code cpu:used:percent.avg} arrive escaped. '_' is the
 * escape character: {@code __} stands for '_' and {@code _XX} (two hex digits) for
 * the character with that code, e.g. {@code cpu_3Aused_3Apercent.avg}.
 * A '_' that starts neither form is kept as is, so unescaped names pass through.
 */
public final class MetricNames {

    private static final char ESCAPE = '_';

    private MetricNames() {
    }

    public static String unescape(String name) {
        if (name == null || name.indexOf(ESCAPE) < 0) {
            return name;
        }
        StringBuilder result = new StringBuilder(name.length());
        int i = 0;
        while (i < name.length()) {
            char c = name.charAt(i);
            if (c != ESCAPE) {
                result.append(c);
                i++;
            } else if (i + 1 < name.length() && name.charAt(i + 1) == ESCAPE) {
                result.append(ESCAPE);
                i += 2;
            } else if (i + 2 < name.length() && isHex(name.charAt(i + 1)) && isHex(name.charAt(i + 2))) {
                result.append((char) Integer.parseInt(name.substring(i + 1, i + 3), 16));
                i += 3;
            } else {
                result.append(c);
                i++;
            }
        }
        return result.toString();
    }

    private static boolean isHex(char c) {
        return Character.digit(c, 16) >= 0;
    }
}
