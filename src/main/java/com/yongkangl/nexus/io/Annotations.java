package com.yongkangl.nexus.io;

import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

// Key/value pairs from command comments: [&rate=1.2,height={1.0,2.0}] and [&&NHX:S=human:E=1.1].
final class Annotations {
    private static final String NHX = "&&NHX";

    private Annotations() {
    }

    static void parse(String body, Map<String, String> into) {
        String content;
        char separator;
        if (StringUtils.startsWithIgnoreCase(body, NHX)) {
            content = body.substring(NHX.length());
            separator = ':';
        } else {
            content = StringUtils.removeStart(body, "&");
            separator = ',';
        }
        for (String pair : split(content, separator)) {
            if (StringUtils.isBlank(pair)) {
                continue;
            }
            int equals = pair.indexOf('=');
            if (equals < 0) {
                into.put(pair.trim(), "");
            } else {
                into.put(pair.substring(0, equals).trim(), pair.substring(equals + 1).trim());
            }
        }
    }

    // Splits on the separator outside of braces and double quotes.
    private static List<String> split(String content, char separator) {
        List<String> parts = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int braces = 0;
        boolean quoted = false;
        for (int i = 0; i < content.length(); i++) {
            char c = content.charAt(i);
            if (c == '"') {
                quoted = !quoted;
            } else if (!quoted && c == '{') {
                braces++;
            } else if (!quoted && c == '}') {
                braces--;
            }
            if (c == separator && braces == 0 && !quoted) {
                parts.add(current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        parts.add(current.toString());
        return parts;
    }
}
