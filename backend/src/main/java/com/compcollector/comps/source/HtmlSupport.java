package com.compcollector.comps.source;

import org.jsoup.nodes.Element;

final class HtmlSupport {

    private HtmlSupport() {
    }

    static String text(Element root, String cssQuery) {
        if (root == null) {
            return null;
        }
        Element element = root.selectFirst(cssQuery);
        if (element == null) {
            return null;
        }
        return blankToNull(element.text());
    }

    static String absAttr(Element root, String cssQuery, String attribute) {
        if (root == null) {
            return null;
        }
        Element element = root.selectFirst(cssQuery);
        if (element == null) {
            return null;
        }
        return blankToNull(element.absUrl(attribute));
    }

    static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }

    static String blankToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.strip();
        return trimmed.isEmpty() ? null : trimmed;
    }

    static boolean isHttpUrl(String value) {
        return value != null && (value.startsWith("https://") || value.startsWith("http://"));
    }
}
