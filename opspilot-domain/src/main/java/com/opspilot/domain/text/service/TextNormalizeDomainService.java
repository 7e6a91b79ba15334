package com.opspilot.domain.text.service;

import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;
import org.springframework.web.util.HtmlUtils;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 文本归一领域服务：去除 HTML 标记噪声与空白不规整。
 * <p>
 * 护栏使用 {@link #normalizeQuery(String)}，收据解析使用 {@link #normalizeDocument(String)}。
 * </p>
 */
@Service
public class TextNormalizeDomainService {

    private static final String[] HTML_HINTS = {"<html", "<table", "<tr", "<td", "<div", "<br", "<body"};
    private static final Pattern LINE_BREAK_TAG = Pattern.compile(
            "(?i)<\\s*br\\s*/?\\s*>|<\\s*/\\s*(tr|p|div|li|h[1-6]|td|th)\\s*>");
    private static final Pattern ANY_TAG = Pattern.compile("<[^>]+>");
    private static final Pattern INLINE_SPACES = Pattern.compile("[ \\t]+");
    private static final Pattern BLANK_LINES = Pattern.compile("\\n\\s*\\n+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /**
     * 单行提问归一：解码 HTML 实体并折叠空白，保留标签原文以便识别 system 标签。
     */
    public String normalizeQuery(String raw) {
        if (StringUtils.isBlank(raw)) {
            return "";
        }
        String text = raw.indexOf('&') >= 0 ? HtmlUtils.htmlUnescape(raw) : raw;
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }

    /**
     * 多行文档归一：统一换行，HTML 块标签转换行、其余标签转空格，折叠空白与空行。
     */
    public String normalizeDocument(String raw) {
        if (StringUtils.isBlank(raw)) {
            return "";
        }
        String text = raw.replace("\r\n", "\n").replace('\r', '\n');
        if (looksLikeHtml(text)) {
            text = LINE_BREAK_TAG.matcher(text).replaceAll("\n");
            text = ANY_TAG.matcher(text).replaceAll(" ");
            text = HtmlUtils.htmlUnescape(text);
        }
        text = INLINE_SPACES.matcher(text).replaceAll(" ");
        text = BLANK_LINES.matcher(text).replaceAll("\n");
        return text.trim();
    }

    private boolean looksLikeHtml(String text) {
        String lowered = text.toLowerCase(Locale.ROOT);
        for (String hint : HTML_HINTS) {
            if (lowered.contains(hint)) {
                return true;
            }
        }
        return false;
    }
}
