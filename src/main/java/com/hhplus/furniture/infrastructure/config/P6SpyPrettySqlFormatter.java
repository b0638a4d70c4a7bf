package com.hhplus.furniture.infrastructure.config;

import com.p6spy.engine.spy.appender.MessageFormattingStrategy;
import org.hibernate.engine.jdbc.internal.FormatStyle;

/**
 * P6Spy 로그 포맷. 카테고리, 실행 시간, 포매팅된 SQL을 한 블록으로 출력한다.
 */
public class P6SpyPrettySqlFormatter implements MessageFormattingStrategy {

    @Override
    public String formatMessage(int connectionId, String now, long elapsed, String category,
                                String prepared, String sql, String url) {
        if (sql == null || sql.isBlank()) {
            return "";
        }
        String cleanedSql = sql.trim().replaceAll("\\s+", " ");
        return "\n[P6Spy] " + category + " | " + elapsed + "ms" + format(cleanedSql);
    }

    private String format(String sql) {
        String lower = sql.toLowerCase();
        // DDL은 줄바꿈 없이 그대로
        if (lower.startsWith("create") || lower.startsWith("alter") || lower.startsWith("drop")) {
            return "\n" + sql;
        }
        try {
            return FormatStyle.BASIC.getFormatter().format(sql);
        } catch (RuntimeException e) {
            return "\n" + sql;
        }
    }
}
