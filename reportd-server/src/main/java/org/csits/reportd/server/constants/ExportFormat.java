package org.csits.reportd.server.constants;

import java.util.Locale;

/**
 * 报表导出格式。
 */
public enum ExportFormat {
    CSV("csv", "text/csv"),
    JSON("json", "application/json");

    private final String extension;
    private final String contentType;

    ExportFormat(String extension, String contentType) {
        this.extension = extension;
        this.contentType = contentType;
    }

    public String getExtension() {
        return extension;
    }

    public String getContentType() {
        return contentType;
    }

    /**
     * 未知格式按 CSV 处理。
     */
    public static ExportFormat fromValue(String value) {
        if (value != null && JSON.extension.equals(value.trim().toLowerCase(Locale.ROOT))) {
            return JSON;
        }
        return CSV;
    }
}
