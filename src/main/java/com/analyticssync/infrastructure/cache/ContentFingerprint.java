package com.analyticssync.infrastructure.cache;

import com.analyticssync.domain.model.AnalyticsReport;
import com.analyticssync.domain.model.ReportRow;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.zip.CRC32;

/**
 * Cheap change-detection hash over a report.
 *
 * Only the row count and the first and last rows are hashed, so a change confined to
 * middle rows is not detected. Good enough to decide whether dashboards need a redraw.
 */
public final class ContentFingerprint {

    public static final String EMPTY = "empty";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ContentFingerprint() {
    }

    public static String of(AnalyticsReport report) {
        if (report == null || report.getRows().isEmpty()) {
            return EMPTY;
        }
        List<ReportRow> rows = report.getRows();
        try {
            String input = rows.size()
                    + "|" + MAPPER.writeValueAsString(rows.get(0))
                    + "|" + MAPPER.writeValueAsString(rows.get(rows.size() - 1));
            CRC32 crc = new CRC32();
            crc.update(input.getBytes(StandardCharsets.UTF_8));
            return Long.toHexString(crc.getValue());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Report rows are not serializable", e);
        }
    }
}
