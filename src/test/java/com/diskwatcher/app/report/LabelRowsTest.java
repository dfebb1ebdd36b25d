package com.diskwatcher.app.report;

import com.diskwatcher.app.database.CatalogRows.VolumeRow;
import com.diskwatcher.app.report.LabelRows.LabelRow;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class LabelRowsTest {

    static VolumeRow volume(String id, Integer labelIndex, String mountUuid, String ptuuid, String partuuid) {
        return new VolumeRow(id, "/mnt/" + id, "2024-01-01T00:00:00.000000Z", labelIndex,
                0, 0, 0, 0, 0, null,
                2000L, 500L, 1500L, null, 0,
                "/dev/sdb1", null, null, mountUuid, "LBL", null,
                null, null, "Model", "SER", null, null, null, null,
                ptuuid, null, partuuid, null, null, null, null,
                null, null);
    }

    @Test
    void humanIdPrefersPartitionUuid() {
        assertEquals("426614174000",
                LabelRows.deriveHumanId("123e4567-e89b-12d3-a456-426614174000", "pt", "mnt", "vol"));
        assertEquals("abcdef12-01", LabelRows.deriveHumanId(null, "abcdef12-01", "mnt", "vol"));
        assertEquals("1234-ABCD", LabelRows.deriveHumanId(" ", "", "1234-ABCD", "vol"));
    }

    @Test
    void humanIdKeepsLastHexRunOfCompositeIds() {
        assertEquals("1a2b3c", LabelRows.deriveHumanId(null, null, null, "serial=zz|fsver=1a2b3c"));
    }

    @Test
    void humanIdClampedToTwelveCharacters() {
        assertEquals("EF0123456789", LabelRows.deriveHumanId(null, null, null, "ABCDEF0123456789"));
        assertEquals("", LabelRows.deriveHumanId(null, null, null, null));
    }

    @Test
    void buildRowsUsesStoredIndexOrPosition() {
        List<LabelRow> rows = LabelRows.buildRows(List.of(
                volume("a", 4, "uuid-aaaaaa", null, null),
                volume("b", null, null, null, "part-bbbbbb")));

        assertEquals(4, rows.get(0).labelIndex());
        assertEquals(2, rows.get(1).labelIndex(), "Missing index falls back to the list position");
        assertEquals("aaaaaa", rows.get(0).humanId());
        assertEquals("bbbbbb", rows.get(1).humanId());
        assertEquals(LabelRows.LABEL_EXPORT_COLUMNS, List.copyOf(rows.get(0).values().keySet()));
        assertEquals("/mnt/a", rows.get(0).values().get("directory"));
        assertEquals(1500L, rows.get(0).values().get("usage_free_bytes"));
    }
}
