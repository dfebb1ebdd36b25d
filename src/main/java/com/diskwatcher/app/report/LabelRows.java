package com.diskwatcher.app.report;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.commons.lang3.StringUtils;

import com.diskwatcher.app.database.CatalogRows.VolumeRow;

/**
 * Printable label rows for volumes: a stable index plus a short id a person can match against
 * the physical disk.
 */
public final class LabelRows {

    public static final List<String> LABEL_EXPORT_COLUMNS = List.of(
            "volume_id",
            "directory",
            "mount_label",
            "mount_uuid",
            "mount_volume_id",
            "mount_device",
            "lsblk_ptuuid",
            "lsblk_partuuid",
            "lsblk_wwn",
            "lsblk_model",
            "lsblk_serial",
            "lsblk_vendor",
            "lsblk_size",
            "usage_total_bytes",
            "usage_used_bytes",
            "usage_free_bytes"
    );

    private static final Pattern HEX_RUN = Pattern.compile("[0-9a-fA-F]+");
    private static final int MAX_HUMAN_ID = 12;
    private static final int MIN_SUFFIX = 6;

    public record LabelRow(int labelIndex, String humanId, Map<String, Object> values) {
        public LabelRow {
            values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        }
    }

    private LabelRows() {}

    public static List<LabelRow> buildRows(List<VolumeRow> volumes) {
        List<LabelRow> rows = new ArrayList<>(volumes.size());
        int position = 0;
        for (VolumeRow v : volumes) {
            position++;
            int index = v.labelIndex() != null && v.labelIndex() > 0 ? v.labelIndex() : position;
            rows.add(new LabelRow(index, deriveHumanId(v), columns(v)));
        }
        return rows;
    }

    public static String deriveHumanId(VolumeRow v) {
        return deriveHumanId(v.lsblkPartuuid(), v.lsblkPtuuid(), v.mountUuid(), v.volumeId());
    }

    /**
     * First non-blank of the candidates in preference order, shortened: composite ids keep
     * their last hex run, dashed ids keep trailing segments until at least six characters, and
     * the result is clamped to the last twelve characters.
     */
    public static String deriveHumanId(String partUuid, String ptUuid, String mountUuid, String volumeId) {
        String token = firstNonBlank(partUuid, ptUuid, mountUuid, volumeId);
        if (token == null) return "";
        token = token.trim();

        if (token.contains("=") || token.contains("|")) {
            String last = null;
            Matcher m = HEX_RUN.matcher(token);
            while (m.find()) last = m.group();
            if (last != null) token = last;
        }

        if (token.contains("-")) {
            List<String> parts = new ArrayList<>();
            for (String p : token.split("-")) {
                if (!p.isEmpty()) parts.add(p);
            }
            if (!parts.isEmpty()) {
                String acc = parts.get(parts.size() - 1);
                int idx = parts.size() - 2;
                while (acc.length() < MIN_SUFFIX && idx >= 0) {
                    acc = parts.get(idx) + "-" + acc;
                    idx--;
                }
                token = acc;
            }
        }

        if (token.length() > MAX_HUMAN_ID) {
            token = token.substring(token.length() - MAX_HUMAN_ID);
        }
        return token;
    }

    private static String firstNonBlank(String... values) {
        for (String v : values) {
            if (StringUtils.isNotBlank(v)) return v;
        }
        return null;
    }

    private static Map<String, Object> columns(VolumeRow v) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("volume_id", v.volumeId());
        m.put("directory", v.directory());
        m.put("mount_label", v.mountLabel());
        m.put("mount_uuid", v.mountUuid());
        m.put("mount_volume_id", v.mountVolumeId());
        m.put("mount_device", v.mountDevice());
        m.put("lsblk_ptuuid", v.lsblkPtuuid());
        m.put("lsblk_partuuid", v.lsblkPartuuid());
        m.put("lsblk_wwn", v.lsblkWwn());
        m.put("lsblk_model", v.lsblkModel());
        m.put("lsblk_serial", v.lsblkSerial());
        m.put("lsblk_vendor", v.lsblkVendor());
        m.put("lsblk_size", v.lsblkSize());
        m.put("usage_total_bytes", v.usageTotalBytes());
        m.put("usage_used_bytes", v.usageUsedBytes());
        m.put("usage_free_bytes", v.usageFreeBytes());
        return m;
    }
}
