package com.diskwatcher.app.identity;

import java.util.Map;

/**
 * Block-device attributes as reported by lsblk (or OSHI). Blank values are normalized to null;
 * {@code raw} keeps every key/value pair the probe saw, for persistence.
 */
public record BlockDeviceInfo(
        String name,
        String path,
        String uuid,
        String label,
        String model,
        String serial,
        String vendor,
        String size,
        String fsver,
        String pttype,
        String ptuuid,
        String parttype,
        String partuuid,
        String parttypename,
        String wwn,
        String majMin,
        Map<String, String> raw
) {
    public BlockDeviceInfo {
        raw = raw == null ? Map.of() : Map.copyOf(raw);
    }

    static BlockDeviceInfo fromPairs(Map<String, String> pairs) {
        return new BlockDeviceInfo(
                clean(pairs.get("NAME")),
                clean(pairs.get("PATH")),
                clean(pairs.get("UUID")),
                clean(pairs.get("LABEL")),
                clean(pairs.get("MODEL")),
                clean(pairs.get("SERIAL")),
                clean(pairs.get("VENDOR")),
                clean(pairs.get("SIZE")),
                clean(pairs.get("FSVER")),
                clean(pairs.get("PTTYPE")),
                clean(pairs.get("PTUUID")),
                clean(pairs.get("PARTTYPE")),
                clean(pairs.get("PARTUUID")),
                clean(pairs.get("PARTTYPENAME")),
                clean(pairs.get("WWN")),
                clean(pairs.get("MAJ_MIN")),
                pairs
        );
    }

    /** Fills hardware fields this (partition) row lacks from its parent disk row. */
    BlockDeviceInfo withParentHardware(BlockDeviceInfo parent) {
        if (parent == null) return this;
        return new BlockDeviceInfo(
                name, path, uuid, label,
                model != null ? model : parent.model(),
                serial != null ? serial : parent.serial(),
                vendor != null ? vendor : parent.vendor(),
                size, fsver, pttype,
                ptuuid != null ? ptuuid : parent.ptuuid(),
                parttype, partuuid, parttypename,
                wwn != null ? wwn : parent.wwn(),
                majMin, raw
        );
    }

    static String clean(String v) {
        if (v == null) return null;
        String t = v.trim();
        return t.isEmpty() ? null : t;
    }
}
