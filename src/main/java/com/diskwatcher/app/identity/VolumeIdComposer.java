package com.diskwatcher.app.identity;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

/**
 * Pure composition of a volume id from whatever signals were gathered.
 *
 * <p>Precedence (first usable wins):
 * <ol>
 *   <li>filesystem UUID, verbatim</li>
 *   <li>partition UUID, verbatim</li>
 *   <li>hardware tuple {@code serial=..|model=..|vendor=..|fsver=..} with only the present parts,
 *       needs a serial or a model</li>
 *   <li>raw device path, verbatim</li>
 *   <li>normalized absolute directory path</li>
 * </ol>
 * Values are trimmed; blank means absent. Changing this order changes every stored id.
 */
public final class VolumeIdComposer {

    private VolumeIdComposer() {}

    public record Signals(
            String fsUuid,
            String partUuid,
            String serial,
            String model,
            String vendor,
            String fsver,
            String device,
            Path directory
    ) {}

    public record Composition(String volumeId, IdentitySource source) {}

    public static Composition compose(Signals s) {
        String fsUuid = StringUtils.trimToNull(s.fsUuid());
        if (fsUuid != null) return new Composition(fsUuid, IdentitySource.FS_UUID);

        String partUuid = StringUtils.trimToNull(s.partUuid());
        if (partUuid != null) return new Composition(partUuid, IdentitySource.PART_UUID);

        String hardware = hardwareTuple(s.serial(), s.model(), s.vendor(), s.fsver());
        if (hardware != null) return new Composition(hardware, IdentitySource.HARDWARE);

        String device = StringUtils.trimToNull(s.device());
        if (device != null) return new Composition(device, IdentitySource.DEVICE);

        return new Composition(normalizeDirectory(s.directory()), IdentitySource.DIRECTORY);
    }

    static String hardwareTuple(String serial, String model, String vendor, String fsver) {
        String sr = StringUtils.trimToNull(serial);
        String md = StringUtils.trimToNull(model);
        if (sr == null && md == null) return null;

        List<String> parts = new ArrayList<>(4);
        if (sr != null) parts.add("serial=" + sr);
        if (md != null) parts.add("model=" + md);
        String vd = StringUtils.trimToNull(vendor);
        if (vd != null) parts.add("vendor=" + vd);
        String fv = StringUtils.trimToNull(fsver);
        if (fv != null) parts.add("fsver=" + fv);
        return String.join("|", parts);
    }

    public static String normalizeDirectory(Path directory) {
        if (directory == null) {
            throw new IllegalArgumentException("directory is required");
        }
        return directory.toAbsolutePath().normalize().toString();
    }
}
