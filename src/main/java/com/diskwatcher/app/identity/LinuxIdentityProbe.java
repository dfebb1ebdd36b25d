package com.diskwatcher.app.identity;

import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Probe backed by util-linux: {@code findmnt} for the mount entry and {@code lsblk -P} for the
 * block device (and its parent disk, for model/serial).
 */
public final class LinuxIdentityProbe implements IdentityProbe {

    private static final Logger logger = LoggerFactory.getLogger(LinuxIdentityProbe.class);

    static final Duration COMMAND_TIMEOUT = Duration.ofSeconds(5);

    static final String LSBLK_COLUMNS =
            "NAME,PATH,PKNAME,UUID,LABEL,MODEL,SERIAL,VENDOR,SIZE,FSVER,PTTYPE,PTUUID,"
                    + "PARTTYPE,PARTUUID,PARTTYPENAME,WWN,MAJ:MIN";

    // KEY="value" pairs; lsblk escapes unsafe bytes as \xHH
    private static final Pattern PAIR = Pattern.compile("([A-Z0-9_:\\-]+)=\"((?:[^\"\\\\]|\\\\.)*)\"");
    private static final Pattern HEX_ESCAPE = Pattern.compile("\\\\x([0-9a-fA-F]{2})");

    private final CommandRunner runner;

    public LinuxIdentityProbe(CommandRunner runner) {
        this.runner = runner;
    }

    @Override
    public Optional<MountInfo> probeMount(Path directory) {
        String target = directory.toAbsolutePath().normalize().toString();
        Optional<String> out = runner.run(List.of(
                "findmnt", "--noheadings", "-P",
                "--output", "TARGET,SOURCE,FSTYPE,UUID,LABEL",
                "--target", target), COMMAND_TIMEOUT);
        if (out.isEmpty()) return Optional.empty();

        Map<String, String> pairs = firstLine(out.get());
        String mountTarget = BlockDeviceInfo.clean(pairs.get("TARGET"));
        if (mountTarget == null) {
            logger.debug("findmnt returned no target dir={}", target);
            return Optional.empty();
        }
        return Optional.of(new MountInfo(
                Path.of(mountTarget),
                BlockDeviceInfo.clean(pairs.get("SOURCE")),
                BlockDeviceInfo.clean(pairs.get("FSTYPE")),
                BlockDeviceInfo.clean(pairs.get("UUID")),
                BlockDeviceInfo.clean(pairs.get("LABEL")),
                null
        ));
    }

    @Override
    public Optional<BlockDeviceInfo> probeBlockDevice(String device) {
        if (device == null || !device.startsWith("/dev/")) return Optional.empty();

        Optional<BlockDeviceInfo> info = lsblk(device);
        if (info.isEmpty()) return info;

        BlockDeviceInfo dev = info.get();
        String parent = BlockDeviceInfo.clean(dev.raw().get("PKNAME"));
        if (parent != null && (dev.model() == null || dev.serial() == null)) {
            Optional<BlockDeviceInfo> disk = lsblk("/dev/" + parent);
            if (disk.isPresent()) {
                return Optional.of(dev.withParentHardware(disk.get()));
            }
        }
        return Optional.of(dev);
    }

    private Optional<BlockDeviceInfo> lsblk(String device) {
        Optional<String> out = runner.run(List.of(
                "lsblk", "-P", "--nodeps", "-o", LSBLK_COLUMNS, device), COMMAND_TIMEOUT);
        if (out.isEmpty()) return Optional.empty();

        Map<String, String> pairs = firstLine(out.get());
        if (pairs.isEmpty()) return Optional.empty();
        return Optional.of(BlockDeviceInfo.fromPairs(pairs));
    }

    static Map<String, String> firstLine(String output) {
        for (String line : output.split("\\R")) {
            if (!line.isBlank()) return parsePairs(line);
        }
        return Map.of();
    }

    static Map<String, String> parsePairs(String line) {
        Map<String, String> out = new LinkedHashMap<>();
        Matcher m = PAIR.matcher(line);
        while (m.find()) {
            // util-linux prints MAJ:MIN in older releases, MAJ_MIN in newer ones
            String key = m.group(1).replace(':', '_');
            out.put(key, unescape(m.group(2)));
        }
        return out;
    }

    static String unescape(String value) {
        if (value.indexOf('\\') < 0) return value;
        Matcher m = HEX_ESCAPE.matcher(value);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            char c = (char) Integer.parseInt(m.group(1), 16);
            m.appendReplacement(sb, Matcher.quoteReplacement(String.valueOf(c)));
        }
        m.appendTail(sb);
        return sb.toString();
    }
}
