package com.diskwatcher.app.identity;

/** Which fallback step produced a volume id, strongest first. */
public enum IdentitySource {
    FS_UUID,
    PART_UUID,
    HARDWARE,
    DEVICE,
    DIRECTORY
}
