package com.diskwatcher.app.service;

import java.nio.file.Path;
import java.util.Set;

/** What the discovery loop drives: attach newly mounted directories, detach vanished ones. */
public interface VolumeAttachments {

    /** Registers the directory, scans it when asked, and watches it when watching is on. */
    void attach(Path directory, boolean scan);

    /** Cancels the directory's jobs and forgets it. False when it was not attached. */
    boolean detach(Path directory);

    Set<Path> attached();
}
