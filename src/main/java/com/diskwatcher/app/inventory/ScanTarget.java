package com.diskwatcher.app.inventory;

import java.nio.file.Path;

public record ScanTarget(String volumeId, Path root) {}
