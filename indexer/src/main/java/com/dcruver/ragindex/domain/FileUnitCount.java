package com.dcruver.ragindex.domain;

/**
 * Number of stored units attributed to one source file.
 */
public record FileUnitCount(String sourcePath, int unitCount) {}
