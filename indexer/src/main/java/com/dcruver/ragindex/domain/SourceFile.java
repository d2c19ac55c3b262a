package com.dcruver.ragindex.domain;

import lombok.Value;

/**
 * One entry of a source directory snapshot. {@code modifiedTime} is epoch millis.
 */
@Value
public class SourceFile {
    String path;
    long modifiedTime;
}
