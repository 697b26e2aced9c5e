package com.eyelevel.mediamigrator.service.disk;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Measures the real disk footprint of the work directory.
 */
public interface DiskUsageProbe {

    /**
     * @return total bytes of all files currently under {@code directory}.
     */
    long measureUsedBytes(Path directory) throws IOException;

    /**
     * @return bytes still usable on the filesystem holding {@code directory}.
     */
    long usableBytes(Path directory) throws IOException;
}
