package com.eyelevel.mediamigrator.service.disk;

import org.apache.commons.io.file.Counters;
import org.apache.commons.io.file.CountingPathVisitor;
import org.apache.commons.io.file.PathUtils;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * Measures the work directory while workers keep creating and deleting files in it. Entries that vanish
 * mid-walk are not counted; any other I/O failure is reported.
 */
@Component
public class FileSystemDiskUsageProbe implements DiskUsageProbe {

    @Override
    public long measureUsedBytes(Path directory) throws IOException {
        if (!Files.isDirectory(directory)) {
            return 0L;
        }
        return PathUtils.visitFileTree(new ChurnTolerantCountingVisitor(), directory)
                        .getPathCounters()
                        .getByteCounter()
                        .getLong();
    }

    @Override
    public long usableBytes(Path directory) throws IOException {
        return Files.getFileStore(directory).getUsableSpace();
    }

    static final class ChurnTolerantCountingVisitor extends CountingPathVisitor {

        ChurnTolerantCountingVisitor() {
            super(Counters.longPathCounters());
        }

        @Override
        public FileVisitResult visitFileFailed(Path file, IOException exc) throws IOException {
            if (exc instanceof NoSuchFileException) {
                return FileVisitResult.CONTINUE;
            }
            throw exc;
        }

        @Override
        public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
            if (exc != null && !(exc instanceof NoSuchFileException)) {
                throw exc;
            }
            return super.postVisitDirectory(dir, null);
        }
    }
}
