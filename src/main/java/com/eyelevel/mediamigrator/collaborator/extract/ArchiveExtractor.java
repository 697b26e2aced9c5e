package com.eyelevel.mediamigrator.collaborator.extract;

import java.nio.file.Path;
import java.util.List;

public interface ArchiveExtractor {

    /**
     * Extracts every relevant entry of {@code archivePath} below {@code targetDir}, replacing earlier output.
     *
     * @throws com.eyelevel.mediamigrator.exception.CorruptInputException if the archive is corrupt or truncated;
     *                                                                    no partial output is left behind.
     */
    List<ExtractedEntry> extract(Path archivePath, Path targetDir);
}
