package com.eyelevel.mediamigrator.collaborator.source;

import java.nio.file.Path;
import java.util.List;

/**
 * Where the Takeout archives come from.
 */
public interface ArchiveSource {

    /**
     * Lists every archive currently available, ordered by id.
     *
     * @throws com.eyelevel.mediamigrator.exception.TransientCollaboratorException if the source is unreachable.
     * @throws com.eyelevel.mediamigrator.exception.PermanentCollaboratorException if the source is misconfigured.
     */
    List<RemoteArchive> listAvailable();

    /**
     * Copies the archive into {@code targetDir}. The returned file is complete: a partially transferred copy is
     * never left under its final name.
     */
    Path fetch(RemoteArchive archive, Path targetDir);
}
