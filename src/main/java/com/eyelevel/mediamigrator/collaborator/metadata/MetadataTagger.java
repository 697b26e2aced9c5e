package com.eyelevel.mediamigrator.collaborator.metadata;

import java.nio.file.Path;

/**
 * Writes capture metadata into a media file in place.
 * <p>
 * Implementations report failures with the boundary exceptions of the pipeline:
 * {@link com.eyelevel.mediamigrator.exception.TransientCollaboratorException},
 * {@link com.eyelevel.mediamigrator.exception.PermanentCollaboratorException} or
 * {@link com.eyelevel.mediamigrator.exception.CorruptInputException}.
 */
public interface MetadataTagger {

    void applyMetadata(Path mediaPath, MediaMetadata metadata);
}
