package com.eyelevel.mediamigrator.collaborator.upload;

import java.nio.file.Path;
import java.util.Set;

/**
 * Sends one media file to the target photo service.
 */
public interface PhotoUploader {

    /**
     * @return the identifier the photo service assigned to the uploaded file.
     */
    String upload(Path mediaPath, Set<String> albumNames);
}
