package com.eyelevel.mediamigrator.collaborator.source;

import org.apache.commons.codec.digest.DigestUtils;
import org.apache.commons.io.FilenameUtils;

/**
 * An archive as listed by an {@link ArchiveSource}.
 *
 * @param id   stable identifier within the source (relative path or object key)
 * @param name file name for display
 * @param size size in bytes as reported by the source, {@code 0} when unknown
 */
public record RemoteArchive(String id, String name, long size) {

    /**
     * File name used for the local copy. The id hash keeps equally named archives from different folders apart.
     */
    public String localFileName() {
        return DigestUtils.sha256Hex(id).substring(0, 8) + "-" + FilenameUtils.getName(name);
    }
}
