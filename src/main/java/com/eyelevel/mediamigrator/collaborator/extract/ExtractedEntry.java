package com.eyelevel.mediamigrator.collaborator.extract;

import java.nio.file.Path;

/**
 * One file written by an {@link ArchiveExtractor}.
 *
 * @param relativePath path inside the archive, always with forward slashes
 * @param path         where the file now lives on disk
 * @param sha256       hex SHA-256 of the content
 * @param size         bytes written
 */
public record ExtractedEntry(String relativePath, Path path, String sha256, long size) {
}
