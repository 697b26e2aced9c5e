package com.eyelevel.mediamigrator.support;

import com.eyelevel.mediamigrator.collaborator.upload.PhotoUploader;
import com.eyelevel.mediamigrator.exception.PermanentCollaboratorException;
import com.eyelevel.mediamigrator.exception.TransientCollaboratorException;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Uploader double that records every call. Failures are scripted per file name.
 */
public class RecordingPhotoUploader implements PhotoUploader {

    private final List<String> uploadedFileNames = new CopyOnWriteArrayList<>();
    private final Set<String> permanentFailures = ConcurrentHashMap.newKeySet();
    private final Set<String> transientFailures = ConcurrentHashMap.newKeySet();

    @Override
    public String upload(Path mediaPath, Set<String> albumNames) {
        String fileName = mediaPath.getFileName().toString();
        uploadedFileNames.add(fileName);
        if (permanentFailures.contains(fileName)) {
            throw new PermanentCollaboratorException("Rejected by the photo library: " + fileName);
        }
        if (transientFailures.contains(fileName)) {
            throw new TransientCollaboratorException("Photo library unavailable for " + fileName);
        }
        return "remote-" + fileName;
    }

    public void failPermanently(String fileName) {
        permanentFailures.add(fileName);
    }

    public void failTransiently(String fileName) {
        transientFailures.add(fileName);
    }

    public List<String> uploadedFileNames() {
        return List.copyOf(uploadedFileNames);
    }

    public long callsFor(String fileName) {
        return uploadedFileNames.stream().filter(fileName::equals).count();
    }

    public void reset() {
        uploadedFileNames.clear();
        permanentFailures.clear();
        transientFailures.clear();
    }
}
