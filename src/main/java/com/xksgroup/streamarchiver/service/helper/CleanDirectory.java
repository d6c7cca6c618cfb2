package com.xksgroup.streamarchiver.service.helper;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;


@Service
@Slf4j
public class CleanDirectory {

    /**
     * Deletes the files directly inside {@code stagingDirectory} whose names start with
     * {@code prefix}, then removes the directory itself if nothing else is left in it.
     *
     * @return the number of files deleted
     */
    public int cleanStagingFiles(Path stagingDirectory, String prefix) {
        if (stagingDirectory == null || !Files.isDirectory(stagingDirectory)) {
            return 0;
        }
        List<Path> candidates;
        try (Stream<Path> files = Files.list(stagingDirectory)) {
            candidates = files
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().startsWith(prefix))
                    .collect(Collectors.toList());
        } catch (IOException e) {
            log.warn("Error listing staging directory {}: {}", stagingDirectory, e.getMessage());
            return 0;
        }

        int deleted = 0;
        for (Path path : candidates) {
            if (deleteFile(path)) {
                deleted++;
            }
        }

        try {
            Files.deleteIfExists(stagingDirectory);
            log.info("Staging directory {} removed", stagingDirectory);
        } catch (DirectoryNotEmptyException e) {
            log.debug("Staging directory {} still holds unrelated files; keeping it", stagingDirectory);
        } catch (IOException e) {
            log.warn("Error deleting {}: {}", stagingDirectory, e.getMessage());
        }
        return deleted;
    }

    private boolean deleteFile(Path path) {
        try {
            return Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Error deleting {}: {}", path, e.getMessage());
            return false;
        }
    }
}
