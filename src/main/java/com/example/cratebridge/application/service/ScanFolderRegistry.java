package com.example.cratebridge.application.service;

import com.example.cratebridge.common.config.AppScanProperties;
import com.example.cratebridge.common.exception.LibraryException;
import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import javax.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Folders the user registered for scanning. Registration order is also the search order when relocating
 * missing files.
 */
@Component
public class ScanFolderRegistry {

    private static final Logger log = LoggerFactory.getLogger(ScanFolderRegistry.class);

    private final AppScanProperties appScanProperties;
    private final List<Path> folders = new ArrayList<>();

    public ScanFolderRegistry(AppScanProperties appScanProperties) {
        this.appScanProperties = appScanProperties;
    }

    @PostConstruct
    public void registerConfiguredFolders() {
        for (String folder : appScanProperties.getFolders()) {
            try {
                addFolder(Paths.get(folder));
            } catch (LibraryException e) {
                log.warn("SCAN_FOLDER_IGNORED folder={} reason={}", folder, e.getMessage());
            }
        }
    }

    /**
     * @return {@code false} when the folder was already registered
     */
    public synchronized boolean addFolder(Path folder) {
        if (folder == null || !Files.isDirectory(folder)) {
            throw LibraryException.inputMissing("Scan folder", folder);
        }
        Path normalized = folder.toAbsolutePath().normalize();
        if (folders.contains(normalized)) {
            log.debug("SCAN_FOLDER_DUPLICATE folder={}", normalized);
            return false;
        }
        folders.add(normalized);
        log.info("SCAN_FOLDER_ADDED folder={} total={}", normalized, folders.size());
        return true;
    }

    public synchronized List<Path> getFolders() {
        return Collections.unmodifiableList(new ArrayList<>(folders));
    }

    /**
     * Finds a file with exactly this name. Folders are searched in registration order and files inside a folder
     * in sorted path order; the first match wins.
     */
    public Optional<Path> locate(String fileName) {
        if (fileName == null || fileName.isEmpty()) {
            return Optional.empty();
        }
        for (Path folder : getFolders()) {
            if (!Files.isDirectory(folder)) {
                continue;
            }
            NameMatcher matcher = new NameMatcher(fileName);
            try {
                Files.walkFileTree(folder, matcher);
            } catch (IOException e) {
                log.warn("LOCATE_FOLDER_FAILED folder={} fileName={} reason={}", folder, fileName, e.getMessage());
            }
            Optional<Path> first = matcher.first();
            if (first.isPresent()) {
                return first;
            }
        }
        return Optional.empty();
    }

    /**
     * Collects regular files with the given name. Entries that cannot be read are logged and skipped.
     */
    static class NameMatcher extends SimpleFileVisitor<Path> {

        private final String fileName;
        private final List<Path> matches = new ArrayList<>();

        NameMatcher(String fileName) {
            this.fileName = fileName;
        }

        @Override
        public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
            if (attrs.isRegularFile() && file.getFileName() != null
                    && fileName.equals(file.getFileName().toString())) {
                matches.add(file);
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFileFailed(Path file, IOException exc) {
            log.debug("LOCATE_ENTRY_SKIPPED path={} reason={}", file, exc.getMessage());
            return FileVisitResult.CONTINUE;
        }

        Optional<Path> first() {
            if (matches.isEmpty()) {
                return Optional.empty();
            }
            List<Path> sorted = new ArrayList<>(matches);
            Collections.sort(sorted);
            return Optional.of(sorted.get(0));
        }
    }
}
