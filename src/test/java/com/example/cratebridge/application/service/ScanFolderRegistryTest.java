package com.example.cratebridge.application.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.cratebridge.common.config.AppScanProperties;
import com.example.cratebridge.common.exception.LibraryException;
import java.io.File;
import java.nio.file.AccessDeniedException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Arrays;
import java.util.Optional;
import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ScanFolderRegistryTest {

    @TempDir
    Path tempDir;

    @Test
    void addFolderShouldIgnoreDuplicates() throws Exception {
        ScanFolderRegistry registry = new ScanFolderRegistry(new AppScanProperties());
        Path folder = Files.createDirectories(tempDir.resolve("music"));

        assertTrue(registry.addFolder(folder));
        assertFalse(registry.addFolder(folder.resolve("../music")));
        assertEquals(1, registry.getFolders().size());
    }

    @Test
    void missingFolderShouldBeRejected() {
        ScanFolderRegistry registry = new ScanFolderRegistry(new AppScanProperties());

        LibraryException error = assertThrows(LibraryException.class,
                () -> registry.addFolder(tempDir.resolve("absent")));

        assertEquals(LibraryException.INPUT_MISSING, error.getCode());
    }

    @Test
    void configuredFoldersShouldRegisterAndSkipMissingOnes() throws Exception {
        Path folder = Files.createDirectories(tempDir.resolve("configured"));
        AppScanProperties properties = new AppScanProperties();
        properties.setFolders(Arrays.asList(folder.toString(), tempDir.resolve("absent").toString()));
        ScanFolderRegistry registry = new ScanFolderRegistry(properties);

        registry.registerConfiguredFolders();

        assertEquals(1, registry.getFolders().size());
    }

    @Test
    void locateShouldHonorRegistrationOrder() throws Exception {
        Path first = Files.createDirectories(tempDir.resolve("first/nested"));
        Path second = Files.createDirectories(tempDir.resolve("second"));
        Files.write(second.resolve("song.mp3"), new byte[16]);
        Path expected = Files.write(first.resolve("song.mp3"), new byte[16]);
        ScanFolderRegistry registry = new ScanFolderRegistry(new AppScanProperties());
        registry.addFolder(tempDir.resolve("first"));
        registry.addFolder(second);

        Optional<Path> located = registry.locate("song.mp3");

        assertTrue(located.isPresent());
        assertEquals(expected.toAbsolutePath().normalize(), located.get().toAbsolutePath().normalize());
        assertFalse(registry.locate("other.mp3").isPresent());
        assertFalse(registry.locate("").isPresent());
    }

    @Test
    void unreadableEntryShouldNotEndTheFolderSearch() throws Exception {
        Path folder = Files.createDirectories(tempDir.resolve("music"));
        Path expected = Files.write(folder.resolve("song.mp3"), new byte[16]);
        ScanFolderRegistry.NameMatcher matcher = new ScanFolderRegistry.NameMatcher("song.mp3");

        FileVisitResult afterFailure = matcher.visitFileFailed(folder.resolve("locked"),
                new AccessDeniedException(folder.resolve("locked").toString()));
        matcher.visitFile(expected, Files.readAttributes(expected, BasicFileAttributes.class));

        assertEquals(FileVisitResult.CONTINUE, afterFailure);
        assertEquals(Optional.of(expected), matcher.first());
    }

    @Test
    void locateShouldSearchPastUnreadableSubfolder() throws Exception {
        Path locked = Files.createDirectories(tempDir.resolve("music/a-locked"));
        Files.write(locked.resolve("song.mp3"), new byte[16]);
        Path open = Files.createDirectories(tempDir.resolve("music/b-open"));
        Path expected = Files.write(open.resolve("song.mp3"), new byte[16]);
        File lockedDir = locked.toFile();
        Assumptions.assumeTrue(lockedDir.setReadable(false));
        try {
            Assumptions.assumeFalse(Files.isReadable(locked));
            ScanFolderRegistry registry = new ScanFolderRegistry(new AppScanProperties());
            registry.addFolder(tempDir.resolve("music"));

            Optional<Path> located = registry.locate("song.mp3");

            assertTrue(located.isPresent());
            assertEquals(expected.toAbsolutePath().normalize(), located.get().toAbsolutePath().normalize());
        } finally {
            lockedDir.setReadable(true);
        }
    }
}
