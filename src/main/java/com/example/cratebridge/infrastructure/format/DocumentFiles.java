package com.example.cratebridge.infrastructure.format;

import com.example.cratebridge.common.exception.LibraryException;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes documents through a sibling temporary file and moves it over the target once complete.
 */
public final class DocumentFiles {

    private static final Logger log = LoggerFactory.getLogger(DocumentFiles.class);

    @FunctionalInterface
    public interface DocumentWriter {
        void writeTo(OutputStream out) throws IOException;
    }

    private DocumentFiles() {
    }

    public static void requireReadable(Path source, String what) {
        if (source == null || !Files.isRegularFile(source)) {
            throw LibraryException.inputMissing(what, source);
        }
        if (!Files.isReadable(source)) {
            throw new LibraryException(LibraryException.INPUT_MISSING, what + " is not readable: " + source);
        }
    }

    public static void writeAtomically(Path target, DocumentWriter writer) throws IOException {
        Path absolute = target.toAbsolutePath().normalize();
        Path directory = absolute.getParent();
        if (directory == null || !Files.isDirectory(directory) || !Files.isWritable(directory)) {
            throw new LibraryException(LibraryException.TARGET_UNWRITABLE,
                    "Target directory is not writable: " + directory, "Choose another output location");
        }
        Path temp = Files.createTempFile(directory, "." + absolute.getFileName(), ".tmp");
        boolean moved = false;
        try {
            try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(temp))) {
                writer.writeTo(out);
            }
            try {
                Files.move(temp, absolute, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, absolute, StandardCopyOption.REPLACE_EXISTING);
            }
            moved = true;
        } finally {
            if (!moved && !Files.deleteIfExists(temp)) {
                log.debug("Temp document already gone: {}", temp);
            }
        }
    }

    /**
     * File name without its last extension.
     */
    public static String stem(Path path) {
        String name = path.getFileName() == null ? path.toString() : path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
