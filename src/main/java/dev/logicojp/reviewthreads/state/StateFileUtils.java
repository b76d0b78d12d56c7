package dev.logicojp.reviewthreads.state;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Set;

/// File helpers for the review state store.
final class StateFileUtils {

    private static final Set<PosixFilePermission> OWNER_DIRECTORY_PERMISSIONS =
        PosixFilePermissions.fromString("rwx------");
    private static final Set<PosixFilePermission> OWNER_FILE_PERMISSIONS =
        PosixFilePermissions.fromString("rw-------");

    private StateFileUtils() {
    }

    static void ensureDirectory(Path directory) throws IOException {
        if (Files.exists(directory)) {
            return;
        }
        if (supportsPosix(directory)) {
            Files.createDirectories(directory,
                PosixFilePermissions.asFileAttribute(OWNER_DIRECTORY_PERMISSIONS));
            return;
        }
        Files.createDirectories(directory);
    }

    /// Writes to a sibling temp file first, then replaces the target.
    static void replaceContent(Path filePath, String content) throws IOException {
        Path temp = filePath.resolveSibling(filePath.getFileName() + ".tmp");
        Files.writeString(temp, content);
        if (supportsPosix(temp)) {
            Files.setPosixFilePermissions(temp, OWNER_FILE_PERMISSIONS);
        }
        Files.move(temp, filePath, StandardCopyOption.REPLACE_EXISTING);
    }

    private static boolean supportsPosix(Path path) {
        Path target = path;
        while (target != null && !Files.exists(target)) {
            target = target.getParent();
        }
        if (target == null) {
            target = Path.of("").toAbsolutePath();
        }
        return Files.getFileAttributeView(target, PosixFileAttributeView.class) != null;
    }
}
