package com.pdfseal.crypto;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Keeps the keypair as {@code private.pem} and {@code public.pem} inside one directory.
 * <p>
 * Files are written to a temporary sibling first and moved into place. On POSIX file systems
 * the private key file is readable by its owner only.
 */
public final class PemKeyFileStore implements KeyPersistence {

    private static final Logger log = LoggerFactory.getLogger(PemKeyFileStore.class);

    public static final String PRIVATE_KEY_FILE = "private.pem";
    public static final String PUBLIC_KEY_FILE = "public.pem";

    private static final Set<PosixFilePermission> OWNER_ONLY = PosixFilePermissions.fromString("rw-------");

    private final Path directory;

    public PemKeyFileStore(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory").toAbsolutePath();
    }

    public Path getDirectory() {
        return directory;
    }

    @Override
    public Optional<StoredKeyPair> load() throws IOException {
        Path privateFile = directory.resolve(PRIVATE_KEY_FILE);
        Path publicFile = directory.resolve(PUBLIC_KEY_FILE);
        if (!Files.isRegularFile(privateFile) || !Files.isRegularFile(publicFile)) {
            return Optional.empty();
        }
        return Optional.of(new StoredKeyPair(
                Files.readString(privateFile, StandardCharsets.US_ASCII),
                Files.readString(publicFile, StandardCharsets.US_ASCII)));
    }

    @Override
    public void store(String privateKeyPem, String publicKeyPem) throws IOException {
        Files.createDirectories(directory);
        write(directory.resolve(PRIVATE_KEY_FILE), privateKeyPem, true);
        write(directory.resolve(PUBLIC_KEY_FILE), publicKeyPem, false);
        log.info("[keystore] keypair saved to {}", directory);
    }

    private static void write(Path target, String content, boolean secret) throws IOException {
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        Files.deleteIfExists(tmp);
        if (secret && supportsPosix()) {
            Files.createFile(tmp, PosixFilePermissions.asFileAttribute(OWNER_ONLY));
        }
        Files.writeString(tmp, content, StandardCharsets.US_ASCII);
        try {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static boolean supportsPosix() {
        return FileSystems.getDefault().supportedFileAttributeViews().contains("posix");
    }
}
