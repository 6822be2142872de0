package com.arenabox.transport;

import com.arenabox.core.model.OrchestratorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Comparator;
import java.util.Set;
import java.util.stream.Stream;

/**
 * TLS key material written to a private temporary directory for the lifetime of one orchestrator call.
 *
 * <p>The docker-java TLS configuration only reads certificates from a directory containing
 * {@code ca.pem}, {@code cert.pem} and {@code key.pem}. Each call gets its own directory, readable
 * by the owner only, and {@link #close()} removes it. Use in try-with-resources.
 */
public final class CredentialMaterial implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CredentialMaterial.class);

    static final String CA_FILE = "ca.pem";
    static final String CERT_FILE = "cert.pem";
    static final String KEY_FILE = "key.pem";

    private static final Set<PosixFilePermission> DIR_PERMISSIONS = PosixFilePermissions.fromString("rwx------");
    private static final Set<PosixFilePermission> FILE_PERMISSIONS = PosixFilePermissions.fromString("rw-------");

    private final Path directory;

    private CredentialMaterial(Path directory) {
        this.directory = directory;
    }

    /**
     * Writes the configuration's CA, client certificate and client key to a fresh directory.
     *
     * @throws IOException if the directory or any file cannot be written; nothing is left behind
     */
    public static CredentialMaterial materialize(OrchestratorConfig config) throws IOException {
        if (!config.hasCredentialMaterial()) {
            throw new IOException("TLS is enabled but CA, client certificate or client key is missing");
        }
        boolean posix = FileSystems.getDefault().supportedFileAttributeViews().contains("posix");
        Path dir = posix
                ? Files.createTempDirectory("arenabox-tls-", PosixFilePermissions.asFileAttribute(DIR_PERMISSIONS))
                : Files.createTempDirectory("arenabox-tls-");
        var material = new CredentialMaterial(dir);
        try {
            material.write(CA_FILE, config.caCert(), posix);
            material.write(CERT_FILE, config.clientCert(), posix);
            material.write(KEY_FILE, config.clientKey(), posix);
        } catch (IOException | RuntimeException e) {
            material.close();
            throw e;
        }
        return material;
    }

    public Path directory() {
        return directory;
    }

    private void write(String fileName, String pem, boolean posix) throws IOException {
        Path file = directory.resolve(fileName);
        if (posix) {
            Files.createFile(file, PosixFilePermissions.asFileAttribute(FILE_PERMISSIONS));
        }
        Files.writeString(file, pem, StandardCharsets.US_ASCII);
    }

    @Override
    public void close() {
        if (!Files.exists(directory)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(directory)) {
            walk.sorted(Comparator.reverseOrder()).forEach(CredentialMaterial::delete);
        } catch (IOException e) {
            log.error("Could not list TLS material directory {} for removal", directory, e);
        }
    }

    private static void delete(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.error("Could not remove TLS material {}", path, e);
        }
    }
}
