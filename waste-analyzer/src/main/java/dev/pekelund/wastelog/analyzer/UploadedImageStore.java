package dev.pekelund.wastelog.analyzer;

import dev.pekelund.wastelog.storage.WasteStoreException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Keeps the raw bytes of uploaded waste photos on local disk.
 */
public class UploadedImageStore {

    public static final String PUBLIC_PREFIX = "/uploads/";

    private static final Logger LOGGER = LoggerFactory.getLogger(UploadedImageStore.class);
    private static final DateTimeFormatter FILE_PREFIX =
        DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss-SSS", Locale.US).withZone(ZoneOffset.UTC);
    private static final int MAX_FILENAME_LENGTH = 60;
    private static final String DEFAULT_FILENAME = "waste-photo";

    private final Path directory;
    private final Clock clock;

    public UploadedImageStore(Path directory, Clock clock) {
        this.directory = directory;
        this.clock = clock != null ? clock : Clock.systemUTC();
    }

    /**
     * Writes the image under a unique name.
     *
     * @return the public reference of the stored image, {@code /uploads/<name>}
     */
    public String save(byte[] content, String originalFilename) {
        String storedName = buildFileName(originalFilename);
        Path target = directory.resolve(storedName);
        try {
            Files.createDirectories(directory);
            Files.write(target, content);
        } catch (IOException ex) {
            String displayName = StringUtils.hasText(originalFilename) ? originalFilename : storedName;
            throw new WasteStoreException("Failed to store upload '%s'".formatted(displayName), ex);
        }
        LOGGER.info("Stored upload {} ({} bytes)", target, content.length);
        return PUBLIC_PREFIX + storedName;
    }

    /**
     * Removes an upload written by {@link #save}. Failures are logged and otherwise ignored.
     */
    public void delete(String publicPath) {
        if (!StringUtils.hasText(publicPath) || !publicPath.startsWith(PUBLIC_PREFIX)) {
            return;
        }
        Path root = directory.toAbsolutePath().normalize();
        Path target = root.resolve(publicPath.substring(PUBLIC_PREFIX.length())).normalize();
        if (!root.equals(target.getParent())) {
            LOGGER.warn("Refusing to delete {} outside the upload directory", publicPath);
            return;
        }
        try {
            if (Files.deleteIfExists(target)) {
                LOGGER.info("Removed upload {}", target);
            }
        } catch (IOException ex) {
            LOGGER.warn("Unable to remove upload {}", target, ex);
        }
    }

    public Path getDirectory() {
        return directory;
    }

    /**
     * @return lowercase hex SHA-256 digest of the content
     */
    public static String calculateSha256Hash(byte[] content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return bytesToHex(digest.digest(content));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 algorithm not available", ex);
        }
    }

    private static String bytesToHex(byte[] bytes) {
        StringBuilder hexString = new StringBuilder(2 * bytes.length);
        for (byte b : bytes) {
            String hex = Integer.toHexString(0xff & b);
            if (hex.length() == 1) {
                hexString.append('0');
            }
            hexString.append(hex);
        }
        return hexString.toString();
    }

    String buildFileName(String originalFilename) {
        String filename = StringUtils.hasText(originalFilename) ? originalFilename : DEFAULT_FILENAME;
        filename = extractFilename(filename);
        filename = shortenFilename(filename.replaceAll("[^A-Za-z0-9._-]", "_"), MAX_FILENAME_LENGTH);
        if (!StringUtils.hasText(filename) || filename.startsWith(".")) {
            filename = DEFAULT_FILENAME + filename;
        }
        String prefix = FILE_PREFIX.format(clock.instant());
        String suffix = UUID.randomUUID().toString().substring(0, 8);
        return prefix + "_" + suffix + "_" + filename;
    }

    private String extractFilename(String filename) {
        try {
            Path fileName = Paths.get(filename).getFileName();
            if (fileName != null) {
                return fileName.toString();
            }
        } catch (InvalidPathException ex) {
            LOGGER.debug("Upload name '{}' is not a valid path; parsing it manually", filename);
        }
        int separatorIndex = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
        if (separatorIndex >= 0 && separatorIndex < filename.length() - 1) {
            return filename.substring(separatorIndex + 1);
        }
        return filename;
    }

    private String shortenFilename(String filename, int maxLength) {
        if (filename.length() <= maxLength) {
            return filename;
        }
        int extensionIndex = filename.lastIndexOf('.');
        if (extensionIndex > 0 && extensionIndex < filename.length() - 1) {
            String extension = filename.substring(extensionIndex);
            int allowedBaseLength = Math.max(1, maxLength - extension.length());
            return filename.substring(0, Math.min(extensionIndex, allowedBaseLength)) + extension;
        }
        return filename.substring(0, maxLength);
    }
}
