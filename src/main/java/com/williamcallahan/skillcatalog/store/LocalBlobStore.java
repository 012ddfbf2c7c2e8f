package com.williamcallahan.skillcatalog.store;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Filesystem-backed blob store rooted at {@code app.storage.blob-root}.
 *
 * <p>Each key maps to a file under the root. Writes go through a temporary sibling file and an
 * atomic move so readers never observe a half-written blob.</p>
 */
@Component
public class LocalBlobStore implements BlobStore {
    private final Path root;

    public LocalBlobStore(@Value("${app.storage.blob-root}") String blobRoot) throws IOException {
        this.root = Paths.get(blobRoot).toAbsolutePath().normalize();
        Files.createDirectories(this.root);
    }

    @Override
    public Optional<String> getText(String key) {
        Path path = resolve(key);
        try {
            return Optional.of(Files.readString(path, StandardCharsets.UTF_8));
        } catch (NoSuchFileException missing) {
            return Optional.empty();
        } catch (IOException e) {
            throw new BlobStoreException("Failed to read blob " + key, e);
        }
    }

    @Override
    public void putText(String key, String content) {
        Path path = resolve(key);
        try {
            Files.createDirectories(path.getParent());
            Path temp = path.resolveSibling(path.getFileName() + ".tmp");
            Files.writeString(temp, content, StandardCharsets.UTF_8);
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new BlobStoreException("Failed to write blob " + key, e);
        }
    }

    @Override
    public boolean delete(String key) {
        try {
            return Files.deleteIfExists(resolve(key));
        } catch (IOException e) {
            throw new BlobStoreException("Failed to delete blob " + key, e);
        }
    }

    @Override
    public boolean exists(String key) {
        return Files.isRegularFile(resolve(key));
    }

    @Override
    public List<String> list(String prefix) {
        Path base = resolve(prefix);
        if (!Files.isDirectory(base)) {
            return List.of();
        }
        try (Stream<Path> files = Files.walk(base)) {
            return files.filter(Files::isRegularFile)
                    .filter(path -> !path.getFileName().toString().endsWith(".tmp"))
                    .map(path -> root.relativize(path).toString().replace('\\', '/'))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException | UncheckedIOException e) {
            throw new BlobStoreException("Failed to list blobs under " + prefix, e);
        }
    }

    private Path resolve(String key) {
        if (key == null || key.isBlank() || key.startsWith("/") || key.contains("\\")) {
            throw new IllegalArgumentException("Invalid blob key: " + key);
        }
        Path resolved = root.resolve(key).normalize();
        if (!resolved.startsWith(root) || resolved.equals(root)) {
            throw new IllegalArgumentException("Blob key escapes the store root: " + key);
        }
        return resolved;
    }
}
