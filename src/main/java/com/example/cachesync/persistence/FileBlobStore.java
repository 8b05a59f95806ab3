package com.example.cachesync.persistence;

import java.io.IOException;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * One file per key under a directory. File names are the URL-encoded key plus
 * {@value #SUFFIX}; writes go through a temp file and an atomic rename.
 */
public class FileBlobStore implements BlobStore {

    static final String SUFFIX = ".blob";
    private static final String TEMP_PREFIX = "write-";
    private static final String TEMP_SUFFIX = ".tmp";

    private final Path directory;

    public FileBlobStore(Path directory) {
        this.directory = directory;
    }

    @Override
    public Set<String> keys() throws IOException {
        Set<String> keys = new TreeSet<>();
        if (!Files.isDirectory(directory)) {
            return keys;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*" + SUFFIX)) {
            for (Path file : stream) {
                String name = file.getFileName().toString();
                keys.add(URLDecoder.decode(name.substring(0, name.length() - SUFFIX.length()), StandardCharsets.UTF_8));
            }
        }
        return keys;
    }

    @Override
    public Optional<byte[]> read(String key) throws IOException {
        try {
            return Optional.of(Files.readAllBytes(fileFor(key)));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        }
    }

    @Override
    public void write(String key, byte[] blob) throws IOException {
        Files.createDirectories(directory);
        Path target = fileFor(key);
        // one temp file per write, concurrent writers of the same key must not share it
        Path temp = Files.createTempFile(directory, TEMP_PREFIX, TEMP_SUFFIX);
        try {
            Files.write(temp, blob);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    @Override
    public void delete(String key) throws IOException {
        Files.deleteIfExists(fileFor(key));
    }

    public Path getDirectory() {
        return directory;
    }

    private Path fileFor(String key) {
        return directory.resolve(URLEncoder.encode(key, StandardCharsets.UTF_8) + SUFFIX);
    }
}
