package io.github.hide212131.scripttest.runtime.resource;

import io.github.hide212131.scripttest.runtime.ResourceExtractionException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * ディレクトリ配下のファイルをリソースとして読む。CLI から manifest を実行する場合に使う。
 */
public final class DirectoryResourceOrigin implements ResourceOrigin {

    private final Path root;

    public DirectoryResourceOrigin(Path root) {
        Objects.requireNonNull(root, "root");
        this.root = root.toAbsolutePath().normalize();
    }

    @Override
    public InputStream open(String locator) throws IOException {
        Path resolved = resolve(locator);
        if (resolved == null || !Files.isRegularFile(resolved)) {
            return null;
        }
        return Files.newInputStream(resolved);
    }

    @Override
    public ResourceOrigin resolveReference(String reference) {
        if (reference == null || reference.isBlank()) {
            return this;
        }
        Path resolved = resolve(reference);
        if (resolved == null || !Files.isDirectory(resolved)) {
            throw new ResourceExtractionException("origin に指定されたディレクトリが存在しません: " + reference);
        }
        return new DirectoryResourceOrigin(resolved);
    }

    @Override
    public String describe() {
        return "dir:" + root;
    }

    public Path root() {
        return root;
    }

    private Path resolve(String locator) {
        if (locator == null || locator.isBlank()) {
            throw new IllegalArgumentException("locator は空にできません");
        }
        String normalized = locator.trim().replace('\\', '/');
        while (normalized.startsWith("/")) {
            normalized = normalized.substring(1);
        }
        Path resolved;
        try {
            resolved = root.resolve(normalized).normalize();
        } catch (InvalidPathException ex) {
            throw new ResourceExtractionException("パスとして解釈できません: " + locator, ex);
        }
        if (!resolved.startsWith(root)) {
            return null;
        }
        return resolved;
    }
}
