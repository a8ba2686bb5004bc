package io.github.hide212131.scripttest.runtime.sandbox;

import io.github.hide212131.scripttest.runtime.ResourceExtractionException;
import io.github.hide212131.scripttest.runtime.resource.ResourceOrigin;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * origin のリソースをサンドボックス配下のファイルへ書き出す。
 */
public final class ResourceExtractor {

    private static final int BUFFER_SIZE = 8192;
    private static final Logger LOGGER = Logger.getLogger(ResourceExtractor.class.getName());

    private final Path sandboxRoot;

    public ResourceExtractor(Path sandboxRoot) {
        Objects.requireNonNull(sandboxRoot, "sandboxRoot");
        this.sandboxRoot = sandboxRoot.toAbsolutePath().normalize();
    }

    /**
     * リソースを {@code destination} へ書き出し、正規化した書き出し先を返す。
     *
     * @throws ResourceExtractionException 引数が不正、サンドボックス外、既存ファイル、リソースなし、I/O 失敗の場合
     */
    public Path extract(ResourceOrigin origin, String resourceLocator, Path destination) {
        if (origin == null) {
            throw new ResourceExtractionException("リソースの origin が指定されていません: " + resourceLocator);
        }
        if (resourceLocator == null || resourceLocator.isBlank()) {
            throw new ResourceExtractionException("リソースパスは空にできません");
        }
        if (destination == null || destination.toString().isBlank()) {
            throw new ResourceExtractionException("書き出し先は空にできません: " + resourceLocator);
        }
        Path target = destination.toAbsolutePath().normalize();
        if (!target.startsWith(sandboxRoot)) {
            throw new ResourceExtractionException(
                    "書き出し先はサンドボックス配下である必要があります（.. による親ディレクトリ参照は不可）: " + destination);
        }
        try {
            Path parent = target.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (InputStream input = origin.open(resourceLocator)) {
                if (input == null) {
                    throw new ResourceExtractionException(
                            "リソースが見つかりません: " + resourceLocator + " (" + origin.describe() + ")");
                }
                try (OutputStream output = Files.newOutputStream(target, StandardOpenOption.CREATE_NEW,
                        StandardOpenOption.WRITE)) {
                    copy(input, output);
                    output.flush();
                }
            }
            return target;
        } catch (FileAlreadyExistsException ex) {
            log(origin, resourceLocator, target, ex);
            throw new ResourceExtractionException("書き出し先のファイルが既に存在します: " + target, ex);
        } catch (IOException ex) {
            log(origin, resourceLocator, target, ex);
            throw new ResourceExtractionException("リソースの書き出しに失敗しました: " + resourceLocator + " -> " + target, ex);
        }
    }

    public Path sandboxRoot() {
        return sandboxRoot;
    }

    private static void copy(InputStream input, OutputStream output) throws IOException {
        byte[] buffer = new byte[BUFFER_SIZE];
        int read;
        while ((read = input.read(buffer)) != -1) {
            output.write(buffer, 0, read);
        }
    }

    private static void log(ResourceOrigin origin, String resourceLocator, Path target, IOException ex) {
        if (LOGGER.isLoggable(Level.WARNING)) {
            LOGGER.log(Level.WARNING, "リソース [" + resourceLocator + "] を " + origin.describe() + " から ["
                    + target + "] へ書き出せません", ex);
        }
    }
}
