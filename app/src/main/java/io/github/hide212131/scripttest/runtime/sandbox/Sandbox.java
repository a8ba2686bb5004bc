package io.github.hide212131.scripttest.runtime.sandbox;

import io.github.hide212131.scripttest.runtime.ResourceExtractionException;
import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 1 回のブリッジ実行だけが使う一時ディレクトリ。展開したファイルを記録し、{@link #close()} で削除する。
 */
public final class Sandbox implements AutoCloseable {

    private static final String PREFIX = "script-test-";
    private static final Logger LOGGER = Logger.getLogger(Sandbox.class.getName());

    private final Path basePath;
    private final boolean retain;
    private final List<Path> trackedFiles = new ArrayList<>();
    private boolean closed;

    private Sandbox(Path basePath, boolean retain) {
        this.basePath = basePath.toAbsolutePath().normalize();
        this.retain = retain;
    }

    public static Sandbox create(boolean retain) {
        try {
            return new Sandbox(Files.createTempDirectory(PREFIX), retain);
        } catch (IOException ex) {
            throw new ResourceExtractionException("サンドボックスの作成に失敗しました", ex);
        }
    }

    static Sandbox create(Path parent, boolean retain) {
        Objects.requireNonNull(parent, "parent");
        try {
            Files.createDirectories(parent);
            return new Sandbox(Files.createTempDirectory(parent, PREFIX), retain);
        } catch (IOException ex) {
            throw new ResourceExtractionException("サンドボックスの作成に失敗しました: " + parent, ex);
        }
    }

    public Path basePath() {
        return basePath;
    }

    public boolean retain() {
        return retain;
    }

    public List<Path> trackedFiles() {
        return List.copyOf(trackedFiles);
    }

    public void track(Path file) {
        Objects.requireNonNull(file, "file");
        if (closed) {
            throw new IllegalStateException("クローズ済みのサンドボックスです: " + basePath);
        }
        trackedFiles.add(file.toAbsolutePath().normalize());
    }

    /**
     * 記録したファイルとディレクトリを削除する。retain の場合は何も削除しない。
     * 削除に失敗しても例外は送出せず、警告ログを出力する。
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (retain) {
            LOGGER.info("サンドボックスを保持します: " + basePath);
            return;
        }
        for (Path file : trackedFiles) {
            try {
                Files.deleteIfExists(file);
            } catch (IOException ex) {
                LOGGER.log(Level.WARNING, "一時ファイルの削除に失敗しました: " + file, ex);
            }
        }
        try {
            deleteRecursively(basePath);
        } catch (IOException ex) {
            LOGGER.log(Level.WARNING, "サンドボックスの削除に失敗しました: " + basePath, ex);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (!Files.exists(root)) {
            return;
        }
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.deleteIfExists(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                if (exc != null) {
                    throw exc;
                }
                Files.deleteIfExists(dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }
}
