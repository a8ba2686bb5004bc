package io.github.hide212131.scripttest.runtime.resource;

import io.github.hide212131.scripttest.runtime.ResourceExtractionException;
import java.io.InputStream;
import java.util.Objects;

/**
 * クラスのクラスローダ経由でリソースを読む。locator は {@link Class#getResourceAsStream(String)} と同じく、
 * 先頭が {@code /} でなければクラスのパッケージからの相対パスとして扱う。
 * 区切り文字の {@code \} は {@code /} として扱う。
 */
public final class ClassResourceOrigin implements ResourceOrigin {

    private final Class<?> anchor;

    public ClassResourceOrigin(Class<?> anchor) {
        this.anchor = Objects.requireNonNull(anchor, "anchor");
    }

    @Override
    public InputStream open(String locator) {
        Objects.requireNonNull(locator, "locator");
        return anchor.getResourceAsStream(locator.replace('\\', '/'));
    }

    @Override
    public ResourceOrigin resolveReference(String reference) {
        if (reference == null || reference.isBlank()) {
            return this;
        }
        String className = reference.trim();
        try {
            return new ClassResourceOrigin(Class.forName(className, false, classLoader()));
        } catch (ClassNotFoundException | LinkageError ex) {
            throw new ResourceExtractionException("origin に指定されたクラスを読み込めません: " + className, ex);
        }
    }

    @Override
    public String describe() {
        return "class:" + anchor.getName();
    }

    public Class<?> anchor() {
        return anchor;
    }

    private ClassLoader classLoader() {
        ClassLoader loader = anchor.getClassLoader();
        return loader != null ? loader : ClassLoader.getSystemClassLoader();
    }
}
