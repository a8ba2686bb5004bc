package io.github.hide212131.scripttest.runtime.descriptor;

import java.util.Optional;

/**
 * テスト実行前にサンドボックスへ展開する補助ファイル。
 *
 * @param sourceLocator 補助ファイルのリソースパス
 * @param targetRelativePath サンドボックス基準の展開先。区切り文字は {@code /} に正規化する
 * @param originReference リソースを取り出す origin。{@code null} は呼び出し元と同じ origin
 */
public record SupportFileDescriptor(String sourceLocator, String targetRelativePath, String originReference) {

    public SupportFileDescriptor {
        if (sourceLocator == null || sourceLocator.isBlank()) {
            throw new IllegalArgumentException("sourceLocator は空にできません");
        }
        if (targetRelativePath == null || targetRelativePath.isBlank()) {
            throw new IllegalArgumentException("targetRelativePath は空にできません");
        }
        targetRelativePath = targetRelativePath.replace('\\', '/');
        if (originReference != null && originReference.isBlank()) {
            originReference = null;
        }
    }

    public SupportFileDescriptor(String sourceLocator, String targetRelativePath) {
        this(sourceLocator, targetRelativePath, null);
    }

    public Optional<String> origin() {
        return Optional.ofNullable(originReference);
    }
}
