package io.github.hide212131.scripttest.runtime.resource;

import java.io.IOException;
import java.io.InputStream;

/**
 * 名前付きリソースを取り出す元（クラスパス上のクラス、ディレクトリなど）。
 */
public interface ResourceOrigin {

    /**
     * リソースを開く。見つからない場合は {@code null} を返す。
     */
    InputStream open(String locator) throws IOException;

    /**
     * 記述子に指定された origin 参照を、この origin を基準に解決する。
     *
     * @throws io.github.hide212131.scripttest.runtime.ResourceExtractionException 参照を解決できない場合
     */
    ResourceOrigin resolveReference(String reference);

    String describe();
}
