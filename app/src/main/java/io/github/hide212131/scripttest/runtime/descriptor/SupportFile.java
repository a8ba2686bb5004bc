package io.github.hide212131.scripttest.runtime.descriptor;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Repeatable;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * スクリプトと一緒にサンドボックスへ展開するファイル。
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
@Repeatable(SupportFiles.class)
public @interface SupportFile {

    String source();

    /** サンドボックス基準の相対パス。サンドボックスの外は指定できない。 */
    String target();

    String origin() default "";
}
