package io.github.hide212131.scripttest.runtime.result;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * インタプリタの出力から {@code "X tests, Y assertions, Z failures, Q errors"} 形式のサマリを読み取る。
 * 読み取れない出力は成功扱いにせず、エラー 1 件の結果にする。
 */
public final class ScriptTestResultParser {

    public static final String UNPARSEABLE_PREFIX = "*** Unable to parse output from script test ***\n";

    private static final Pattern SUMMARY = Pattern.compile(
            "(\\d+)\\s*tests[^\\d]*(\\d+)\\s*assertions[^\\d]*(\\d+)\\s*failures[^\\d]*(\\d+)\\s*errors",
            Pattern.CASE_INSENSITIVE | Pattern.MULTILINE);

    private ScriptTestResultParser() {
        throw new AssertionError("インスタンス化できません");
    }

    public static ScriptTestResult parse(String rawOutput) {
        String output = rawOutput == null ? "" : rawOutput;
        Matcher matcher = SUMMARY.matcher(output);
        if (!matcher.find()) {
            return failSafe(output);
        }
        try {
            return new ScriptTestResult(Integer.parseInt(matcher.group(1)), Integer.parseInt(matcher.group(2)),
                    Integer.parseInt(matcher.group(3)), Integer.parseInt(matcher.group(4)), output);
        } catch (IllegalArgumentException ex) {
            // 0 tests や int に収まらない件数
            return failSafe(output);
        }
    }

    static ScriptTestResult failSafe(String output) {
        return new ScriptTestResult(1, 0, 0, 1, UNPARSEABLE_PREFIX + output);
    }
}
