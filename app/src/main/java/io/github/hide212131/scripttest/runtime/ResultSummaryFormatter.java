package io.github.hide212131.scripttest.runtime;

import io.github.hide212131.scripttest.runtime.result.ScriptTestResult;
import java.util.StringJoiner;

final class ResultSummaryFormatter {

    static final String RESULTS_DIVIDER = "\n----------\n";
    static final String SUCCESS = "SUCCESS";
    static final String FAILED = "FAILED";

    private ResultSummaryFormatter() {
        throw new AssertionError("インスタンス化できません");
    }

    static String summary(String description, ScriptTestResult result) {
        StringJoiner joiner = new StringJoiner(System.lineSeparator());
        joiner.add(description + ": " + (result.success() ? SUCCESS : FAILED));
        joiner.add(result.rawMessage());
        joiner.add(RESULTS_DIVIDER);
        return joiner.toString();
    }

    static String failureMessage(String description, ScriptTestResult result, boolean includeOutput) {
        String message = description + ": " + FAILED;
        if (includeOutput) {
            message += "\n" + result.rawMessage() + RESULTS_DIVIDER;
        }
        return message;
    }
}
