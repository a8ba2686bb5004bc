package io.github.hide212131.scripttest.runtime;

import java.util.Locale;

/**
 * ブリッジ実行 1 回の状態。
 */
public enum BridgePhase {
    IDLE, RESOLVING, EXTRACTING, RUNNING, PARSING, REPORTING, CLEANING_UP, DONE, FAULTED;

    public String label() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
