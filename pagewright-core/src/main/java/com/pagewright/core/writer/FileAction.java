package com.pagewright.core.writer;

import java.util.Locale;

/**
 * What happened to an output file during compilation.
 */
public enum FileAction {
    /** The file did not exist and has been created */
    CREATE,
    /** The file existed and its content changed */
    UPDATE,
    /** The representation was recompiled but the output turned out identical */
    IDENTICAL,
    /** The representation was not recompiled */
    SKIP;

    /**
     * Classifies a write.
     *
     * @param created whether the file did not exist before
     * @param modified whether the file content changed
     * @return matching action
     */
    public static FileAction of(boolean created, boolean modified) {
        if (created) {
            return CREATE;
        }
        return modified ? UPDATE : IDENTICAL;
    }

    /**
     * Returns the lowercase label used in logs (e.g. "create").
     *
     * @return label
     */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
