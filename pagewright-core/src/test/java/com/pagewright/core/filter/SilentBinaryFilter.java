package com.pagewright.core.filter;

import com.pagewright.core.model.ContentKind;

/**
 * Declares binary output but never writes its output file.
 */
public class SilentBinaryFilter implements Filter {

    @Override
    public String getId() {
        return "silent_binary";
    }

    @Override
    public ContentKind getOutputKind() {
        return ContentKind.BINARY;
    }

    @Override
    public String run(FilterSource source, FilterContext context) {
        return null;
    }
}
