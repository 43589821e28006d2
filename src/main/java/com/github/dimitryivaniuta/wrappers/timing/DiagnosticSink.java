package com.github.dimitryivaniuta.wrappers.timing;

import org.slf4j.Logger;

/**
 * Where timing wrappers write their lines.
 */
@FunctionalInterface
public interface DiagnosticSink {

    void log(String message);

    static DiagnosticSink info(Logger logger) {
        return logger::info;
    }
}
