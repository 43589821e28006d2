package com.github.dimitryivaniuta.wrappers.timing;

import lombok.Builder;

/**
 * @param memory also report the heap-used delta in bytes
 * @param sink   diagnostic sink; the wrapper's SLF4J logger at INFO when not set
 */
@Builder
public record MeasureOptions(boolean memory, DiagnosticSink sink) {
}
