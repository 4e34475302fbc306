package com.p14n.upsbridge.telemetry;

import java.util.function.Supplier;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

/**
 * Utility class for running work inside trace spans.
 */
public class OpenTelemetryFunctions {

        private OpenTelemetryFunctions() {
        }

        /**
         * Executes an action within a new trace span tagged with a device id.
         *
         * @param <T>      Return type of the action
         * @param tracer   Tracer to create spans
         * @param spanName Name of the span to create
         * @param deviceId Device attribute for the span, may be null
         * @param action   Action to execute within the span
         * @return Result of the action execution
         * @throws RuntimeException if the action throws an exception
         */
        public static <T> T processWithTelemetry(Tracer tracer, String spanName, String deviceId,
                        Supplier<T> action) {
                SpanBuilder sb = tracer.spanBuilder(spanName);
                if (deviceId != null) {
                        sb.setAttribute("device.id", deviceId);
                }
                Span span = sb.startSpan();
                try (Scope scope = span.makeCurrent()) {
                        return action.get();
                } catch (RuntimeException e) {
                        span.recordException(e);
                        span.setStatus(StatusCode.ERROR);
                        throw e;
                } finally {
                        span.end();
                }
        }
}
