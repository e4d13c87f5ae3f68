/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.runner.telemetry;

import com.repoq.trs.infra.config.EnvironmentSettings;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.exporter.logging.LoggingSpanExporter;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import io.opentelemetry.sdk.trace.samplers.Sampler;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * OpenTelemetry bootstrap for the verification runner.
 *
 * <p>Tracing is off unless enabled; verification runs are short and the spans are mostly
 * useful when profiling a slow critical-pair search. When enabled, spans are batched to the
 * logging exporter.
 *
 * <p>Configuration via environment variables (or the lower-case dotted system property):
 * <ul>
 *   <li>{@code TRS_TRACING_ENABLED}: enable tracing (default: false)</li>
 *   <li>{@code TRS_TRACE_SAMPLING_RATIO}: 0.0-1.0 (default: 1.0)</li>
 *   <li>{@code TRS_SERVICE_VERSION}: reported service version (default: unknown)</li>
 * </ul>
 */
public final class TracingService {
    private static final Logger logger = Logger.getLogger(TracingService.class.getName());

    private static final String INSTRUMENTATION_NAME = "com.repoq.trs";
    private static final String SERVICE = "trs-verifier";

    private static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
    private static final AttributeKey<String> SERVICE_VERSION = AttributeKey.stringKey("service.version");

    private static volatile TracingService INSTANCE;
    private static final Object LOCK = new Object();

    private final OpenTelemetry openTelemetry;
    private final Tracer tracer;
    private final SdkTracerProvider tracerProvider;

    private TracingService(OpenTelemetry openTelemetry, SdkTracerProvider tracerProvider) {
        this.openTelemetry = openTelemetry;
        this.tracer = openTelemetry.getTracer(INSTRUMENTATION_NAME);
        this.tracerProvider = tracerProvider;
    }

    public static TracingService getInstance() {
        TracingService instance = INSTANCE;
        if (instance == null) {
            synchronized (LOCK) {
                instance = INSTANCE;
                if (instance == null) {
                    instance = create(EnvironmentSettings.getBoolean("TRS_TRACING_ENABLED", false));
                    INSTANCE = instance;
                }
            }
        }
        return instance;
    }

    /**
     * Builds a service without touching the shared instance. The SDK is not registered
     * globally, so several services may coexist in one JVM.
     */
    public static TracingService create(boolean enabled) {
        if (!enabled) {
            logger.fine("OpenTelemetry tracing is disabled");
            return new TracingService(OpenTelemetry.noop(), null);
        }
        try {
            Sampler sampler = Sampler.parentBasedBuilder(Sampler.traceIdRatioBased(samplingRatio())).build();
            SdkTracerProvider tracerProvider = SdkTracerProvider.builder()
                    .setResource(Resource.getDefault().merge(Resource.create(Attributes.builder()
                            .put(SERVICE_NAME, SERVICE)
                            .put(SERVICE_VERSION, EnvironmentSettings.getString("TRS_SERVICE_VERSION", "unknown"))
                            .build())))
                    .setSampler(sampler)
                    .addSpanProcessor(BatchSpanProcessor.builder(LoggingSpanExporter.create())
                            .setMaxQueueSize(2048)
                            .setScheduleDelay(Duration.ofSeconds(1))
                            .build())
                    .build();
            OpenTelemetrySdk sdk = OpenTelemetrySdk.builder()
                    .setTracerProvider(tracerProvider)
                    .build();
            logger.info("OpenTelemetry initialized with logging exporter, sampler=" + sampler.getDescription());
            return new TracingService(sdk, tracerProvider);
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to initialize OpenTelemetry - falling back to noop", e);
            return new TracingService(OpenTelemetry.noop(), null);
        }
    }

    private static double samplingRatio() {
        String raw = EnvironmentSettings.getString("TRS_TRACE_SAMPLING_RATIO", "1.0");
        try {
            return Math.max(0.0, Math.min(1.0, Double.parseDouble(raw)));
        } catch (NumberFormatException e) {
            logger.warning("Invalid TRS_TRACE_SAMPLING_RATIO '" + raw + "', using 1.0");
            return 1.0;
        }
    }

    /**
     * Exports pending spans and releases the SDK.
     */
    public void shutdown() {
        if (tracerProvider == null) {
            return;
        }
        tracerProvider.shutdown().join(10, TimeUnit.SECONDS);
    }

    public void flush() {
        if (tracerProvider == null) {
            return;
        }
        tracerProvider.forceFlush().join(10, TimeUnit.SECONDS);
    }

    public Tracer getTracer() {
        return tracer;
    }

    public OpenTelemetry getOpenTelemetry() {
        return openTelemetry;
    }

    public boolean isEnabled() {
        return tracerProvider != null;
    }
}
