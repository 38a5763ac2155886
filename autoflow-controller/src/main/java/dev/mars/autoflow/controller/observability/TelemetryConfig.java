/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.autoflow.controller.observability;

import dev.mars.autoflow.controller.config.AppConfig;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporter;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Configuration for OpenTelemetry integration.
 *
 * <p>When telemetry is enabled the SDK is built with an OTLP metric exporter read
 * periodically; otherwise a no-op instance is handed out.
 */
public final class TelemetryConfig implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(TelemetryConfig.class);

    private final OpenTelemetry openTelemetry;
    private final OpenTelemetrySdk sdk;

    private TelemetryConfig(OpenTelemetry openTelemetry, OpenTelemetrySdk sdk) {
        this.openTelemetry = openTelemetry;
        this.sdk = sdk;
    }

    public static TelemetryConfig configure(AppConfig config) {
        if (!config.isTelemetryEnabled()) {
            logger.info("Telemetry is disabled");
            return new TelemetryConfig(OpenTelemetry.noop(), null);
        }

        String serviceName = config.getServiceName();
        String endpoint = config.getOtlpEndpoint();
        Duration interval = Duration.ofMillis(config.getTelemetryExportIntervalMs());

        Resource resource = Resource.getDefault().toBuilder()
                .put("service.name", serviceName)
                .build();

        OtlpGrpcMetricExporter metricExporter = OtlpGrpcMetricExporter.builder()
                .setEndpoint(endpoint)
                .build();

        SdkMeterProvider meterProvider = SdkMeterProvider.builder()
                .setResource(resource)
                .registerMetricReader(PeriodicMetricReader.builder(metricExporter)
                        .setInterval(interval)
                        .build())
                .build();

        OpenTelemetrySdk sdk = OpenTelemetrySdk.builder()
                .setMeterProvider(meterProvider)
                .build();

        logger.info("OpenTelemetry configured: service={}, otlp={}, interval={}ms",
                serviceName, endpoint, interval.toMillis());
        return new TelemetryConfig(sdk, sdk);
    }

    public OpenTelemetry getOpenTelemetry() {
        return openTelemetry;
    }

    public boolean isEnabled() {
        return sdk != null;
    }

    /**
     * Flushes pending metrics and shuts the SDK down.
     */
    @Override
    public void close() {
        if (sdk == null) {
            return;
        }
        if (!sdk.shutdown().join(10, TimeUnit.SECONDS).isSuccess()) {
            logger.warn("OpenTelemetry SDK did not shut down cleanly");
        } else {
            logger.info("OpenTelemetry SDK shut down");
        }
    }
}
