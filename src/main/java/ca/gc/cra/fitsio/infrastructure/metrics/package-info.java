/**
 * OpenTelemetry implementation of {@link ca.gc.cra.fitsio.application.port.MetricsPort}.
 */
package ca.gc.cra.fitsio.infrastructure.metrics;
