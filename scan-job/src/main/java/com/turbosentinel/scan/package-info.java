/**
 * Scan job: scans configured units on a schedule, runs the anomaly engine on
 * their stored series and hands actionable anomalies to a reporting
 * collaborator.
 *
 * <p>
 * {@link com.turbosentinel.scan.AnomalyScanJob} is the entry point;
 * {@link com.turbosentinel.scan.UnitScanOrchestrator} isolates units from each
 * other's storage failures.
 * </p>
 */
package com.turbosentinel.scan;
