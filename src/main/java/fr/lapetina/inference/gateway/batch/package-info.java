/**
 * Batch jobs: admission, submission, background polling and result files.
 *
 * <p>Status only moves forward: SUBMITTED, PENDING, RUNNING, then COMPLETED or FAILED.
 */
package fr.lapetina.inference.gateway.batch;
