/**
 * Target selection and failover.
 *
 * <p>{@link fr.lapetina.inference.gateway.routing.FederatedRouter} builds the candidate list of a
 * request (access checks, maintenance, live status, health ordering) and tries candidates in order
 * until one succeeds or a client fault ends the attempt.
 */
package fr.lapetina.inference.gateway.routing;
