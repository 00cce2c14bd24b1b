/**
 * Streaming inference: relay of remote chunks and proxying to the client as server-sent events.
 */
package fr.lapetina.inference.gateway.streaming;
