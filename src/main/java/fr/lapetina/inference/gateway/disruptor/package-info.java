/**
 * Asynchronous request logging on an LMAX Disruptor ring buffer.
 *
 * <p>Request handlers publish a {@link fr.lapetina.inference.gateway.domain.model.RequestLog}
 * and return; a single consumer writes entries to the store in order.
 * When the ring buffer is full the caller writes the entry itself.
 *
 * @see com.lmax.disruptor.dsl.Disruptor
 */
package fr.lapetina.inference.gateway.disruptor;
