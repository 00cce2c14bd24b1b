package fr.lapetina.inference.gateway.disruptor;

import com.lmax.disruptor.EventFactory;
import fr.lapetina.inference.gateway.domain.model.RequestLog;

/**
 * Mutable ring buffer slot carrying one request log to the writer.
 *
 * Slots are pre-allocated and reused; {@link #clear()} runs after each write so the
 * buffer does not pin old payloads.
 */
public final class RequestLogEvent {

    public static final EventFactory<RequestLogEvent> FACTORY = RequestLogEvent::new;

    private RequestLog log;

    public RequestLog getLog() {
        return log;
    }

    public void setLog(RequestLog log) {
        this.log = log;
    }

    public void clear() {
        this.log = null;
    }
}
