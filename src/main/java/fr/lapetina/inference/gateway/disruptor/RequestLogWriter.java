package fr.lapetina.inference.gateway.disruptor;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.inference.gateway.domain.model.RequestLog;
import fr.lapetina.inference.gateway.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.inference.gateway.store.RequestLogStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single consumer of the request log ring buffer: writes each log to the store.
 */
final class RequestLogWriter implements EventHandler<RequestLogEvent> {

    private static final Logger log = LoggerFactory.getLogger(RequestLogWriter.class);

    private final RequestLogStore store;
    private final MetricsRegistry metrics;

    RequestLogWriter(RequestLogStore store, MetricsRegistry metrics) {
        this.store = store;
        this.metrics = metrics;
    }

    @Override
    public void onEvent(RequestLogEvent event, long sequence, boolean endOfBatch) {
        RequestLog requestLog = event.getLog();
        try {
            if (requestLog != null) {
                store.save(requestLog);
                metrics.incrementRequestLogWrites("ring");
                log.debug("Request log written: id={}, sequence={}", requestLog.id(), sequence);
            }
        } finally {
            event.clear();
        }
    }
}
