package lab.bridge.common.logging;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.filter.Filter;
import ch.qos.logback.core.spi.FilterReply;

import java.util.Map;

/**
 * Lets through only lines logged while the relay was handling a specific swap (MDC transferId set).
 * Backs the swap audit appender.
 */
public class RequireTransferIdFilter extends Filter<ILoggingEvent> {

    static final String TRANSFER_ID_KEY = "transferId";

    @Override
    public FilterReply decide(ILoggingEvent event) {
        if (event == null) {
            return FilterReply.DENY;
        }
        Map<String, String> mdc = event.getMDCPropertyMap();
        if (mdc != null && mdc.get(TRANSFER_ID_KEY) != null) {
            return FilterReply.NEUTRAL;
        }
        return FilterReply.DENY;
    }
}
