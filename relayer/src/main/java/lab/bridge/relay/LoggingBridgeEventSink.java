package lab.bridge.relay;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(10)
@Slf4j
public class LoggingBridgeEventSink implements BridgeEventSink {

    @Override
    public void accept(BridgeEvent event) {
        if (event instanceof BridgeWarning warning) {
            if (warning.isCritical()) {
                log.error("event=bridge.warning kind={} severity={} source={} transferId={} message={} at={}",
                        warning.kind(), warning.severity(), warning.source(), warning.bridgeTransferId(), warning.message(), warning.occurredAt());
            } else {
                log.warn("event=bridge.warning kind={} severity={} source={} transferId={} message={} at={}",
                        warning.kind(), warning.severity(), warning.source(), warning.bridgeTransferId(), warning.message(), warning.occurredAt());
            }
            return;
        }
        if (event instanceof ContractEventObserved observed) {
            log.info("event=bridge.contract_event origin={} contractEvent={} transferId={} at={}",
                    observed.origin(), observed.eventName(), observed.event().bridgeTransferId(), observed.occurredAt());
            return;
        }
        if (event instanceof SwapProgressReported progress) {
            log.info("event=bridge.swap_progress direction={} outcome={} transferId={} at={}",
                    progress.direction().label(), progress.progress().getClass().getSimpleName(),
                    progress.progress().bridgeTransferId(), progress.occurredAt());
        }
    }
}
