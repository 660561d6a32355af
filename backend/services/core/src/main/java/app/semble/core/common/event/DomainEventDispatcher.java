package app.semble.core.common.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class DomainEventDispatcher {

    private static final Logger log = LoggerFactory.getLogger(DomainEventDispatcher.class);

    private final ApplicationEventPublisher publisher;

    public DomainEventDispatcher(ApplicationEventPublisher publisher) {
        this.publisher = publisher;
    }

    public void dispatch(List<Object> events) {
        for (Object event : events) {
            log.debug("Dispatching {}", event);
            publisher.publishEvent(event);
        }
    }
}
