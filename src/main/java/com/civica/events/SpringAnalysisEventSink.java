package com.civica.events;

import com.civica.model.AnalysisCompletedEvent;
import org.springframework.context.ApplicationEventPublisher;

/**
 * Publishes completed analyses as Spring application events.
 */
public class SpringAnalysisEventSink implements AnalysisEventSink {

    private final ApplicationEventPublisher publisher;

    public SpringAnalysisEventSink(ApplicationEventPublisher publisher) {
        this.publisher = publisher;
    }

    @Override
    public void publish(AnalysisCompletedEvent event) {
        publisher.publishEvent(event);
    }
}
