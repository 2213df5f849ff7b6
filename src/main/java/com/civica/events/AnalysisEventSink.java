package com.civica.events;

import com.civica.model.AnalysisCompletedEvent;

/**
 * Fire-and-forget receiver of completed analyses.
 */
public interface AnalysisEventSink {

    void publish(AnalysisCompletedEvent event);
}
