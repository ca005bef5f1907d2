package org.panes.service.reader;

import org.panes.model.enums.OpenPhase;

/**
 * Receives the phases of a container open, in order. May be invoked from a background thread.
 */
@FunctionalInterface
public interface OpenPhaseListener {

    OpenPhaseListener NONE = phase -> {
    };

    void onPhase(OpenPhase phase);

    static OpenPhaseListener nullSafe(OpenPhaseListener listener) {
        return listener != null ? listener : NONE;
    }
}
