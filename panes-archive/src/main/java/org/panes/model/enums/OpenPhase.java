package org.panes.model.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Progress phases of a single container open, always reported in declaration order.
 * {@link #EXTRACTING} is only reported by families that decompress eagerly.
 */
@Getter
@RequiredArgsConstructor
public enum OpenPhase {
    OPENING("opening"),
    BUILDING_IMAGE_LIST("building image list"),
    EXTRACTING("extracting");

    private final String label;
}
