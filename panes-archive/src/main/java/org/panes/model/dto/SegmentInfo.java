package org.panes.model.dto;

public record SegmentInfo(String name, int startIndex, int count, boolean nested) {

    public int endIndexExclusive() {
        return startIndex + count;
    }
}
