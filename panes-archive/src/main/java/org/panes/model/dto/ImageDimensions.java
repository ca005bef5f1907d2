package org.panes.model.dto;

public record ImageDimensions(int width, int height) {
}
