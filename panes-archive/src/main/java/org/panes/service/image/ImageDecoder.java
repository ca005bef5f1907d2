package org.panes.service.image;

import org.panes.model.dto.ImageDimensions;

import java.awt.image.BufferedImage;
import java.util.Optional;

public interface ImageDecoder {

    Optional<BufferedImage> decode(byte[] data);

    /**
     * Pixel size from the image header, without decoding the raster.
     */
    Optional<ImageDimensions> readDimensions(byte[] data);
}
