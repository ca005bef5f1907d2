package org.panes.service.image;

import lombok.extern.slf4j.Slf4j;
import org.panes.model.dto.ImageDimensions;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Iterator;
import java.util.Optional;

@Slf4j
@Component
public class ImageIoImageDecoder implements ImageDecoder {

    @Override
    public Optional<BufferedImage> decode(byte[] data) {
        if (data == null || data.length == 0) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(ImageIO.read(new ByteArrayInputStream(data)));
        } catch (IOException e) {
            log.warn("Failed to decode image of {} bytes: {}", data.length, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public Optional<ImageDimensions> readDimensions(byte[] data) {
        if (data == null || data.length == 0) {
            return Optional.empty();
        }
        try (ImageInputStream iis = ImageIO.createImageInputStream(new ByteArrayInputStream(data))) {
            if (iis == null) {
                return Optional.empty();
            }
            Iterator<ImageReader> readers = ImageIO.getImageReaders(iis);
            if (!readers.hasNext()) {
                return Optional.empty();
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(iis, true, true);
                return Optional.of(new ImageDimensions(reader.getWidth(0), reader.getHeight(0)));
            } finally {
                reader.dispose();
            }
        } catch (IOException e) {
            log.warn("Failed to read image header: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
