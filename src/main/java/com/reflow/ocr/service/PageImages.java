package com.reflow.ocr.service;

import com.reflow.ocr.model.PageMetadata;
import lombok.extern.slf4j.Slf4j;
import org.w3c.dom.NodeList;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.metadata.IIOMetadata;
import javax.imageio.metadata.IIOMetadataFormatImpl;
import javax.imageio.metadata.IIOMetadataNode;
import javax.imageio.stream.ImageInputStream;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Iterator;

/**
 * Reads size and resolution from uploaded page bytes without decoding the raster.
 */
@Slf4j
final class PageImages {

    private static final float MM_PER_INCH = 25.4f;

    private PageImages() {
    }

    static PageMetadata inspect(byte[] data, String mimetype) {
        try (ImageInputStream input = ImageIO.createImageInputStream(new ByteArrayInputStream(data))) {
            if (input == null) {
                return PageMetadata.unknown(mimetype);
            }
            Iterator<ImageReader> readers = ImageIO.getImageReaders(input);
            if (!readers.hasNext()) {
                log.debug("No image reader recognizes the uploaded page ({})", mimetype);
                return PageMetadata.unknown(mimetype);
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(input, true, false);
                String type = mimetype != null ? mimetype : providerMimeType(reader);
                return new PageMetadata(reader.getWidth(0), reader.getHeight(0), readDpi(reader.getImageMetadata(0)), type);
            } finally {
                reader.dispose();
            }
        } catch (IOException | RuntimeException e) {
            log.debug("Page metadata unavailable: {}", e.getMessage());
            return PageMetadata.unknown(mimetype);
        }
    }

    private static String providerMimeType(ImageReader reader) {
        if (reader.getOriginatingProvider() == null) {
            return null;
        }
        String[] types = reader.getOriginatingProvider().getMIMETypes();
        return types != null && types.length > 0 ? types[0] : null;
    }

    private static Integer readDpi(IIOMetadata metadata) {
        if (metadata == null || !metadata.isStandardMetadataFormatSupported()) {
            return null;
        }
        IIOMetadataNode root = (IIOMetadataNode) metadata.getAsTree(IIOMetadataFormatImpl.standardMetadataFormatName);
        NodeList nodes = root.getElementsByTagName("HorizontalPixelSize");
        if (nodes.getLength() == 0) {
            return null;
        }
        float mmPerPixel = Float.parseFloat(((IIOMetadataNode) nodes.item(0)).getAttribute("value"));
        return mmPerPixel > 0 ? Math.round(MM_PER_INCH / mmPerPixel) : null;
    }
}
