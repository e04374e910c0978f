package com.filmtools.contactsheet.core.export;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageTypeSpecifier;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.metadata.IIOMetadata;
import javax.imageio.metadata.IIOMetadataNode;
import javax.imageio.stream.ImageOutputStream;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.OutputStream;
import java.util.Iterator;

/**
 * Encodes a sheet as JPEG or PNG with its DPI recorded in the file metadata.
 */
final class RasterSheetWriter {
    static final float JPEG_QUALITY = 0.95f;
    static final double METERS_PER_INCH = 0.0254;

    private static final String JPEG_NATIVE_FORMAT = "javax_imageio_jpeg_image_1.0";
    private static final String PNG_NATIVE_FORMAT = "javax_imageio_png_1.0";

    private RasterSheetWriter() {
    }

    static void writeJpeg(BufferedImage image, int dpi, OutputStream out) throws IOException {
        ImageWriter writer = writerFor("jpeg");
        try {
            ImageWriteParam param = writer.getDefaultWriteParam();
            param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            param.setCompressionQuality(JPEG_QUALITY);

            IIOMetadata metadata = writer.getDefaultImageMetadata(ImageTypeSpecifier.createFromRenderedImage(image), param);
            IIOMetadataNode root = (IIOMetadataNode) metadata.getAsTree(JPEG_NATIVE_FORMAT);
            IIOMetadataNode jfif = findOrCreateJfif(root);
            jfif.setAttribute("resUnits", "1");
            jfif.setAttribute("Xdensity", Integer.toString(dpi));
            jfif.setAttribute("Ydensity", Integer.toString(dpi));
            metadata.setFromTree(JPEG_NATIVE_FORMAT, root);

            write(writer, image, metadata, param, out);
        } finally {
            writer.dispose();
        }
    }

    static void writePng(BufferedImage image, int dpi, OutputStream out) throws IOException {
        ImageWriter writer = writerFor("png");
        try {
            ImageWriteParam param = writer.getDefaultWriteParam();
            IIOMetadata metadata = writer.getDefaultImageMetadata(ImageTypeSpecifier.createFromRenderedImage(image), param);

            String pixelsPerMeter = Long.toString(Math.round(dpi / METERS_PER_INCH));
            IIOMetadataNode phys = new IIOMetadataNode("pHYs");
            phys.setAttribute("pixelsPerUnitXAxis", pixelsPerMeter);
            phys.setAttribute("pixelsPerUnitYAxis", pixelsPerMeter);
            phys.setAttribute("unitSpecifier", "meter");
            IIOMetadataNode root = new IIOMetadataNode(PNG_NATIVE_FORMAT);
            root.appendChild(phys);
            metadata.mergeTree(PNG_NATIVE_FORMAT, root);

            write(writer, image, metadata, param, out);
        } finally {
            writer.dispose();
        }
    }

    private static void write(ImageWriter writer,
                              BufferedImage image,
                              IIOMetadata metadata,
                              ImageWriteParam param,
                              OutputStream out) throws IOException {
        try (ImageOutputStream ios = ImageIO.createImageOutputStream(out)) {
            if (ios == null) {
                throw new IOException("No image output stream available");
            }
            writer.setOutput(ios);
            writer.write(null, new IIOImage(image, null, metadata), param);
            ios.flush();
        }
    }

    private static ImageWriter writerFor(String formatName) throws IOException {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName(formatName);
        if (!writers.hasNext()) {
            throw new IOException("No " + formatName + " writer found");
        }
        return writers.next();
    }

    private static IIOMetadataNode findOrCreateJfif(IIOMetadataNode root) {
        if (root.getElementsByTagName("app0JFIF").getLength() > 0) {
            return (IIOMetadataNode) root.getElementsByTagName("app0JFIF").item(0);
        }
        IIOMetadataNode variety;
        if (root.getElementsByTagName("JPEGvariety").getLength() > 0) {
            variety = (IIOMetadataNode) root.getElementsByTagName("JPEGvariety").item(0);
        } else {
            variety = new IIOMetadataNode("JPEGvariety");
            root.insertBefore(variety, root.getFirstChild());
        }
        IIOMetadataNode jfif = new IIOMetadataNode("app0JFIF");
        variety.appendChild(jfif);
        return jfif;
    }
}
