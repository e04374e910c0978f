package com.filmtools.contactsheet.core.render;

import com.filmtools.contactsheet.core.model.NumberedThumbnail;
import org.junit.jupiter.api.Test;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ThumbnailProducerTest {

    private final ThumbnailProducer producer = new ThumbnailProducer();

    @Test
    void smallSourceIsCentredWithoutUpscaling() {
        BufferedImage source = solid(100, 50, Color.GREEN);

        BufferedImage box = producer.resizeToFit(source, 365, 243);

        assertEquals(365, box.getWidth());
        assertEquals(243, box.getHeight());
        int x = (365 - 100) / 2;
        int y = (243 - 50) / 2;
        assertEquals(Color.GREEN.getRGB(), box.getRGB(x + 50, y + 25));
        assertEquals(Color.BLACK.getRGB(), box.getRGB(x - 1, y + 25));
        assertEquals(Color.BLACK.getRGB(), box.getRGB(0, 0));
    }

    @Test
    void largeSourceIsLetterboxedInsideCell() {
        BufferedImage source = solid(1000, 1000, Color.BLUE);

        BufferedImage box = producer.resizeToFit(source, 300, 200);

        assertEquals(300, box.getWidth());
        assertEquals(200, box.getHeight());
        assertEquals(Color.BLUE.getRGB(), box.getRGB(150, 100));
        assertEquals(Color.BLACK.getRGB(), box.getRGB(10, 100));
        assertEquals(Color.BLACK.getRGB(), box.getRGB(290, 100));
    }

    @Test
    void rejectsEmptyBox() {
        BufferedImage source = solid(10, 10, Color.RED);

        assertThrows(IllegalArgumentException.class, () -> producer.resizeToFit(source, 0, 10));
    }

    @Test
    void numberBadgeIsDrawnOnCopy() {
        BufferedImage source = solid(200, 150, Color.BLACK);

        BufferedImage numbered = producer.overlayNumber(source, 12);

        assertNotSame(source, numbered);
        assertEquals(0, countLight(source, 0, 0, 60, 40));
        assertTrue(countLight(numbered, 0, 0, 60, 40) > 0, "Badge should paint white pixels in the corner");
        assertEquals(0, countLight(numbered, 100, 100, 200, 150), "Badge must stay in the top-left corner");
    }

    @Test
    void produceKeepsCellSize() {
        BufferedImage thumb = producer.produce(new NumberedThumbnail(solid(640, 480, Color.GRAY), 7), 365, 243);

        assertEquals(365, thumb.getWidth());
        assertEquals(243, thumb.getHeight());
    }

    static BufferedImage solid(int width, int height, Color color) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = image.createGraphics();
        try {
            g.setColor(color);
            g.fillRect(0, 0, width, height);
        } finally {
            g.dispose();
        }
        return image;
    }

    static int countLight(BufferedImage image, int x0, int y0, int x1, int y1) {
        int count = 0;
        for (int y = y0; y < Math.min(y1, image.getHeight()); y++) {
            for (int x = x0; x < Math.min(x1, image.getWidth()); x++) {
                Color c = new Color(image.getRGB(x, y));
                if (c.getRed() > 200 && c.getGreen() > 200 && c.getBlue() > 200) {
                    count++;
                }
            }
        }
        return count;
    }
}
