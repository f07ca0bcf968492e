package org.pixelmill.processing;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.pixelmill.exception.DecodeException;
import org.pixelmill.imaging.AwtImagingLibrary;
import org.pixelmill.imaging.ImagingLibrary;
import org.pixelmill.metrics.ErrorKind;
import org.pixelmill.metrics.ResultRecord;
import org.pixelmill.util.TestDataGenerator;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ImageWorkerTest {

    @TempDir
    Path tempDir;

    private static final TransformConfig SMALL = new TransformConfig(16, 12, 1.0, 2.0, 1.5, 1.2, 1, false);

    private final ImageWorker worker = new ImageWorker(new AwtImagingLibrary(), 0.85f);

    @Test
    void testProcess_success() throws IOException {
        Path source = TestDataGenerator.writeImage(tempDir.resolve("in").resolve("photo.png"), 40, 30, 1);
        byte[] before = Files.readAllBytes(source);
        Path destination = Files.createDirectories(tempDir.resolve("out")).resolve("processed_photo.png");

        ResultRecord record = worker.process(new WorkItem(source, destination, SMALL));

        assertTrue(record.success(), () -> "Unexpected failure: " + record.message());
        assertTrue(Files.exists(destination));
        assertEquals(Files.size(destination), record.bytesWritten().getAsLong());
        BufferedImage written = ImageIO.read(destination.toFile());
        assertEquals(16, written.getWidth());
        assertEquals(12, written.getHeight());
        assertArrayEquals(before, Files.readAllBytes(source), "The source file must never be modified.");
    }

    @Test
    void testProcess_jpegOutput() throws IOException {
        Path source = TestDataGenerator.writeImage(tempDir.resolve("in").resolve("photo.jpg"), 40, 30, 2);
        Path destination = Files.createDirectories(tempDir.resolve("out")).resolve("processed_photo.jpg");

        ResultRecord record = worker.process(new WorkItem(source, destination, SMALL));

        assertTrue(record.success());
        assertNotNull(ImageIO.read(destination.toFile()));
    }

    @Test
    void testProcess_missingSourceIsAccessError() {
        ResultRecord record = worker.process(new WorkItem(tempDir.resolve("gone.png"), tempDir.resolve("out.png"), SMALL));

        assertEquals(ErrorKind.ACCESS_ERROR, record.errorKind());
        assertFalse(Files.exists(tempDir.resolve("out.png")));
    }

    @Test
    void testProcess_corruptSourceIsDecodeError() throws IOException {
        Path source = TestDataGenerator.createCorruptImage(tempDir.resolve("broken.png"));

        ResultRecord record = worker.process(new WorkItem(source, tempDir.resolve("processed_broken.png"), SMALL));

        assertEquals(ErrorKind.DECODE_ERROR, record.errorKind());
        assertNull(record.failedStage());
        assertFalse(Files.exists(tempDir.resolve("processed_broken.png")), "Nothing is written for a failed item.");
    }

    @Test
    void testProcess_unwritableDestinationIsAccessError() {
        Path source = TestDataGenerator.writeImage(tempDir.resolve("photo.png"), 20, 20, 3);
        Path destination = tempDir.resolve("no_such_dir").resolve("processed_photo.png");

        ResultRecord record = worker.process(new WorkItem(source, destination, SMALL));

        assertEquals(ErrorKind.ACCESS_ERROR, record.errorKind());
    }

    @Test
    void testProcess_stageFailureIsTransformError() throws Exception {
        ImagingLibrary imaging = mock(ImagingLibrary.class);
        when(imaging.decode(any())).thenReturn(new BufferedImage(4, 4, BufferedImage.TYPE_INT_RGB));
        when(imaging.resize(any(), anyInt(), anyInt())).thenThrow(new IllegalArgumentException("too small"));
        Path source = Files.write(tempDir.resolve("photo.png"), new byte[]{1, 2, 3});

        ResultRecord record = new ImageWorker(imaging, 0.85f)
                .process(new WorkItem(source, tempDir.resolve("processed_photo.png"), SMALL));

        assertEquals(ErrorKind.TRANSFORM_ERROR, record.errorKind());
        assertEquals("Resize", record.failedStage());
        assertTrue(record.message().contains("too small"));
    }

    @Test
    void testProcess_decoderExceptionPropagatesAsRecord() throws Exception {
        ImagingLibrary imaging = mock(ImagingLibrary.class);
        when(imaging.decode(any())).thenThrow(new DecodeException("Unsupported pixel layout"));
        Path source = Files.write(tempDir.resolve("photo.bmp"), new byte[]{1});

        ResultRecord record = new ImageWorker(imaging, 0.85f)
                .process(new WorkItem(source, tempDir.resolve("processed_photo.bmp"), SMALL));

        assertEquals(ErrorKind.DECODE_ERROR, record.errorKind());
        assertEquals("Unsupported pixel layout", record.message());
    }

    @Test
    void testFormatFor() {
        assertEquals("jpg", ImageWorker.formatFor(Path.of("a.JPEG")));
        assertEquals("jpg", ImageWorker.formatFor(Path.of("a.jpg")));
        assertEquals("png", ImageWorker.formatFor(Path.of("a.png")));
        assertEquals("gif", ImageWorker.formatFor(Path.of("a.gif")));
        assertEquals("png", ImageWorker.formatFor(Path.of("noext")));
    }
}
