package com.flowmable.colormatch;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the batch and single-image commands against temporary folders.
 */
class ColorCorrectionDriverTest {

    @TempDir
    Path tmp;

    private Path input;
    private Path references;
    private Path output;

    @BeforeEach
    void setUp() throws IOException {
        input = Files.createDirectory(tmp.resolve("input"));
        references = Files.createDirectory(tmp.resolve("references"));
        output = tmp.resolve("output");

        PixelBufferIO.write(SyntheticImages.gradient(40, 30, 150, 120, 90, 230, 200, 170), references.resolve("warm.png"));
        PixelBufferIO.write(SyntheticImages.gradient(40, 30, 60, 80, 100, 140, 160, 180), references.resolve("cool.png"));
    }

    private int run(String... args) {
        return ColorCorrectionDriver.newCommandLine().execute(args);
    }

    @Test
    void batch_correctsEveryImage() throws IOException {
        PixelBufferIO.write(SyntheticImages.colorful(50, 40), input.resolve("one.png"));
        PixelBufferIO.write(SyntheticImages.colorful(20, 60), input.resolve("two.jpg"));

        int code = run("batch",
                "--input", input.toString(),
                "--references", references.toString(),
                "--output", output.toString());

        assertEquals(ColorCorrectionDriver.EXIT_OK, code);
        PixelBuffer one = PixelBufferIO.read(output.resolve("corrected_one.png"));
        PixelBuffer two = PixelBufferIO.read(output.resolve("corrected_two.jpg"));
        assertEquals(50, one.width());
        assertEquals(40, one.height());
        assertEquals(20, two.width());
        assertEquals(60, two.height());
    }

    @Test
    void batch_brokenInputIsReportedAndOthersStillWritten() throws IOException {
        PixelBufferIO.write(SyntheticImages.colorful(16, 16), input.resolve("good.png"));
        Files.writeString(input.resolve("bad.png"), "not an image");

        int code = run("batch",
                "-i", input.toString(),
                "-r", references.toString(),
                "-o", output.toString());

        assertEquals(ColorCorrectionDriver.EXIT_FILE_FAILURES, code);
        assertTrue(Files.exists(output.resolve("corrected_good.png")));
        assertFalse(Files.exists(output.resolve("corrected_bad.png")));
    }

    @Test
    void correctAll_uncheckedFailureCountsAsFailedFile() throws IOException {
        Path odd = input.resolve("odd.png");
        Path good = input.resolve("good.png");
        PixelBufferIO.write(SyntheticImages.colorful(13, 13), odd);
        PixelBufferIO.write(SyntheticImages.colorful(16, 16), good);
        Files.createDirectories(output);

        // Stands in for a codec that blows up on one particular image
        ColorMatcher picky = new ColorMatcher() {
            @Override
            public PixelBuffer applyColorTransfer(PixelBuffer source, PixelBuffer target, double strength) {
                if (source.width() == 13) {
                    throw new IllegalStateException("unsupported sample model");
                }
                return super.applyColorTransfer(source, target, strength);
            }
        };
        ColorCorrectionDriver.Setup setup = new ColorCorrectionDriver.Setup(
                picky, Map.of("flat", PixelBuffer.uniform(10, 10, 40, 160, 220)));

        int code = ColorCorrectionDriver.correctAll(setup, List.of(odd, good), output, 0.85);

        assertEquals(ColorCorrectionDriver.EXIT_FILE_FAILURES, code);
        assertFalse(Files.exists(output.resolve("corrected_odd.png")));
        assertTrue(Files.exists(output.resolve("corrected_good.png")));
    }

    @Test
    void batch_fullStrengthWithFlatReference() throws IOException {
        Path flatRefs = Files.createDirectory(tmp.resolve("flat"));
        PixelBufferIO.write(PixelBuffer.uniform(10, 10, 40, 160, 220), flatRefs.resolve("flat.png"));
        PixelBufferIO.write(SyntheticImages.colorful(24, 24), input.resolve("photo.png"));

        int code = run("batch",
                "-i", input.toString(),
                "-r", flatRefs.toString(),
                "-o", output.toString(),
                "--strength", "1.0");

        assertEquals(ColorCorrectionDriver.EXIT_OK, code);
        PixelBuffer result = PixelBufferIO.read(output.resolve("corrected_photo.png"));
        assertTrue(SyntheticImages.maxSampleDifference(PixelBuffer.uniform(24, 24, 40, 160, 220), result) <= 1);
    }

    @Test
    void batch_emptyReferenceFolderFails() throws IOException {
        Path empty = Files.createDirectory(tmp.resolve("empty"));
        PixelBufferIO.write(SyntheticImages.colorful(16, 16), input.resolve("photo.png"));

        int code = run("batch", "-i", input.toString(), "-r", empty.toString(), "-o", output.toString());

        assertEquals(ColorCorrectionDriver.EXIT_INVALID_SETUP, code);
        assertFalse(Files.exists(output));
    }

    @Test
    void batch_outOfRangeStrengthFails() {
        int code = run("batch",
                "-i", input.toString(),
                "-r", references.toString(),
                "-o", output.toString(),
                "--strength", "1.5");

        assertEquals(ColorCorrectionDriver.EXIT_INVALID_SETUP, code);
    }

    @Test
    void batch_negativeWeightFails() {
        int code = run("batch",
                "-i", input.toString(),
                "-r", references.toString(),
                "-o", output.toString(),
                "--color-weight=-1");

        assertEquals(ColorCorrectionDriver.EXIT_INVALID_SETUP, code);
    }

    @Test
    void correct_writesSingleOutput() throws IOException {
        Path photo = input.resolve("photo.png");
        Path result = tmp.resolve("fixed.png");
        PixelBufferIO.write(SyntheticImages.colorful(32, 18), photo);

        int code = run("correct", photo.toString(), result.toString(), "-r", references.toString(), "-s", "0.5");

        assertEquals(ColorCorrectionDriver.EXIT_OK, code);
        PixelBuffer corrected = PixelBufferIO.read(result);
        assertEquals(32, corrected.width());
        assertEquals(18, corrected.height());
    }

    @Test
    void correct_missingInputFails() {
        int code = run("correct", tmp.resolve("missing.png").toString(), tmp.resolve("out.png").toString(),
                "-r", references.toString());

        assertEquals(ColorCorrectionDriver.EXIT_FILE_FAILURES, code);
    }
}
