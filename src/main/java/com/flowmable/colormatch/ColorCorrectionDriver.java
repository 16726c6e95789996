package com.flowmable.colormatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command line front-ends for the color matcher.
 * <p>
 * {@code batch} corrects every image in a folder against a folder of
 * references; {@code correct} handles a single photo. Both only do I/O and
 * reporting around one {@link ColorMatcher}.
 */
@Command(name = "color-match", mixinStandardHelpOptions = true,
        description = "Matches photos to brand reference images and corrects their colors.",
        subcommands = {ColorCorrectionDriver.BatchCommand.class, ColorCorrectionDriver.CorrectCommand.class})
public class ColorCorrectionDriver implements Runnable {

    private static final Logger logger = LoggerFactory.getLogger(ColorCorrectionDriver.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_FILE_FAILURES = 1;
    public static final int EXIT_INVALID_SETUP = 2;

    static final String OUTPUT_PREFIX = "corrected_";

    public static void main(String[] args) {
        System.exit(newCommandLine().execute(args));
    }

    static CommandLine newCommandLine() {
        return new CommandLine(new ColorCorrectionDriver());
    }

    @Override
    public void run() {
        CommandLine.usage(this, System.out);
    }

    /**
     * Options shared by both subcommands.
     */
    static class TuningOptions {

        @Option(names = {"-r", "--references"}, defaultValue = "references",
                description = "Folder of reference images (default: ${DEFAULT-VALUE}).")
        Path referencesDir;

        @Option(names = {"-s", "--strength"}, defaultValue = "0.85",
                description = "Blend strength in [0, 1]; 1 applies the full transfer (default: ${DEFAULT-VALUE}).")
        double strength;

        @Option(names = "--lightness-weight", defaultValue = "1.5",
                description = "Weight of the lightness difference when choosing a reference (default: ${DEFAULT-VALUE}).")
        double lightnessWeight;

        @Option(names = "--color-weight", defaultValue = "1.0",
                description = "Weight of each color-opponent difference when choosing a reference (default: ${DEFAULT-VALUE}).")
        double colorWeight;

        @Option(names = "--reference-size", defaultValue = "300",
                description = "Side length references are resized to before analysis; 0 keeps them as is (default: ${DEFAULT-VALUE}).")
        int referenceSize;

        /**
         * Validates the tuning values and builds the matcher and reference set.
         */
        Setup prepare() throws IOException {
            ColorMatcher.requireStrength(strength);
            MatchingWeights weights = new MatchingWeights(lightnessWeight, colorWeight);
            if (referenceSize < 0) {
                throw new InvalidParameterException("reference-size must not be negative, got " + referenceSize);
            }

            Map<String, PixelBuffer> references = PixelBufferIO.loadReferences(referencesDir, referenceSize);
            if (references.isEmpty()) {
                throw new EmptyReferenceSetException("No reference images found in " + referencesDir);
            }
            ColorMatcher matcher = new ColorMatcher(weights, new StatsExtractor(), new ReferenceStatsCache());
            return new Setup(matcher, references);
        }
    }

    record Setup(ColorMatcher matcher, Map<String, PixelBuffer> references) {

        ReferenceMatch correct(Path input, Path output, double strength) throws IOException {
            PixelBuffer source = PixelBufferIO.read(input);
            ReferenceMatch match = matcher.selectBestReference(source, references);
            PixelBuffer corrected = matcher.applyColorTransfer(source, match.buffer(), strength);
            PixelBufferIO.write(corrected, output);
            return match;
        }
    }

    @Command(name = "batch", mixinStandardHelpOptions = true,
            description = "Corrects every JPEG/PNG in the input folder and writes corrected_<name> files.")
    static class BatchCommand implements Callable<Integer> {

        @Mixin
        TuningOptions tuning;

        @Option(names = {"-i", "--input"}, defaultValue = "input",
                description = "Folder of photos to correct (default: ${DEFAULT-VALUE}).")
        Path inputDir;

        @Option(names = {"-o", "--output"}, defaultValue = "output",
                description = "Folder for corrected photos, created if missing (default: ${DEFAULT-VALUE}).")
        Path outputDir;

        @Override
        public Integer call() {
            Setup setup;
            List<Path> inputs;
            try {
                setup = tuning.prepare();
                inputs = PixelBufferIO.listImages(inputDir);
                Files.createDirectories(outputDir);
            } catch (IOException | ColorMatchException e) {
                logger.error(e.getMessage());
                return EXIT_INVALID_SETUP;
            }

            logger.info("Processing {} image(s) from {}", inputs.size(), inputDir);
            return correctAll(setup, inputs, outputDir, tuning.strength);
        }
    }

    /**
     * Corrects each input into {@code outputDir}. A file that fails is logged
     * and counted; the remaining files are still processed.
     *
     * @return {@link #EXIT_OK}, or {@link #EXIT_FILE_FAILURES} if any file failed
     */
    static int correctAll(Setup setup, List<Path> inputs, Path outputDir, double strength) {
        int failed = 0;
        for (Path input : inputs) {
            String name = input.getFileName().toString();
            Path output = outputDir.resolve(OUTPUT_PREFIX + name);
            try {
                ReferenceMatch match = setup.correct(input, output, strength);
                logger.info("{}: matched {} (distance {}), saved {}",
                        name, match.name(), String.format("%.2f", match.distance()), output);
            } catch (IOException | InvalidInputException e) {
                logger.warn("{}: failed - {}", name, e.getMessage());
                failed++;
            } catch (RuntimeException e) {
                // Codec and AWT errors on one odd file
                logger.warn("{}: failed unexpectedly", name, e);
                failed++;
            }
        }

        if (failed > 0) {
            logger.warn("{} of {} image(s) failed", failed, inputs.size());
            return EXIT_FILE_FAILURES;
        }
        return EXIT_OK;
    }

    @Command(name = "correct", mixinStandardHelpOptions = true,
            description = "Corrects a single photo against the best matching reference.")
    static class CorrectCommand implements Callable<Integer> {

        @Mixin
        TuningOptions tuning;

        @Parameters(index = "0", paramLabel = "input", description = "Photo to correct.")
        Path input;

        @Parameters(index = "1", paramLabel = "output", description = "Where to write the corrected photo.")
        Path output;

        @Override
        public Integer call() {
            Setup setup;
            try {
                setup = tuning.prepare();
            } catch (IOException | ColorMatchException e) {
                logger.error(e.getMessage());
                return EXIT_INVALID_SETUP;
            }

            try {
                ReferenceMatch match = setup.correct(input, output, tuning.strength);
                logger.info("Correction applied using reference {} (distance {}), saved {}",
                        match.name(), String.format("%.2f", match.distance()), output);
                return EXIT_OK;
            } catch (IOException | InvalidInputException e) {
                logger.error("Could not correct {}: {}", input, e.getMessage());
                return EXIT_FILE_FAILURES;
            } catch (RuntimeException e) {
                logger.error("Could not correct {}", input, e);
                return EXIT_FILE_FAILURES;
            }
        }
    }
}
