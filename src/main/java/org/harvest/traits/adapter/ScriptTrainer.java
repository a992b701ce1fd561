package org.harvest.traits.adapter;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import org.harvest.exception.ExtractionRuntimeException;
import org.harvest.traits.profile.ModelProfile;
import org.jboss.logging.Logger;

import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Fine-tunes a model by running an external training script.
 *
 * <p>The script receives {@code --train_file}, {@code --output_dir},
 * {@code --num_epochs} and {@code --batch_size}. Training examples are
 * written as a JSON array of {@code {text, triples}} objects.
 */
public class ScriptTrainer {

    private static final Logger LOG = Logger.getLogger(ScriptTrainer.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();

    static final Duration TRAINING_TIMEOUT = Duration.ofHours(1);

    private final ExternalProcessRunner processRunner;

    public ScriptTrainer(ExternalProcessRunner processRunner) {
        this.processRunner = processRunner;
    }

    /**
     * Runs the training command.
     *
     * @param profile profile being trained
     * @param command program and leading arguments
     * @param workingDir directory the command runs in
     * @param examples training data
     * @param options output directory, epochs and batch size
     * @return success with the output directory, or failed with the script output or
     *         the reason the script could not run to completion
     */
    public TrainingResult train(ModelProfile profile, List<String> command, Path workingDir,
            List<TrainingExample> examples, TrainingOptions options) {
        final String outputDir = options.outputDir() != null
            ? options.outputDir()
            : Paths.get("tmp", profile.id() + "_finetuned").toString();

        Path trainFile = null;
        try {
            trainFile = Files.createTempFile("harvest-train-", ".json");
            objectMapper.writeValue(trainFile.toFile(), examples);

            final List<String> fullCommand = new ArrayList<>(command);
            fullCommand.addAll(List.of(
                "--train_file", trainFile.toString(),
                "--output_dir", outputDir,
                "--num_epochs", String.valueOf(options.epochs()),
                "--batch_size", String.valueOf(options.batchSize())));

            final ProcessResult result = processRunner.run(fullCommand, workingDir, TRAINING_TIMEOUT);
            if (!result.succeeded()) {
                return TrainingResult.failed("Training script exited with code " + result.exitCode()
                    + ": " + ExternalProcessRunner.truncate(result.output()));
            }

            LOG.infof("Training for profile %s wrote model to %s", profile.id(), outputDir);
            return TrainingResult.success(outputDir, Map.of(
                "epochs", options.epochs(),
                "batch_size", options.batchSize(),
                "examples", examples.size()));
        } catch (IOException e) {
            return TrainingResult.failed("Could not write training data: " + e.getMessage());
        } catch (ExtractionRuntimeException e) {
            LOG.errorf("Training for profile %s failed: %s", profile.id(), e.getMessage());
            return TrainingResult.failed(e.getMessage());
        } finally {
            if (trainFile != null) {
                try {
                    Files.deleteIfExists(trainFile);
                } catch (IOException e) {
                    LOG.debugf("Could not delete %s: %s", trainFile, e.getMessage());
                }
            }
        }
    }

    /**
     * Splits a configured command line on whitespace.
     */
    public static List<String> parseCommand(String commandLine) {
        return Arrays.stream(commandLine.trim().split("\\s+"))
            .filter(part -> !part.isEmpty())
            .toList();
    }
}
