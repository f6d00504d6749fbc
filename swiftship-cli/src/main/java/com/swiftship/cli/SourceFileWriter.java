package com.swiftship.cli;

import com.swiftship.core.GeneratedSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes generated sources below an output directory.
 */
public class SourceFileWriter {

    private static final Logger log = LoggerFactory.getLogger(SourceFileWriter.class);

    /**
     * Writes one source file, creating the directory when needed.
     *
     * @param outputDir target directory
     * @param source generated source
     * @return path of the written file
     * @throws IllegalStateException if the directory or file cannot be written
     */
    public Path write(Path outputDir, GeneratedSource source) {
        try {
            Files.createDirectories(outputDir);
            log.debug("Output directory created/verified: {}", outputDir);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create output directory: " + outputDir, e);
        }

        Path target = outputDir.resolve(source.fileName());
        try {
            Files.writeString(target, source.content(), StandardCharsets.UTF_8);
            log.info("Wrote file: {} ({} bytes)", target, source.content().getBytes(StandardCharsets.UTF_8).length);
            return target;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write file: " + target, e);
        }
    }
}
