package com.sol2clarity.output;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.sol2clarity.exception.OutputException;
import com.sol2clarity.model.output.GeneratedFile;
import com.sol2clarity.util.FileWriteUtil;

/**
 * Writes generated units below an output directory, overwriting existing files.
 */
public class GeneratedFileWriter {

    private static final Logger log = LoggerFactory.getLogger(GeneratedFileWriter.class);

    /**
     * @return the written paths, in the order of {@code files}
     * @throws OutputException naming the first path that could not be written
     */
    public List<Path> writeAll(List<GeneratedFile> files, Path outputDir) {
        List<Path> written = new ArrayList<>();
        for (GeneratedFile file : files) {
            written.add(write(file, outputDir));
        }
        return written;
    }

    public Path write(GeneratedFile file, Path outputDir) {
        Path target = outputDir.resolve(file.getFileName());
        try {
            FileWriteUtil.safeWriteString(target, file.getContents());
        } catch (IOException e) {
            throw new OutputException(target, e);
        }
        log.info("Wrote {}", target);
        return target;
    }
}
