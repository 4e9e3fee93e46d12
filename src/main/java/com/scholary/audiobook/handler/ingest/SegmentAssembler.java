package com.scholary.audiobook.handler.ingest;

import com.scholary.audiobook.handler.planning.SegmentPlan;
import com.scholary.audiobook.handler.planning.SourceFile;
import com.scholary.audiobook.handler.planning.TableOfContents;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes the planned segments to disk.
 *
 * <p>A pass-through segment is a plain copy of its source file. A combined segment is produced by
 * the {@link AudioConcatenator}; a combine group holding a single file is copied too, since there is
 * nothing to join. Output file names are taken from the table of contents, entry by entry.
 */
@Component
public class SegmentAssembler {

  private static final Logger LOGGER = LoggerFactory.getLogger(SegmentAssembler.class);

  private final AudioConcatenator concatenator;

  public SegmentAssembler(AudioConcatenator concatenator) {
    this.concatenator = concatenator;
  }

  /**
   * Materialize every segment into {@code outputDir}.
   *
   * @return the written files, in segment order
   * @throws IOException if copying or concatenation fails
   */
  public List<Path> assemble(
      Path sourceDir, List<SegmentPlan> plans, TableOfContents toc, Path outputDir)
      throws IOException {
    if (plans.size() != toc.segments().size()) {
      throw new IllegalArgumentException(
          "Plan has " + plans.size() + " segments but TOC has " + toc.segments().size());
    }

    Files.createDirectories(outputDir);
    List<Path> outputs = new ArrayList<>(plans.size());

    for (int i = 0; i < plans.size(); i++) {
      SegmentPlan plan = plans.get(i);
      Path output = outputDir.resolve(toc.segments().get(i).fileName());
      List<Path> inputs = plan.sources().stream().map(s -> resolve(sourceDir, s)).toList();

      if (inputs.size() == 1) {
        Files.copy(inputs.get(0), output, StandardCopyOption.REPLACE_EXISTING);
        LOGGER.debug("Copied {} to {}", inputs.get(0).getFileName(), output.getFileName());
      } else {
        concatenator.concatenate(inputs, output);
      }

      outputs.add(output);
      LOGGER.info(
          "Assembled segment {}/{}: {} ({} source files)",
          i + 1,
          plans.size(),
          output.getFileName(),
          inputs.size());
    }

    return outputs;
  }

  private Path resolve(Path sourceDir, SourceFile source) {
    return sourceDir.resolve(source.name());
  }
}
