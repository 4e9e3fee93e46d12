package com.scholary.audiobook.handler.planning;

import com.scholary.audiobook.handler.config.IngestionProperties;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Decides how downloaded source files become playback segments.
 *
 * <p>Two outcomes are possible:
 *
 * <ol>
 *   <li>Every file already sits inside the segment bounds: each file passes through unchanged, so
 *       nothing has to be concatenated.
 *   <li>Otherwise files are accumulated greedily, in source order, into groups that never exceed
 *       the duration or size ceiling. A group is closed as soon as the next file would overflow it,
 *       even when the group is still shorter than the minimum. The last group is flushed as-is.
 * </ol>
 *
 * <p>Example with a 120s / 150MB ceiling and three 40s / 80MB files: file 1 opens a group, file 2
 * would bring it to 160MB so the group closes with file 1 alone, and so on. The result is three
 * single-file segments.
 *
 * <p>The planner is a pure function of its input: same files in, same grouping out.
 */
@Component
public class SegmentPlanner {

  private static final Logger LOGGER = LoggerFactory.getLogger(SegmentPlanner.class);

  private final SegmentLimits limits;

  @Autowired
  public SegmentPlanner(IngestionProperties properties) {
    this(properties.segmenting().toLimits());
  }

  public SegmentPlanner(SegmentLimits limits) {
    this.limits = limits;
  }

  public SegmentLimits limits() {
    return limits;
  }

  /**
   * Plan segments for a book.
   *
   * @param sourceFiles the downloaded files; ordered by index before planning
   * @return one plan entry per resulting segment, in playback order
   * @throws EmptySourceSetException if no files are given
   * @throws InvalidSourceSetException if indices repeat, sizes/durations are negative or not
   *     finite, or files of different formats would have to be combined
   * @throws OversizeSourceFileException if a single file exceeds the size ceiling on its own
   */
  public List<SegmentPlan> plan(List<SourceFile> sourceFiles) {
    List<SourceFile> ordered = validateAndOrder(sourceFiles);

    double averageDuration =
        ordered.stream().mapToDouble(SourceFile::durationSeconds).average().orElse(0);
    double averageSize = ordered.stream().mapToLong(SourceFile::sizeBytes).average().orElse(0);
    LOGGER.info(
        "Planning segments: files={}, avgDuration={}s, avgSize={} MB, limits=[{}s-{}s, {} MB]",
        ordered.size(),
        String.format("%.1f", averageDuration),
        String.format("%.1f", averageSize / 1024 / 1024),
        limits.minSegmentSeconds(),
        limits.maxSegmentSeconds(),
        limits.maxSegmentBytes() / 1024 / 1024);

    if (ordered.stream().allMatch(limits::fitsAsIs)) {
      LOGGER.info("All {} files fit the segment bounds, passing them through", ordered.size());
      return ordered.stream().<SegmentPlan>map(SegmentPlan.PassThrough::new).toList();
    }

    List<SegmentPlan> plans = combineGreedily(ordered);
    LOGGER.info("Combined {} files into {} segments", ordered.size(), plans.size());
    return plans;
  }

  private List<SegmentPlan> combineGreedily(List<SourceFile> ordered) {
    List<SegmentPlan> plans = new ArrayList<>();
    List<SourceFile> group = new ArrayList<>();
    double groupDuration = 0;
    long groupSize = 0;

    for (SourceFile file : ordered) {
      boolean fits =
          groupDuration + file.durationSeconds() <= limits.maxSegmentSeconds()
              && groupSize + file.sizeBytes() <= limits.maxSegmentBytes();

      if (!group.isEmpty() && !fits) {
        plans.add(combine(group));
        LOGGER.debug(
            "Closed segment {}: files={}, duration={}s, size={} bytes",
            plans.size(),
            group.size(),
            groupDuration,
            groupSize);
        group = new ArrayList<>();
        groupDuration = 0;
        groupSize = 0;
      }

      group.add(file);
      groupDuration += file.durationSeconds();
      groupSize += file.sizeBytes();
    }

    // Trailing remainder may be short
    plans.add(combine(group));
    return plans;
  }

  // Concatenation copies streams, so a group has to share one container format
  private SegmentPlan combine(List<SourceFile> group) {
    SourceFile first = group.get(0);
    String extension = BookNames.audioExtension(first.name());
    for (SourceFile file : group) {
      if (!extension.equals(BookNames.audioExtension(file.name()))) {
        throw new InvalidSourceSetException(
            "Cannot combine " + first.name() + " and " + file.name() + ": formats differ");
      }
    }
    return new SegmentPlan.Combine(group);
  }

  private List<SourceFile> validateAndOrder(List<SourceFile> sourceFiles) {
    if (sourceFiles == null || sourceFiles.isEmpty()) {
      throw new EmptySourceSetException();
    }

    Set<Integer> seen = new HashSet<>();
    for (SourceFile file : sourceFiles) {
      if (!seen.add(file.index())) {
        throw new InvalidSourceSetException("Duplicate source index: " + file.index());
      }
      if (file.sizeBytes() < 0 || file.durationSeconds() < 0) {
        throw new InvalidSourceSetException(
            "Source file " + file.name() + " has a negative size or duration");
      }
      if (!Double.isFinite(file.durationSeconds())) {
        throw new InvalidSourceSetException(
            "Source file " + file.name() + " has a non-finite duration");
      }
      if (file.sizeBytes() > limits.maxSegmentBytes()) {
        throw new OversizeSourceFileException(file, limits.maxSegmentBytes());
      }
    }

    return sourceFiles.stream().sorted(Comparator.comparingInt(SourceFile::index)).toList();
  }
}
