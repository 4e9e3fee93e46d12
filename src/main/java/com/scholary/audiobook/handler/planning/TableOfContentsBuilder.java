package com.scholary.audiobook.handler.planning;

import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Derives the table of contents from a segment plan.
 *
 * <p>The TOC is never edited by hand: whenever the plan changes it is rebuilt from scratch. Start
 * offsets are the running sum of the preceding segment durations.
 */
@Component
public class TableOfContentsBuilder {

  public TableOfContents build(String bookTitle, List<SegmentPlan> plans) {
    String bookId = BookNames.slug(bookTitle);
    int total = plans.size();

    List<TableOfContents.Entry> entries = new ArrayList<>(total);
    double offset = 0;
    for (int i = 0; i < total; i++) {
      SegmentPlan plan = plans.get(i);
      int sequence = i + 1;
      entries.add(
          new TableOfContents.Entry(
              sequence,
              BookNames.segmentFileName(bookId, sequence, total, plan.audioExtension()),
              BookNames.segmentDisplayName(bookTitle, sequence, total),
              offset,
              plan.durationSeconds(),
              plan.sizeBytes(),
              plan.sourceIndices()));
      offset += plan.durationSeconds();
    }

    return new TableOfContents(bookId, bookTitle, total, offset, entries);
  }
}
