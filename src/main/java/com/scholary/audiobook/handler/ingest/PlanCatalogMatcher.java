package com.scholary.audiobook.handler.ingest;

import com.scholary.audiobook.handler.catalog.Book;
import com.scholary.audiobook.handler.config.IngestionProperties;
import com.scholary.audiobook.handler.planning.SegmentPlan;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Decides whether a book already in the library matches a freshly computed plan.
 *
 * <p>A match means the same number of segments and every segment within the size tolerance of its
 * planned size. Sizes drift slightly when a concatenation rewrites container headers, hence the
 * tolerance instead of an exact comparison.
 */
@Component
public class PlanCatalogMatcher {

  private static final Logger LOGGER = LoggerFactory.getLogger(PlanCatalogMatcher.class);

  private final double tolerance;

  @Autowired
  public PlanCatalogMatcher(IngestionProperties properties) {
    this(properties.segmenting().reprocessSizeTolerance());
  }

  public PlanCatalogMatcher(double tolerance) {
    if (tolerance < 0) {
      throw new IllegalArgumentException("Tolerance cannot be negative");
    }
    this.tolerance = tolerance;
  }

  public boolean matches(List<SegmentPlan> plans, Book existing) {
    if (plans.size() != existing.segments().size()) {
      LOGGER.debug(
          "Segment count differs for {}: planned={}, stored={}",
          existing.id(),
          plans.size(),
          existing.segments().size());
      return false;
    }

    for (int i = 0; i < plans.size(); i++) {
      long planned = plans.get(i).sizeBytes();
      long stored = existing.segments().get(i).sizeBytes();
      if (Math.abs(stored - planned) > planned * tolerance) {
        LOGGER.debug(
            "Segment {} of {} differs in size: planned={}, stored={}",
            i + 1,
            existing.id(),
            planned,
            stored);
        return false;
      }
    }
    return true;
  }
}
