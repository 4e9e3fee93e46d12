package com.scholary.audiobook.handler.api;

import com.scholary.audiobook.handler.planning.TableOfContents;

/**
 * Response for plan preview.
 *
 * @param passThrough true when every file is used as its own segment
 */
public record PlanPreviewResponse(
    String bookId, boolean passThrough, int sourceFileCount, TableOfContents tableOfContents) {}
