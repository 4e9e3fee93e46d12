package com.scholary.audiobook.handler.api;

/** A presigned URL for one segment. */
public record SegmentUrlResponse(String fileId, String displayName, String url) {}
