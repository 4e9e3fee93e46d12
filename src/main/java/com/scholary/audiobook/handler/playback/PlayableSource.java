package com.scholary.audiobook.handler.playback;

import java.net.URL;
import java.util.Map;

/** What the player needs to open a stream: where, and which headers to send. */
public record PlayableSource(URL url, Map<String, String> headers) {

  public PlayableSource {
    if (url == null) {
      throw new IllegalArgumentException("URL is required");
    }
    headers = headers == null ? Map.of() : Map.copyOf(headers);
  }
}
