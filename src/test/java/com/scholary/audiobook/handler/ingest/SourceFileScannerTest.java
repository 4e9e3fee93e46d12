package com.scholary.audiobook.handler.ingest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.audiobook.handler.planning.InvalidSourceSetException;
import com.scholary.audiobook.handler.planning.SourceFile;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SourceFileScannerTest {

  @TempDir Path tempDir;

  private SourceFileScanner scanner;

  @BeforeEach
  void setUp() {
    scanner = new SourceFileScanner(100);
  }

  @Test
  void scan_shouldOrderAudioFilesByTrailingNumber() throws Exception {
    Files.write(tempDir.resolve("audio_10.mp3"), new byte[500]);
    Files.write(tempDir.resolve("audio_2.mp3"), new byte[300]);
    Files.write(tempDir.resolve("Book 1 Chapter 1.M4A"), new byte[200]);
    Files.writeString(tempDir.resolve("cover.jpg"), "not audio");

    List<SourceFile> files = scanner.scan(tempDir);

    assertThat(files).extracting(SourceFile::index).containsExactly(1, 2, 10);
    assertThat(files).extracting(SourceFile::name)
        .containsExactly("Book 1 Chapter 1.M4A", "audio_2.mp3", "audio_10.mp3");
    assertThat(files.get(2).sizeBytes()).isEqualTo(500);
    assertThat(files.get(2).durationSeconds()).isEqualTo(5.0);
  }

  @Test
  void scan_shouldRejectMissingDirectory() {
    assertThatThrownBy(() -> scanner.scan(tempDir.resolve("missing")))
        .isInstanceOf(InvalidSourceSetException.class)
        .hasMessageContaining("does not exist");
  }

  @Test
  void scan_shouldRejectUnnumberedAudioFile() throws Exception {
    Files.write(tempDir.resolve("intro.mp3"), new byte[10]);

    assertThatThrownBy(() -> scanner.scan(tempDir))
        .isInstanceOf(InvalidSourceSetException.class)
        .hasMessageContaining("intro.mp3");
  }

  @Test
  void indexOf_shouldIgnoreDigitsInExtension() {
    assertThat(SourceFileScanner.indexOf("track_07.mp3")).isEqualTo(7);
    assertThat(SourceFileScanner.indexOf("part 3 of 12.mp3")).isEqualTo(12);
  }
}
