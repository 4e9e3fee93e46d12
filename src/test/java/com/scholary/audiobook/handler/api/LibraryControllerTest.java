package com.scholary.audiobook.handler.api;

import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.scholary.audiobook.handler.auth.AuthException;
import com.scholary.audiobook.handler.catalog.Book;
import com.scholary.audiobook.handler.catalog.CatalogClient;
import com.scholary.audiobook.handler.catalog.LibraryService;
import com.scholary.audiobook.handler.catalog.LibrarySnapshot;
import com.scholary.audiobook.handler.catalog.Segment;
import com.scholary.audiobook.handler.objectstore.ObjectStoreException;
import java.net.URL;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class LibraryControllerTest {

  @Mock private LibraryService libraryService;
  @Mock private CatalogClient catalogClient;

  private MockMvc mockMvc;

  private final Book dune =
      new Book(
          "dune",
          "Dune",
          List.of(
              new Segment("audiobooks/dune/dune_segment_01.mp3", "Dune - Segment 01", 3600, 10),
              new Segment("audiobooks/dune/dune_segment_02.mp3", "Dune - Segment 02", 1800, 5)),
          "audiobooks/dune/dune_toc.json");

  @BeforeEach
  void setUp() {
    mockMvc =
        MockMvcBuilders.standaloneSetup(new LibraryController(libraryService, catalogClient))
            .build();
  }

  @Test
  void listBooks_shouldServeLoadedSnapshotWithoutRefreshing() throws Exception {
    when(libraryService.current()).thenReturn(new LibrarySnapshot(List.of(dune), Instant.now()));

    MvcResult result =
        mockMvc.perform(get("/api/books")).andExpect(request().asyncStarted()).andReturn();

    mockMvc
        .perform(asyncDispatch(result))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].id").value("dune"))
        .andExpect(jsonPath("$[0].segmentCount").value(2))
        .andExpect(jsonPath("$[0].totalDurationSeconds").value(5400.0));
    verify(libraryService, never()).refresh();
  }

  @Test
  void listBooks_shouldRefreshWhenAsked() throws Exception {
    when(libraryService.current()).thenReturn(LibrarySnapshot.EMPTY);
    when(libraryService.refresh())
        .thenReturn(
            CompletableFuture.completedFuture(new LibrarySnapshot(List.of(dune), Instant.now())));

    MvcResult result =
        mockMvc
            .perform(get("/api/books").param("refresh", "true"))
            .andExpect(request().asyncStarted())
            .andReturn();

    mockMvc
        .perform(asyncDispatch(result))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].displayName").value("Dune"));
  }

  @Test
  void listBooks_shouldReturn503WhenRefreshFails() throws Exception {
    when(libraryService.current()).thenReturn(LibrarySnapshot.EMPTY);
    when(libraryService.refresh())
        .thenReturn(CompletableFuture.failedFuture(new ObjectStoreException("down", null, true)));

    MvcResult result =
        mockMvc.perform(get("/api/books")).andExpect(request().asyncStarted()).andReturn();

    mockMvc.perform(asyncDispatch(result)).andExpect(status().isServiceUnavailable());
  }

  @Test
  void getBook_shouldReturnBookOrNotFound() throws Exception {
    when(catalogClient.findBook("dune")).thenReturn(Optional.of(dune));
    when(catalogClient.findBook("missing")).thenReturn(Optional.empty());

    mockMvc
        .perform(get("/api/books/dune"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.segments[1].fileId").value("audiobooks/dune/dune_segment_02.mp3"));
    mockMvc.perform(get("/api/books/missing")).andExpect(status().isNotFound());
  }

  @Test
  void getSegmentUrl_shouldPresignSegmentAtIndex() throws Exception {
    when(catalogClient.findBook("dune")).thenReturn(Optional.of(dune));
    when(catalogClient.resolvePlayableUrl("audiobooks/dune/dune_segment_02.mp3"))
        .thenReturn(new URL("http://localhost:9000/lib/dune_segment_02.mp3?sig=x"));

    mockMvc
        .perform(get("/api/books/dune/segments/1/url"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.displayName").value("Dune - Segment 02"))
        .andExpect(jsonPath("$.url").value("http://localhost:9000/lib/dune_segment_02.mp3?sig=x"));

    mockMvc.perform(get("/api/books/dune/segments/2/url")).andExpect(status().isNotFound());
  }

  @Test
  void getSegmentUrl_shouldReturn503WhenCredentialsUnavailable() throws Exception {
    when(catalogClient.findBook("dune")).thenThrow(new AuthException("backing off"));

    mockMvc.perform(get("/api/books/dune/segments/0/url")).andExpect(status().isServiceUnavailable());
  }
}
