package com.speculum.archiver.crawl.handler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.speculum.archiver.crawl.model.CatalogItem;
import com.speculum.archiver.crawl.persistence.CrawlJobRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class VideoSidecarScannerTest {

    @TempDir
    Path channelDir;

    @Mock
    private CrawlJobRepository repository;

    @Test
    void catalogsEachVideoFromItsSidecar() throws IOException {
        Path video = Files.createDirectories(channelDir.resolve("abc123"));
        Files.writeString(video.resolve("My_Title [abc123].info.json"), """
            {"id": "abc123", "title": "My Title", "description": "About it",
             "duration": 61.4, "upload_date": "20240215", "_type": "video"}
            """);
        Files.write(video.resolve("My_Title [abc123].mp4"), new byte[1234]);
        Files.write(video.resolve("My_Title [abc123].jpg"), new byte[10]);
        when(repository.upsertCatalogItem(eq(5L), eq(50L), any())).thenReturn(true);

        int inserted = new VideoSidecarScanner(new ObjectMapper(), repository).scan(5L, 50L, channelDir);

        assertEquals(1, inserted);
        ArgumentCaptor<CatalogItem> item = ArgumentCaptor.forClass(CatalogItem.class);
        verify(repository).upsertCatalogItem(eq(5L), eq(50L), item.capture());
        assertEquals("abc123", item.getValue().itemId());
        assertEquals("My Title", item.getValue().title());
        assertEquals("About it", item.getValue().description());
        assertEquals(61, item.getValue().durationSeconds());
        assertEquals(LocalDate.of(2024, 2, 15), item.getValue().uploadDate());
        assertEquals("My_Title [abc123].mp4", item.getValue().filename());
        assertEquals("My_Title [abc123].jpg", item.getValue().thumbnailFilename());
        assertEquals(1234L, item.getValue().sizeBytes());
    }

    @Test
    void alreadyCatalogedItemsAreNotCounted() throws IOException {
        Path video = Files.createDirectories(channelDir.resolve("old"));
        Files.writeString(video.resolve("Old [old].info.json"), "{\"id\": \"old\", \"title\": \"Old\"}");
        when(repository.upsertCatalogItem(eq(5L), eq(51L), any())).thenReturn(false);

        assertEquals(0, new VideoSidecarScanner(new ObjectMapper(), repository).scan(5L, 51L, channelDir));
    }

    @Test
    void playlistSidecarsAndBrokenJsonAreSkipped() throws IOException {
        Path playlist = Files.createDirectories(channelDir.resolve("UC1"));
        Files.writeString(playlist.resolve("Channel [UC1].info.json"), "{\"id\": \"UC1\", \"_type\": \"playlist\"}");
        Path broken = Files.createDirectories(channelDir.resolve("bad"));
        Files.writeString(broken.resolve("Bad [bad].info.json"), "{oops");

        assertEquals(0, new VideoSidecarScanner(new ObjectMapper(), repository).scan(5L, null, channelDir));
        verify(repository, never()).upsertCatalogItem(anyLong(), any(), any());
    }

    @Test
    void missingIdFallsBackToDirectoryName() throws IOException {
        Path video = Files.createDirectories(channelDir.resolve("xyz"));
        Path sidecar = video.resolve("Untitled.info.json");
        Files.writeString(sidecar, "{\"title\": \"Untitled\", \"upload_date\": \"garbage\"}");

        CatalogItem item = new VideoSidecarScanner(new ObjectMapper(), repository)
            .readItem(sidecar, video, List.of(sidecar));

        assertEquals("xyz", item.itemId());
        assertNull(item.uploadDate());
        assertNull(item.filename());
        assertNull(item.durationSeconds());
    }
}
