package de.bsommerfeld.gamesync.updater.download;

import de.bsommerfeld.gamesync.updater.model.FileEntry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static de.bsommerfeld.gamesync.updater.TestTrees.file;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TransportTest {

    @TempDir
    Path dir;

    @Mock
    private FileFetcher http;

    // -- FileUrlResolver --

    @Test
    void under_shouldAppendRelativePath() {
        FileUrlResolver urls = FileUrlResolver.under(URI.create("https://cdn.example.com/client"));

        assertEquals(URI.create("https://cdn.example.com/client/lib/core.jar"), urls.resolve(file("lib/core.jar", "x")));
    }

    @Test
    void under_shouldEscapeEachSegment() {
        FileUrlResolver urls = FileUrlResolver.under(URI.create("https://cdn.example.com/client/"));

        assertEquals(URI.create("https://cdn.example.com/client/resource%20packs/a%23b%3F.zip"),
                urls.resolve(file("resource packs/a#b?.zip", "x")));
    }

    // -- LocalFileFetcher --

    @Test
    void localFetch_shouldCopyFile() throws IOException {
        Path source = Files.writeString(dir.resolve("src.txt"), "local mirror");
        Path target = dir.resolve("dst.txt");

        long written = new LocalFileFetcher().fetch(
                new FetchRequest(source.toUri(), target, null, new SessionControl()), DownloadProgressListener.NONE);

        assertEquals(12, written);
        assertEquals("local mirror", Files.readString(target));
    }

    @Test
    void localFetch_shouldRejectOtherSchemes() {
        assertThrows(IOException.class, () -> new LocalFileFetcher().fetchText(URI.create("https://x/y"), null));
    }

    @Test
    void localFetch_shouldResolveEscapedNames() throws IOException {
        Path mirror = Files.createDirectories(dir.resolve("mirror"));
        Files.writeString(mirror.resolve("a b#.txt"), "odd name");
        FileEntry entry = file("a b#.txt", "odd name");

        URI url = FileUrlResolver.under(mirror.toUri()).resolve(entry);

        assertEquals("odd name", new LocalFileFetcher().fetchText(url, null));
    }

    // -- SchemeRoutingFileFetcher --

    @Test
    void routing_shouldDispatchByScheme() throws IOException {
        when(http.schemes()).thenReturn(Set.of("http", "https"));
        when(http.fetchText(any(), any())).thenReturn("remote");
        SchemeRoutingFileFetcher routing = new SchemeRoutingFileFetcher(List.of(http, new LocalFileFetcher()));
        Path local = Files.writeString(dir.resolve("m.json"), "local");

        assertEquals("remote", routing.fetchText(URI.create("HTTPS://cdn/m.json"), "t"));
        assertEquals("local", routing.fetchText(local.toUri(), null));
        verify(http).fetchText(URI.create("HTTPS://cdn/m.json"), "t");
    }

    @Test
    void routing_shouldRejectUnknownScheme() {
        SchemeRoutingFileFetcher routing = new SchemeRoutingFileFetcher(List.of(new LocalFileFetcher()));

        assertThrows(IOException.class, () -> routing.fetchText(URI.create("ftp://host/file"), null));
        assertThrows(IOException.class, () -> routing.fetchText(URI.create("relative/path"), null));
    }
}
