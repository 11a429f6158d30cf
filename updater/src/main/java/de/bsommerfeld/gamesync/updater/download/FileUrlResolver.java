package de.bsommerfeld.gamesync.updater.download;

import com.google.common.escape.Escaper;
import com.google.common.net.UrlEscapers;
import de.bsommerfeld.gamesync.updater.model.FileEntry;

import java.net.URI;

/**
 * Maps a manifest file to the URL its bytes are served from.
 */
@FunctionalInterface
public interface FileUrlResolver {

    URI resolve(FileEntry entry);

    /**
     * Serves every file from {@code base/<relative path>}, escaping each path
     * segment separately.
     */
    static FileUrlResolver under(URI base) {
        String prefix = base.toString().endsWith("/") ? base.toString() : base + "/";
        Escaper escaper = UrlEscapers.urlPathSegmentEscaper();
        return entry -> {
            StringBuilder url = new StringBuilder(prefix);
            String[] segments = entry.relativePath().split("/");
            for (int i = 0; i < segments.length; i++) {
                if (i > 0)
                    url.append('/');
                url.append(escaper.escape(segments[i]));
            }
            return URI.create(url.toString());
        };
    }
}
