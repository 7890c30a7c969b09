package com.seibun.backend.services.extraction;

import java.net.URI;
import java.util.Locale;

public enum SourceKind {
    PDF,
    HTML;

    /**
     * "pdf" / "html" pick explicitly; anything else ("auto", blank) looks at the URL path.
     */
    public static SourceKind resolve(String option, String url) {
        String o = option == null ? "" : option.trim().toLowerCase(Locale.ROOT);
        if (o.equals("pdf")) return PDF;
        if (o.equals("html")) return HTML;
        return fromUrl(url);
    }

    static SourceKind fromUrl(String url) {
        if (url == null || url.isBlank()) return PDF;
        String path;
        try {
            path = URI.create(url.trim()).getPath();
        } catch (IllegalArgumentException e) {
            path = url;
        }
        path = path == null ? "" : path.toLowerCase(Locale.ROOT);
        return path.endsWith(".pdf") ? PDF : HTML;
    }
}
