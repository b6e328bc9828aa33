package io.github.clickin.requestbuilder.spi;

import io.github.clickin.requestbuilder.core.Protocol;
import io.github.clickin.requestbuilder.core.RequestBuilderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Extension-table {@link MimeTypeResolver}.
 *
 * <p>For {@code archive.tar.gz} the lookup tries {@code .tar.gz} first, then {@code .gz}. Names
 * with no matching extension resolve to {@code application/octet-stream}. Extensions are matched
 * exactly as written in the table (case-sensitive).
 */
public final class MimeTypes implements MimeTypeResolver {
    private static final Logger log = LoggerFactory.getLogger(MimeTypes.class);

    private static final MimeTypes DEFAULTS = new MimeTypes(defaultTable());

    private final Map<String, String> byExtension;

    private MimeTypes(Map<String, String> byExtension) {
        this.byExtension = Map.copyOf(byExtension);
    }

    public static MimeTypes defaults() {
        return DEFAULTS;
    }

    /**
     * A resolver using only the given table.
     *
     * @param byExtension extension (with leading dot) to MIME type
     * @return a new resolver
     */
    public static MimeTypes of(Map<String, String> byExtension) {
        Objects.requireNonNull(byExtension, "byExtension");
        Map<String, String> table = new HashMap<>();
        byExtension.forEach((ext, type) -> table.put(checkExtension(ext), checkType(ext, type)));
        return new MimeTypes(table);
    }

    /**
     * A copy of this resolver with one extension added or replaced.
     *
     * @param extension extension with leading dot, e.g. {@code ".json"}
     * @param mimeType the MIME type
     * @return a new resolver
     */
    public MimeTypes with(String extension, String mimeType) {
        Map<String, String> table = new HashMap<>(byExtension);
        table.put(checkExtension(extension), checkType(extension, mimeType));
        return new MimeTypes(table);
    }

    @Override
    public String mimeTypeFor(String filename) {
        if (filename == null) return Protocol.CT_OCTET_STREAM;
        int dot = filename.indexOf('.');
        while (dot >= 0) {
            String type = byExtension.get(filename.substring(dot));
            if (type != null) return type;
            dot = filename.indexOf('.', dot + 1);
        }
        log.debug("No MIME type registered for '{}', using {}", filename, Protocol.CT_OCTET_STREAM);
        return Protocol.CT_OCTET_STREAM;
    }

    private static String checkExtension(String extension) {
        if (extension == null || extension.length() < 2 || extension.charAt(0) != '.') {
            throw new RequestBuilderException.InvalidMimeMapping("extension must start with '.': " + extension);
        }
        return extension;
    }

    private static String checkType(String extension, String mimeType) {
        if (mimeType == null || mimeType.isBlank()) {
            throw new RequestBuilderException.InvalidMimeMapping("missing MIME type for " + extension);
        }
        return mimeType;
    }

    private static Map<String, String> defaultTable() {
        Map<String, String> m = new HashMap<>();
        m.put(".asc", "text/plain");
        m.put(".asf", "video/x-ms-asf");
        m.put(".asx", "video/x-ms-asf");
        m.put(".avi", "video/x-msvideo");
        m.put(".bz2", "application/x-bzip");
        m.put(".c", "text/plain");
        m.put(".class", "application/octet-stream");
        m.put(".conf", "text/plain");
        m.put(".cpp", "text/plain");
        m.put(".css", "text/css");
        m.put(".cxx", "text/plain");
        m.put(".dtd", "text/xml");
        m.put(".dvi", "application/x-dvi");
        m.put(".gif", "image/gif");
        m.put(".gz", "application/x-gzip");
        m.put(".hs", "text/plain");
        m.put(".htm", "text/html");
        m.put(".html", "text/html");
        m.put(".ico", "image/x-icon");
        m.put(".jar", "application/x-java-archive");
        m.put(".jpeg", "image/jpeg");
        m.put(".jpg", "image/jpeg");
        m.put(".js", "text/javascript");
        m.put(".json", "application/json");
        m.put(".log", "text/plain");
        m.put(".m3u", "audio/x-mpegurl");
        m.put(".mov", "video/quicktime");
        m.put(".mp3", "audio/mpeg");
        m.put(".mpeg", "video/mpeg");
        m.put(".mpg", "video/mpeg");
        m.put(".ogg", "application/ogg");
        m.put(".pac", "application/x-ns-proxy-autoconfig");
        m.put(".pdf", "application/pdf");
        m.put(".png", "image/png");
        m.put(".ps", "application/postscript");
        m.put(".qt", "video/quicktime");
        m.put(".sig", "application/pgp-signature");
        m.put(".spl", "application/futuresplash");
        m.put(".svg", "image/svg+xml");
        m.put(".swf", "application/x-shockwave-flash");
        m.put(".tar", "application/x-tar");
        m.put(".tar.bz2", "application/x-bzip-compressed-tar");
        m.put(".tar.gz", "application/x-tgz");
        m.put(".tbz", "application/x-bzip-compressed-tar");
        m.put(".text", "text/plain");
        m.put(".tgz", "application/x-tgz");
        m.put(".torrent", "application/x-bittorrent");
        m.put(".txt", "text/plain");
        m.put(".wav", "audio/x-wav");
        m.put(".wax", "audio/x-ms-wax");
        m.put(".wma", "audio/x-ms-wma");
        m.put(".wmv", "video/x-ms-wmv");
        m.put(".xbm", "image/x-xbitmap");
        m.put(".xml", "text/xml");
        m.put(".xpm", "image/x-xpixmap");
        m.put(".xwd", "image/x-xwindowdump");
        m.put(".zip", "application/zip");
        return m;
    }
}
