package pro.javacard.webeid.common;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

// <scheme>://<host>[:<port>] of the relying party. Scheme and host are lowercased, as relying parties compare them.
public final class Origin {
    static final int MAX_LENGTH = 255;
    static final Set<String> SCHEMES = Set.of("https", "wss");

    private final String url;
    private final URI uri;

    private Origin(String url, URI uri) {
        this.url = url;
        this.uri = uri;
    }

    public static Origin valueOf(String origin) {
        Objects.requireNonNull(origin, "origin");
        if (origin.length() > MAX_LENGTH)
            throw new InputDataError(String.format("Origin argument 'origin' cannot be longer than %d characters", MAX_LENGTH));

        final URI uri;
        try {
            uri = new URI(origin);
        } catch (URISyntaxException e) {
            throw new InputDataError("Origin argument 'origin' is not a valid URL: " + e.getReason(), e);
        }
        if (!uri.isAbsolute() || uri.isOpaque() || uri.getHost() == null || uri.getRawUserInfo() != null
                || (uri.getRawPath() != null && !uri.getRawPath().isEmpty())
                || uri.getRawQuery() != null || uri.getRawFragment() != null) {
            throw new InputDataError("Origin argument 'origin' is not in <scheme>://<host>[:<port>] format");
        }
        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        if (!SCHEMES.contains(scheme))
            throw new InputDataError("Origin argument 'origin' scheme has to be https or wss");
        String url = scheme + "://" + uri.getHost().toLowerCase(Locale.ROOT) + (uri.getPort() == -1 ? "" : ":" + uri.getPort());
        return new Origin(url, uri);
    }

    public String url() {
        return url;
    }

    public String getHost() {
        return uri.getHost().toLowerCase(Locale.ROOT);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Origin)) return false;
        return url.equals(((Origin) o).url);
    }

    @Override
    public int hashCode() {
        return url.hashCode();
    }

    @Override
    public String toString() {
        return url;
    }
}
