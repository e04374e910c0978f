package com.filmtools.contactsheet.core.format;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONTokener;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only table of the film formats a contact sheet can be laid out for.
 * <p>
 * The default catalog is parsed once from {@code film-formats.json} on the classpath and shared
 * by every consumer; catalogs are never mutated after construction.
 */
public final class FormatCatalog {
    static final String DEFAULT_RESOURCE = "film-formats.json";

    private final Map<String, FormatSpec> formats;

    private FormatCatalog(Map<String, FormatSpec> formats) {
        this.formats = Collections.unmodifiableMap(new LinkedHashMap<>(formats));
    }

    public static FormatCatalog defaultCatalog() {
        return DefaultHolder.INSTANCE;
    }

    /**
     * Parses a catalog document of the form {@code {"formats": [ {...}, ... ]}}.
     *
     * @throws IOException if the document is malformed or declares the same id twice
     */
    public static FormatCatalog fromJson(Reader reader) throws IOException {
        JSONObject root;
        try {
            root = new JSONObject(new JSONTokener(reader));
        } catch (JSONException e) {
            throw new IOException("Format catalog is not valid JSON: " + e.getMessage(), e);
        }
        JSONArray array = root.optJSONArray("formats");
        if (array == null) {
            throw new IOException("Format catalog is missing the 'formats' array.");
        }

        Map<String, FormatSpec> parsed = new LinkedHashMap<>();
        for (int i = 0; i < array.length(); i++) {
            JSONObject node = array.optJSONObject(i);
            if (node == null) {
                throw new IOException("Format entry " + i + " is not an object.");
            }
            FormatSpec spec = parseFormat(node, i);
            if (parsed.putIfAbsent(spec.id(), spec) != null) {
                throw new IOException("Duplicate format id in catalog: " + spec.id());
            }
        }
        return new FormatCatalog(parsed);
    }

    public FormatSpec getFormat(String id) {
        FormatSpec spec = id == null ? null : formats.get(id.trim());
        if (spec == null) {
            throw new UnknownFormatException(id);
        }
        return spec;
    }

    public boolean contains(String id) {
        return id != null && formats.containsKey(id.trim());
    }

    public List<FormatSpec> formats() {
        return List.copyOf(formats.values());
    }

    private static FormatSpec parseFormat(JSONObject node, int index) throws IOException {
        try {
            String id = node.getString("id");
            JSONArray aspect = node.getJSONArray("aspect");
            if (aspect.length() != 2) {
                throw new IOException("Format '" + id + "' must declare aspect as [width, height].");
            }
            Integer maxImages = node.has("maxImages") && !node.isNull("maxImages")
                ? node.getInt("maxImages")
                : null;
            return new FormatSpec(
                id,
                node.optString("name", id),
                aspect.getDouble(0),
                aspect.getDouble(1),
                node.getInt("imagesPerRow"),
                maxImages,
                Orientation.parse(node.getString("orientation")),
                node.optBoolean("forceRotation", false)
            );
        } catch (JSONException | IllegalArgumentException e) {
            throw new IOException("Invalid format entry " + index + ": " + e.getMessage(), e);
        }
    }

    private static final class DefaultHolder {
        private static final FormatCatalog INSTANCE = load();

        private static FormatCatalog load() {
            InputStream stream = FormatCatalog.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE);
            if (stream == null) {
                throw new IllegalStateException("Missing classpath resource " + DEFAULT_RESOURCE);
            }
            try (Reader reader = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
                return fromJson(reader);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to load " + DEFAULT_RESOURCE, e);
            }
        }
    }
}
