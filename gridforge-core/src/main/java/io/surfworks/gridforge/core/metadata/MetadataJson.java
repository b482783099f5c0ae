package io.surfworks.gridforge.core.metadata;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import io.surfworks.gridforge.core.error.ConfigurationException;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON form of {@link Metadata}, used to hand the record to collaborators that
 * speak the nowcasting metadata dictionary (unit transforms, verification).
 *
 * <p>Keys follow the dictionary names: {@code unit}, {@code transform},
 * {@code threshold}, {@code zerovalue}, {@code accutime}, {@code timestamps}
 * (ISO-8601), {@code leadtimes}, {@code xpixelsize}, {@code ypixelsize},
 * {@code x1}, {@code x2}, {@code y1}, {@code y2}, {@code yorigin},
 * {@code projection}. A squared domain is written as {@code orig_domain}
 * ({@code [rows, cols]}) plus {@code square_method}. Absent attributes are
 * omitted and unknown keys are ignored when reading.
 */
public final class MetadataJson {

    private static final String OPERATION = "metadata-json";

    private static final Gson GSON = new GsonBuilder()
            .serializeSpecialFloatingPointValues()
            .create();

    private MetadataJson() {
        // Utility class
    }

    /**
     * Serialize metadata to a JSON string.
     */
    public static String toJson(Metadata metadata) {
        return GSON.toJson(toJsonTree(metadata));
    }

    /**
     * Build the JSON object for a metadata record.
     */
    public static JsonObject toJsonTree(Metadata metadata) {
        JsonObject json = new JsonObject();
        addIfPresent(json, "unit", metadata.unit());
        addIfPresent(json, "transform", metadata.transform());
        addIfPresent(json, "threshold", metadata.threshold());
        addIfPresent(json, "zerovalue", metadata.zerovalue());
        addIfPresent(json, "accutime", metadata.accutime());

        if (!metadata.timestamps().isEmpty()) {
            JsonArray timestamps = new JsonArray();
            for (Instant timestamp : metadata.timestamps()) {
                timestamps.add(timestamp.toString());
            }
            json.add("timestamps", timestamps);
        }
        if (metadata.hasLeadtimes()) {
            json.add("leadtimes", GSON.toJsonTree(metadata.leadtimes()));
        }

        addIfPresent(json, "xpixelsize", metadata.xpixelsize());
        addIfPresent(json, "ypixelsize", metadata.ypixelsize());
        GridBounds bounds = metadata.bounds();
        if (bounds != null) {
            json.addProperty("x1", bounds.x1());
            json.addProperty("x2", bounds.x2());
            json.addProperty("y1", bounds.y1());
            json.addProperty("y2", bounds.y2());
        }
        json.addProperty("yorigin", metadata.yorigin().key());
        addIfPresent(json, "projection", metadata.projection());

        if (metadata.domainState() instanceof Squared squared) {
            JsonArray origDomain = new JsonArray();
            origDomain.add(squared.originalRows());
            origDomain.add(squared.originalCols());
            json.add("orig_domain", origDomain);
            json.addProperty("square_method", squared.method().key());
        }
        return json;
    }

    /**
     * Parse metadata from a JSON string.
     *
     * @throws ConfigurationException if the text is not a JSON object or a value has the wrong type
     */
    public static Metadata fromJson(String json) {
        JsonElement element;
        try {
            element = JsonParser.parseString(json);
        } catch (JsonParseException e) {
            throw new ConfigurationException(OPERATION, "malformed metadata JSON", e);
        }
        if (!element.isJsonObject()) {
            throw new ConfigurationException(OPERATION, "metadata JSON must be an object");
        }
        return fromJsonTree(element.getAsJsonObject());
    }

    /**
     * Read a metadata record from a JSON object.
     *
     * @throws ConfigurationException if a value has the wrong type, or only one of
     *                                {@code orig_domain} and {@code square_method} is present
     */
    public static Metadata fromJsonTree(JsonObject json) {
        try {
            Metadata.Builder builder = Metadata.builder()
                    .unit(getString(json, "unit"))
                    .transform(getString(json, "transform"))
                    .threshold(getDouble(json, "threshold"))
                    .zerovalue(getDouble(json, "zerovalue"))
                    .accutime(getDouble(json, "accutime"))
                    .xpixelsize(getDouble(json, "xpixelsize"))
                    .ypixelsize(getDouble(json, "ypixelsize"))
                    .projection(getString(json, "projection"));

            if (json.has("timestamps")) {
                List<Instant> timestamps = new ArrayList<>();
                for (JsonElement timestamp : json.getAsJsonArray("timestamps")) {
                    timestamps.add(Instant.parse(timestamp.getAsString()));
                }
                builder.timestamps(timestamps);
            }
            if (json.has("leadtimes")) {
                List<Double> leadtimes = new ArrayList<>();
                for (JsonElement leadtime : json.getAsJsonArray("leadtimes")) {
                    leadtimes.add(leadtime.getAsDouble());
                }
                builder.leadtimes(leadtimes);
            }

            if (json.has("x1") || json.has("x2") || json.has("y1") || json.has("y2")) {
                builder.bounds(new GridBounds(
                        requireDouble(json, "x1"), requireDouble(json, "x2"),
                        requireDouble(json, "y1"), requireDouble(json, "y2")));
            }
            String yorigin = getString(json, "yorigin");
            if (yorigin != null) {
                builder.yorigin(YOrigin.fromKey(yorigin));
            }

            builder.domainState(readDomainState(json));
            return builder.build();
        } catch (IllegalStateException | ClassCastException | UnsupportedOperationException
                 | NumberFormatException | DateTimeParseException e) {
            throw new ConfigurationException(OPERATION, "invalid metadata value: " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(OPERATION, e.getMessage(), e);
        }
    }

    // ==================== Internal Helpers ====================

    private static DomainState readDomainState(JsonObject json) {
        boolean hasDomain = json.has("orig_domain");
        boolean hasMethod = json.has("square_method");
        if (!hasDomain && !hasMethod) {
            return Unmodified.INSTANCE;
        }
        if (hasDomain != hasMethod) {
            throw new ConfigurationException(OPERATION,
                    "'orig_domain' and 'square_method' must be present together");
        }
        JsonArray origDomain = json.getAsJsonArray("orig_domain");
        if (origDomain.size() != 2) {
            throw new ConfigurationException(OPERATION,
                    "'orig_domain' must hold two extents, got " + origDomain.size());
        }
        return new Squared(SquareMethod.fromKey(json.get("square_method").getAsString()),
                origDomain.get(0).getAsInt(), origDomain.get(1).getAsInt());
    }

    private static void addIfPresent(JsonObject json, String key, String value) {
        if (value != null) {
            json.addProperty(key, value);
        }
    }

    private static void addIfPresent(JsonObject json, String key, Double value) {
        if (value != null) {
            json.addProperty(key, value);
        }
    }

    private static String getString(JsonObject json, String key) {
        JsonElement element = json.get(key);
        return element == null || element.isJsonNull() ? null : element.getAsString();
    }

    private static Double getDouble(JsonObject json, String key) {
        JsonElement element = json.get(key);
        return element == null || element.isJsonNull() ? null : element.getAsDouble();
    }

    private static double requireDouble(JsonObject json, String key) {
        Double value = getDouble(json, key);
        if (value == null) {
            throw ConfigurationException.missingKey(OPERATION, key);
        }
        return value;
    }
}
