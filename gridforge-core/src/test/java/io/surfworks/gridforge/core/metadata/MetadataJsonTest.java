package io.surfworks.gridforge.core.metadata;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.google.gson.JsonObject;

import io.surfworks.gridforge.core.error.ConfigurationException;

@DisplayName("MetadataJson")
class MetadataJsonTest {

    private static Metadata full() {
        return Metadata.builder()
                .unit("mm/h")
                .transform("dB")
                .threshold(0.1)
                .zerovalue(-15.0)
                .accutime(5.0)
                .timestamps(List.of(Instant.parse("2024-06-01T12:00:00Z"), Instant.parse("2024-06-01T12:05:00Z")))
                .leadtimes(List.of(5.0, 10.0))
                .pixelSize(1000, 1000)
                .bounds(new GridBounds(0, 700_000, -100_000, 665_000))
                .yorigin(YOrigin.LOWER)
                .projection("+proj=stere +lat_0=90")
                .domainState(new Squared(SquareMethod.PAD, 765, 700))
                .build();
    }

    @Nested
    @DisplayName("Writing")
    class Writing {

        @Test
        @DisplayName("uses the dictionary key names")
        void keyNames() {
            JsonObject json = MetadataJson.toJsonTree(full());
            assertEquals("mm/h", json.get("unit").getAsString());
            assertEquals(700_000.0, json.get("x2").getAsDouble());
            assertEquals(-100_000.0, json.get("y1").getAsDouble());
            assertEquals("lower", json.get("yorigin").getAsString());
            assertEquals("2024-06-01T12:05:00Z", json.getAsJsonArray("timestamps").get(1).getAsString());
        }

        @Test
        @DisplayName("a squared domain is written as orig_domain and square_method")
        void squaredDomain() {
            JsonObject json = MetadataJson.toJsonTree(full());
            assertEquals(765, json.getAsJsonArray("orig_domain").get(0).getAsInt());
            assertEquals(700, json.getAsJsonArray("orig_domain").get(1).getAsInt());
            assertEquals("pad", json.get("square_method").getAsString());
        }

        @Test
        @DisplayName("absent attributes are omitted")
        void absentOmitted() {
            JsonObject json = MetadataJson.toJsonTree(Metadata.builder().unit("mm").build());
            assertFalse(json.has("x1"));
            assertFalse(json.has("leadtimes"));
            assertFalse(json.has("timestamps"));
            assertFalse(json.has("orig_domain"));
            assertEquals("upper", json.get("yorigin").getAsString());
        }
    }

    @Nested
    @DisplayName("Reading")
    class Reading {

        @Test
        @DisplayName("written metadata reads back equal")
        void readsBack() {
            Metadata metadata = full();
            assertEquals(metadata, MetadataJson.fromJson(MetadataJson.toJson(metadata)));
        }

        @Test
        @DisplayName("NaN zerovalue survives")
        void nanZerovalue() {
            Metadata metadata = Metadata.builder().zerovalue(Double.NaN).build();
            Metadata read = MetadataJson.fromJson(MetadataJson.toJson(metadata));
            assertTrue(Double.isNaN(read.zerovalue()));
        }

        @Test
        @DisplayName("unknown keys are ignored and missing ones are absent")
        void unknownKeysIgnored() {
            Metadata metadata = MetadataJson.fromJson("{\"unit\": \"mm\", \"institution\": \"KNMI\"}");
            assertEquals("mm", metadata.unit());
            assertNull(metadata.bounds());
            assertNull(metadata.leadtimes());
            assertSame(Unmodified.INSTANCE, metadata.domainState());
        }

        @Test
        @DisplayName("square method is read case-insensitively")
        void squareMethodCase() {
            Metadata metadata = MetadataJson.fromJson("{\"orig_domain\": [6, 10], \"square_method\": \"CROP\"}");
            assertEquals(new Squared(SquareMethod.CROP, 6, 10), metadata.domainState());
        }
    }

    @Nested
    @DisplayName("Errors")
    class Errors {

        @Test
        @DisplayName("malformed JSON")
        void malformed() {
            ConfigurationException ex = assertThrows(ConfigurationException.class,
                () -> MetadataJson.fromJson("{\"unit\": "));
            assertEquals("metadata-json", ex.operation());
        }

        @Test
        @DisplayName("a JSON array is not metadata")
        void notAnObject() {
            assertThrows(ConfigurationException.class, () -> MetadataJson.fromJson("[1, 2]"));
        }

        @Test
        @DisplayName("orig_domain without square_method")
        void domainWithoutMethod() {
            assertThrows(ConfigurationException.class,
                () -> MetadataJson.fromJson("{\"orig_domain\": [6, 10]}"));
        }

        @Test
        @DisplayName("orig_domain with the wrong number of extents")
        void domainWrongLength() {
            assertThrows(ConfigurationException.class,
                () -> MetadataJson.fromJson("{\"orig_domain\": [6], \"square_method\": \"pad\"}"));
        }

        @Test
        @DisplayName("partial bounds")
        void partialBounds() {
            ConfigurationException ex = assertThrows(ConfigurationException.class,
                () -> MetadataJson.fromJson("{\"x1\": 0, \"x2\": 1, \"y1\": 0}"));
            assertTrue(ex.getMessage().contains("'y2'"));
        }

        @Test
        @DisplayName("value of the wrong type")
        void wrongType() {
            assertThrows(ConfigurationException.class,
                () -> MetadataJson.fromJson("{\"xpixelsize\": \"wide\"}"));
            assertThrows(ConfigurationException.class,
                () -> MetadataJson.fromJson("{\"timestamps\": [\"yesterday\"]}"));
        }

        @Test
        @DisplayName("unknown yorigin")
        void unknownYOrigin() {
            assertThrows(ConfigurationException.class,
                () -> MetadataJson.fromJson("{\"yorigin\": \"sideways\"}"));
        }
    }
}
