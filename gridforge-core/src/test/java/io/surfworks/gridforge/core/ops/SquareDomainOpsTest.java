package io.surfworks.gridforge.core.ops;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import io.surfworks.gridforge.core.error.ConfigurationException;
import io.surfworks.gridforge.core.error.ShapeException;
import io.surfworks.gridforge.core.field.Field;
import io.surfworks.gridforge.core.field.FieldLayout;
import io.surfworks.gridforge.core.metadata.GridBounds;
import io.surfworks.gridforge.core.metadata.Metadata;
import io.surfworks.gridforge.core.metadata.SquareMethod;
import io.surfworks.gridforge.core.metadata.Squared;
import io.surfworks.gridforge.core.metadata.Unmodified;
import io.surfworks.gridforge.core.metadata.YOrigin;
import io.surfworks.gridforge.core.testing.FieldAssert;
import io.surfworks.gridforge.core.testing.ToleranceConfig;

/**
 * Tests for square-domain normalization and its inverse.
 */
@DisplayName("SquareDomainOps")
class SquareDomainOpsTest {

    /** Field of the given shape holding 1, 2, 3, ... so its minimum is 1. */
    private static Field counting(int... shape) {
        int count = 1;
        for (int dim : shape) {
            count *= dim;
        }
        double[] data = new double[count];
        for (int i = 0; i < count; i++) {
            data[i] = i + 1;
        }
        return Field.of(data, shape);
    }

    private static Metadata metadata(int rows, int cols) {
        return Metadata.builder()
                .unit("mm/h")
                .pixelSize(1, 1)
                .bounds(new GridBounds(0, cols, 0, rows))
                .zerovalue(0.0)
                .build();
    }

    @Nested
    @DisplayName("Pad")
    class Pad {

        @Test
        @DisplayName("square field is returned unchanged")
        void alreadySquare() {
            Field field = counting(4, 10, 10);
            Metadata metadata = metadata(10, 10);
            GriddedField result = SquareDomainOps.square(field, metadata, SquareMethod.PAD);
            assertEquals(field, result.field());
            assertSame(Unmodified.INSTANCE, result.metadata().domainState());
            assertEquals(metadata, result.metadata());
        }

        @Test
        @DisplayName("(4, 6, 10) becomes (4, 10, 10) with 2-row bands of the minimum")
        void padsShortAxis() {
            Field field = counting(4, 6, 10);
            GriddedField result = SquareDomainOps.square(field, metadata(6, 10), SquareMethod.PAD);

            Field squared = result.field();
            assertArrayEquals(new int[]{4, 10, 10}, squared.shape());
            for (int t = 0; t < 4; t++) {
                for (int x = 0; x < 10; x++) {
                    assertEquals(1.0, squared.get(t, 0, x));
                    assertEquals(1.0, squared.get(t, 1, x));
                    assertEquals(1.0, squared.get(t, 8, x));
                    assertEquals(1.0, squared.get(t, 9, x));
                    for (int y = 0; y < 6; y++) {
                        assertEquals(field.get(t, y, x), squared.get(t, y + 2, x));
                    }
                }
            }
            assertEquals(new Squared(SquareMethod.PAD, 6, 10), result.metadata().domainState());
        }

        @Test
        @DisplayName("padded bounds grow by the band width on each side")
        void padBounds() {
            GriddedField result = SquareDomainOps.square(counting(4, 6, 10), metadata(6, 10), SquareMethod.PAD);
            assertEquals(new GridBounds(0, 10, -2, 8), result.metadata().bounds());
        }

        @Test
        @DisplayName("padding the x axis of a tall field")
        void padsColumns() {
            GriddedField result = SquareDomainOps.square(counting(6, 4), metadata(6, 4), SquareMethod.PAD);
            assertArrayEquals(new int[]{6, 6}, result.field().shape());
            assertEquals(FieldLayout.PLAIN_2D, result.field().layout());
            assertEquals(1.0, result.field().get(5, 0));
            assertEquals(4.0, result.field().get(0, 4));
            assertEquals(new GridBounds(-1, 5, 0, 6), result.metadata().bounds());
        }

        @Test
        @DisplayName("odd difference puts the extra band at the end")
        void oddDifference() {
            GriddedField result = SquareDomainOps.square(counting(5, 8), metadata(5, 8), SquareMethod.PAD);
            Field squared = result.field();
            assertArrayEquals(new int[]{8, 8}, squared.shape());
            assertEquals(1.0, squared.get(1, 0));
            assertEquals(40.0, squared.get(5, 7));
            assertEquals(1.0, squared.get(6, 7));
            // upper origin: row 0 side is y2
            assertEquals(new GridBounds(0, 8, -2, 6), result.metadata().bounds());
        }

        @Test
        @DisplayName("lower origin extends y1 by the leading band")
        void lowerOriginBounds() {
            Metadata metadata = metadata(5, 8).toBuilder().yorigin(YOrigin.LOWER).build();
            GriddedField result = SquareDomainOps.square(counting(5, 8), metadata, SquareMethod.PAD);
            assertEquals(new GridBounds(0, 8, -1, 7), result.metadata().bounds());
        }

        @Test
        @DisplayName("fill value ignores NaN")
        void fillIgnoresNaN() {
            Field field = Field.of(new double[]{Double.NaN, 3, 2, 5}, 1, 4);
            GriddedField result = SquareDomainOps.square(field, metadata(1, 4), SquareMethod.PAD);
            assertEquals(2.0, result.field().get(0, 0));
            assertEquals(2.0, result.field().get(3, 3));
        }

        @Test
        @DisplayName("metadata without bounds keeps none")
        void noBounds() {
            Metadata metadata = Metadata.builder().build();
            GriddedField result = SquareDomainOps.square(counting(2, 4), metadata, SquareMethod.PAD);
            assertNull(result.metadata().bounds());
            assertArrayEquals(new int[]{4, 4}, result.field().shape());
        }
    }

    @Nested
    @DisplayName("Crop")
    class Crop {

        @Test
        @DisplayName("(4, 6, 10) becomes (4, 6, 6) keeping the central columns")
        void cropsLongAxis() {
            Field field = counting(4, 6, 10);
            GriddedField result = SquareDomainOps.square(field, metadata(6, 10), SquareMethod.CROP);
            assertArrayEquals(new int[]{4, 6, 6}, result.field().shape());
            assertEquals(field.get(3, 5, 2), result.field().get(3, 5, 0));
            assertEquals(field.get(0, 0, 7), result.field().get(0, 0, 5));
            assertEquals(new GridBounds(2, 8, 0, 6), result.metadata().bounds());
            assertEquals(new Squared(SquareMethod.CROP, 6, 10), result.metadata().domainState());
        }

        @Test
        @DisplayName("tall (10, 6) field loses two rows at each end and its y bounds shrink")
        void cropsTallField() {
            Field field = counting(10, 6);
            GriddedField result = SquareDomainOps.square(field, metadata(10, 6), SquareMethod.CROP);
            assertArrayEquals(new int[]{6, 6}, result.field().shape());
            assertEquals(13.0, result.field().get(0, 0));
            assertEquals(field.get(7, 5), result.field().get(5, 5));
            // upper origin: the leading band comes off y2, the trailing band off y1
            assertEquals(new GridBounds(0, 6, 2, 8), result.metadata().bounds());
        }
    }

    @Nested
    @DisplayName("Inverse")
    class Inverse {

        @Test
        @DisplayName("pad then inverse restores field and bounds exactly")
        void padRoundTrip() {
            Field field = counting(2, 3, 6, 10);
            Metadata metadata = metadata(6, 10);
            GriddedField squared = SquareDomainOps.square(field, metadata, SquareMethod.PAD);
            GriddedField restored = SquareDomainOps.inverse(squared);

            FieldAssert.assertEquals(field, restored.field(), ToleranceConfig.forOp("square-domain-inverse"));
            assertEquals(metadata, restored.metadata());
        }

        @Test
        @DisplayName("odd pad then inverse restores the field")
        void oddPadRoundTrip() {
            Field field = counting(5, 8);
            GriddedField squared = SquareDomainOps.square(field, metadata(5, 8), SquareMethod.PAD);
            GriddedField restored = SquareDomainOps.inverse(squared);
            assertEquals(field, restored.field());
            assertEquals(new GridBounds(0, 8, 0, 5), restored.metadata().bounds());
        }

        @Test
        @DisplayName("crop then inverse restores the shape with zeros in the cropped bands")
        void cropRoundTrip() {
            Field field = counting(4, 6, 10);
            Metadata metadata = metadata(6, 10);
            GriddedField cropped = SquareDomainOps.square(field, metadata, SquareMethod.CROP);
            GriddedField restored = SquareDomainOps.inverse(cropped);

            Field out = restored.field();
            assertArrayEquals(new int[]{4, 6, 10}, out.shape());
            for (int t = 0; t < 4; t++) {
                for (int y = 0; y < 6; y++) {
                    for (int x = 0; x < 10; x++) {
                        double expected = x < 2 || x >= 8 ? 0.0 : field.get(t, y, x);
                        assertEquals(expected, out.get(t, y, x));
                    }
                }
            }
            assertEquals(metadata.bounds(), restored.metadata().bounds());
            assertSame(Unmodified.INSTANCE, restored.metadata().domainState());
        }

        @Test
        @DisplayName("inverse without a recorded square domain is a configuration error")
        void inverseWithoutState() {
            assertThrows(ConfigurationException.class,
                () -> SquareDomainOps.inverse(counting(4, 4), metadata(4, 4)));
        }

        @Test
        @DisplayName("inverse of a field already at its original shape only consumes the state")
        void inverseAtOriginalShape() {
            Field field = counting(6, 10);
            Metadata metadata = metadata(6, 10).toBuilder()
                    .domainState(new Squared(SquareMethod.PAD, 6, 10))
                    .build();
            GriddedField result = SquareDomainOps.inverse(field, metadata);
            assertEquals(field, result.field());
            assertSame(Unmodified.INSTANCE, result.metadata().domainState());
            assertEquals(metadata.bounds(), result.metadata().bounds());
        }

        @Test
        @DisplayName("both axes differing from the original is a shape error")
        void bothAxesDiffer() {
            Metadata metadata = metadata(8, 8).toBuilder()
                    .domainState(new Squared(SquareMethod.PAD, 6, 10))
                    .build();
            assertThrows(ShapeException.class, () -> SquareDomainOps.inverse(counting(8, 8), metadata));
        }

        @Test
        @DisplayName("pad inverse of a field smaller than the original is a shape error")
        void padInverseWrongDirection() {
            Metadata metadata = metadata(4, 10).toBuilder()
                    .domainState(new Squared(SquareMethod.PAD, 6, 10))
                    .build();
            assertThrows(ShapeException.class, () -> SquareDomainOps.inverse(counting(4, 10), metadata));
        }

        @Test
        @DisplayName("tall crop then inverse restores the y bounds and zeroes the cropped rows")
        void tallCropRoundTrip() {
            Field field = counting(10, 6);
            GriddedField cropped = SquareDomainOps.square(field, metadata(10, 6), SquareMethod.CROP);
            GriddedField restored = SquareDomainOps.inverse(cropped);

            Field out = restored.field();
            assertArrayEquals(new int[]{10, 6}, out.shape());
            for (int x = 0; x < 6; x++) {
                assertEquals(0.0, out.get(1, x));
                assertEquals(0.0, out.get(8, x));
                assertEquals(field.get(2, x), out.get(2, x));
            }
            assertEquals(new GridBounds(0, 6, 0, 10), restored.metadata().bounds());
        }

        @Test
        @DisplayName("crop inverse of a field larger than the original is a shape error")
        void cropInverseWrongDirection() {
            Metadata metadata = metadata(8, 10).toBuilder()
                    .domainState(new Squared(SquareMethod.CROP, 6, 10))
                    .build();
            assertThrows(ShapeException.class, () -> SquareDomainOps.inverse(counting(8, 10), metadata));
        }
    }

    @Nested
    @DisplayName("Method selection")
    class MethodSelection {

        @Test
        @DisplayName("apply selects the method by name")
        void applyByName() {
            GriddedField padded = SquareDomainOps.apply(counting(6, 10), metadata(6, 10), "pad", false);
            GriddedField cropped = SquareDomainOps.apply(counting(6, 10), metadata(6, 10), "CROP", false);
            assertArrayEquals(new int[]{10, 10}, padded.field().shape());
            assertArrayEquals(new int[]{6, 6}, cropped.field().shape());
        }

        @Test
        @DisplayName("apply with inverse uses the recorded method")
        void applyInverse() {
            GriddedField cropped = SquareDomainOps.apply(counting(6, 10), metadata(6, 10), "crop", false);
            GriddedField restored = SquareDomainOps.apply(cropped.field(), cropped.metadata(), "pad", true);
            assertArrayEquals(new int[]{6, 10}, restored.field().shape());
            assertEquals(0.0, restored.field().get(0, 0));
        }

        @Test
        @DisplayName("unknown method name is a configuration error")
        void unknownMethod() {
            assertThrows(ConfigurationException.class,
                () -> SquareDomainOps.apply(counting(6, 10), metadata(6, 10), "stretch", false));
        }
    }
}
