package io.scanflow.core.data;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class DatasetTest {

    @Nested
    class CreationTest {

        @Test
        void shouldCreateScalarOfRankZero() {
            Dataset scalar = Dataset.scalar(7);

            assertThat(scalar.getRank()).isZero();
            assertThat(scalar.getSize()).isEqualTo(1);
            assertThat(scalar.get()).isEqualTo(7.0);
        }

        @Test
        void shouldRejectDataNotMatchingShape() {
            assertThatThrownBy(() -> Dataset.of(new int[] {2, 3}, new double[5]))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("[2, 3]");
        }

        @Test
        void shouldFillWithValue() {
            Dataset filled = Dataset.filled(new int[] {2, 2}, Double.NaN);

            assertThat(filled.getData()).containsOnly(Double.NaN);
        }

        @Test
        void shouldCreateIndexAxesByDefault() {
            Dataset dataset = Dataset.of(new int[] {3}, new double[] {1, 2, 3});

            assertThat(dataset.getAxis(0).range()).containsExactly(0.0, 1.0, 2.0);
            assertThat(dataset.getAxis(0).label()).isEmpty();
        }
    }

    @Nested
    class AccessTest {

        @Test
        void shouldAddressElementsInRowMajorOrder() {
            Dataset dataset = Dataset.of(new int[] {2, 3}, new double[] {0, 1, 2, 3, 4, 5});

            assertThat(dataset.get(0, 2)).isEqualTo(2.0);
            assertThat(dataset.get(1, 0)).isEqualTo(3.0);
        }

        @Test
        void shouldRejectIndexOutsideShape() {
            Dataset dataset = Dataset.of(1, 2);

            assertThatThrownBy(() -> dataset.get(2)).isInstanceOf(IndexOutOfBoundsException.class);
            assertThatThrownBy(() -> dataset.get(0, 0))
                    .isInstanceOf(IndexOutOfBoundsException.class);
        }

        @Test
        void shouldRejectAxisRangeOfWrongLength() {
            Dataset dataset = Dataset.of(1, 2, 3);

            assertThatThrownBy(
                            () -> dataset.withAxis(0, new AxisMetadata("q", "nm^-1", new double[2])))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    class CopyTest {

        @Test
        void shouldCopyIndependently() {
            // Given
            Dataset original =
                    Dataset.of(1, 2, 3)
                            .withAxis(0, new AxisMetadata("q", "nm^-1", new double[] {1, 2, 3}))
                            .withDataLabel("I", "counts");

            // When
            Dataset copy = original.copy();
            copy.set(99, 0);

            // Then
            assertThat(original.get(0)).isEqualTo(1.0);
            assertThat(copy.getAxis(0)).isEqualTo(original.getAxis(0));
            assertThat(copy.getDataLabel()).isEqualTo("I");
        }

        @Test
        void shouldTreatNaNAsEqual() {
            Dataset first = Dataset.of(Double.NaN, 1);
            Dataset second = Dataset.of(Double.NaN, 1);

            assertThat(first).isEqualTo(second);
            assertThat(first.hashCode()).isEqualTo(second.hashCode());
        }
    }
}
