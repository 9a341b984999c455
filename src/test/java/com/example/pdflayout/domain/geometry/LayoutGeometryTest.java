package com.example.pdflayout.domain.geometry;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class LayoutGeometryTest {

    @ParameterizedTest
    @CsvSource({
            "0, 792",
            "700, 792",
            "-15.5, 100",
            "1234.567, 0.25",
            "1e6, 842"
    })
    void fromCanonicalYInvertsToCanonicalY(double y, double height) {
        double canonical = LayoutGeometry.toCanonicalY(y, height);

        assertThat(LayoutGeometry.fromCanonicalY(canonical, height, 0)).isCloseTo(y, within(1e-6));
    }

    @Test
    void toCanonicalYMeasuresFromTheTopEdge() {
        assertThat(LayoutGeometry.toCanonicalY(700, 792)).isEqualTo(92);
        assertThat(LayoutGeometry.fromCanonicalY(92, 792, 20)).isEqualTo(680);
    }

    @ParameterizedTest
    @ValueSource(doubles = {0.5, 1, 12, 300})
    void pureScaleTransformDecomposesIntoScaleAndTranslation(double scale) {
        Placement placement = LayoutGeometry.matrixToOrigin(new double[]{scale, 0, 0, scale, 10, 20}, 792);

        assertThat(placement.fallback()).isFalse();
        assertThat(placement.scaleX()).isCloseTo(scale, within(1e-9));
        assertThat(placement.scaleY()).isCloseTo(scale, within(1e-9));
        assertThat(placement.x()).isEqualTo(10);
        assertThat(placement.y()).isEqualTo(772);
    }

    @Test
    void rotatedTransformKeepsAxisLengths() {
        double angle = Math.toRadians(30);
        double[] transform = {
                12 * Math.cos(angle), 12 * Math.sin(angle),
                -8 * Math.sin(angle), 8 * Math.cos(angle),
                50, 60
        };

        Placement placement = LayoutGeometry.matrixToOrigin(transform, 100);

        assertThat(placement.scaleX()).isCloseTo(12, within(1e-9));
        assertThat(placement.scaleY()).isCloseTo(8, within(1e-9));
        assertThat(placement.y()).isEqualTo(40);
    }

    @Test
    void malformedTransformsFallBackToIdentityPlacement() {
        assertThat(LayoutGeometry.matrixToOrigin(null, 792).fallback()).isTrue();
        assertThat(LayoutGeometry.matrixToOrigin(new double[]{1, 0, 0}, 792).fallback()).isTrue();
        assertThat(LayoutGeometry.matrixToOrigin(new double[]{Double.NaN, 0, 0, 1, 0, 0}, 792).fallback()).isTrue();
        assertThat(LayoutGeometry.matrixToOrigin(new double[]{0, 0, 0, 5, 10, 10}, 792).fallback()).isTrue();

        Placement fallback = LayoutGeometry.matrixToOrigin(new double[]{1, 0, 0, 1, Double.POSITIVE_INFINITY, 0}, 792);
        assertThat(fallback.x()).isZero();
        assertThat(fallback.y()).isZero();
    }

    @Test
    void footprintOfUprightImageStartsAtItsTopEdge() {
        Footprint footprint = LayoutGeometry.unitSquareFootprint(new double[]{50, 0, 0, 25, 100, 200}, 792);

        assertThat(footprint.fallback()).isFalse();
        assertThat(footprint.x()).isEqualTo(100);
        assertThat(footprint.y()).isEqualTo(567);
        assertThat(footprint.width()).isEqualTo(50);
        assertThat(footprint.height()).isEqualTo(25);
    }

    @Test
    void footprintOfMirroredImageUsesTranslationAsTopEdge() {
        Footprint footprint = LayoutGeometry.unitSquareFootprint(new double[]{50, 0, 0, -25, 100, 225}, 792);

        assertThat(footprint.x()).isEqualTo(100);
        assertThat(footprint.y()).isEqualTo(567);
        assertThat(footprint.width()).isEqualTo(50);
        assertThat(footprint.height()).isEqualTo(25);
    }

    @Test
    void footprintOfQuarterTurnSwapsExtents() {
        Footprint footprint = LayoutGeometry.unitSquareFootprint(new double[]{0, 50, -25, 0, 125, 200}, 792);

        assertThat(footprint.x()).isEqualTo(100);
        assertThat(footprint.y()).isEqualTo(542);
        assertThat(footprint.width()).isEqualTo(25);
        assertThat(footprint.height()).isEqualTo(50);
    }

    @Test
    void footprintOfDegenerateTransformFallsBack() {
        assertThat(LayoutGeometry.unitSquareFootprint(new double[]{0, 0, 0, 0, 10, 10}, 792).fallback()).isTrue();
        assertThat(LayoutGeometry.unitSquareFootprint(null, 792).fallback()).isTrue();
    }
}
