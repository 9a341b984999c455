package com.example.pdflayout.domain.trace;

/**
 * One entry of a page's drawing-operator trace.
 *
 * @param index        position in the trace
 * @param kind         role of the operator for layout purposes
 * @param name         raw operator name, e.g. {@code cm} or {@code Do}
 * @param transform    for {@link Kind#SET_TRANSFORM}, the transformation matrix in effect after the operator
 * @param resourceName for {@link Kind#PAINT_IMAGE}, the name of the referenced XObject
 */
public record TraceOperator(int index, Kind kind, String name, double[] transform, String resourceName) {

    public enum Kind {
        SET_TRANSFORM,
        PAINT_IMAGE,
        OTHER
    }

    public static TraceOperator setTransform(int index, String name, double[] transform) {
        return new TraceOperator(index, Kind.SET_TRANSFORM, name, transform, null);
    }

    public static TraceOperator paintImage(int index, String name, String resourceName) {
        return new TraceOperator(index, Kind.PAINT_IMAGE, name, null, resourceName);
    }

    public static TraceOperator other(int index, String name) {
        return new TraceOperator(index, Kind.OTHER, name, null, null);
    }
}
