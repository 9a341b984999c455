package com.example.pdflayout.domain.trace;

/**
 * An image-paint operator paired with the transform that places it.
 *
 * @param operatorIndex index of the paint operator in the trace
 * @param resourceName  referenced XObject name
 * @param transform     nearest preceding transform, identity when none precedes the paint
 */
public record ImagePaint(int operatorIndex, String resourceName, double[] transform) {
}
