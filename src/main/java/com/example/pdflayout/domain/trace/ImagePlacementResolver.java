package com.example.pdflayout.domain.trace;

import com.example.pdflayout.domain.geometry.LayoutGeometry;

import java.util.ArrayList;
import java.util.List;

/**
 * Pairs every image-paint operator of a trace with the transform that applies to it.
 * The nearest preceding transform-set operator wins; without one the identity transform is used.
 * <p>
 * The backward search is linear per image, so a page with many images costs O(operators^2) in the worst
 * case. Traces are bounded per page; an index of transform positions would make this O(n log n).
 */
public final class ImagePlacementResolver {

    private ImagePlacementResolver() {
    }

    /**
     * Scans the trace left to right and resolves the placement transform of each image paint.
     *
     * @param trace page operator trace in content stream order
     * @return image paints in trace order
     */
    public static List<ImagePaint> resolve(List<TraceOperator> trace) {
        List<ImagePaint> paints = new ArrayList<>();
        if (trace == null) {
            return paints;
        }
        int lastTransformIndex = -1;
        for (int i = 0; i < trace.size(); i++) {
            TraceOperator operator = trace.get(i);
            if (operator.kind() == TraceOperator.Kind.SET_TRANSFORM) {
                lastTransformIndex = i;
            } else if (operator.kind() == TraceOperator.Kind.PAINT_IMAGE) {
                double[] transform = lastTransformIndex < 0
                        ? LayoutGeometry.IDENTITY.clone()
                        : findPrecedingTransform(trace, i);
                paints.add(new ImagePaint(i, operator.resourceName(), transform));
            }
        }
        return paints;
    }

    /**
     * Walks backwards from {@code paintIndex} to the closest transform-set operator.
     *
     * @param trace      page operator trace
     * @param paintIndex index of the image-paint operator
     * @return copy of the transform, identity when none is found
     */
    static double[] findPrecedingTransform(List<TraceOperator> trace, int paintIndex) {
        for (int i = paintIndex - 1; i >= 0; i--) {
            TraceOperator candidate = trace.get(i);
            if (candidate.kind() == TraceOperator.Kind.SET_TRANSFORM && candidate.transform() != null) {
                return candidate.transform().clone();
            }
        }
        return LayoutGeometry.IDENTITY.clone();
    }
}
