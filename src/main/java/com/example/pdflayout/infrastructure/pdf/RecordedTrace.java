package com.example.pdflayout.infrastructure.pdf;

import com.example.pdflayout.domain.trace.ImagePaint;
import com.example.pdflayout.domain.trace.TraceOperator;

import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.pdmodel.PDResources;
import org.apache.pdfbox.pdmodel.graphics.PDXObject;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Operator trace of one page plus the resource dictionaries that were current at each image paint,
 * so images can be resolved by name after the scan.
 */
public record RecordedTrace(List<TraceOperator> operators, Map<Integer, PDResources> paintResources) {

    /**
     * Resolves the raster object an image paint refers to.
     *
     * @param paint image paint produced from this trace
     * @return image XObject
     * @throws IOException when the object is missing, broken or not an image
     */
    public PDImageXObject resolveImage(ImagePaint paint) throws IOException {
        PDResources resources = paintResources.get(paint.operatorIndex());
        if (resources == null) {
            throw new IOException("No resources in scope for image " + paint.resourceName());
        }
        PDXObject xObject = resources.getXObject(COSName.getPDFName(paint.resourceName()));
        if (xObject instanceof PDImageXObject image) {
            return image;
        }
        throw new IOException("XObject " + paint.resourceName() + " is not an image");
    }
}
