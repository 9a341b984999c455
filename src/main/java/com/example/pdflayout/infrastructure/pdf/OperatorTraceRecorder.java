package com.example.pdflayout.infrastructure.pdf;

import com.example.pdflayout.domain.trace.TraceOperator;

import org.apache.pdfbox.contentstream.PDFStreamEngine;
import org.apache.pdfbox.contentstream.operator.DrawObject;
import org.apache.pdfbox.contentstream.operator.Operator;
import org.apache.pdfbox.contentstream.operator.OperatorName;
import org.apache.pdfbox.contentstream.operator.state.Concatenate;
import org.apache.pdfbox.contentstream.operator.state.Restore;
import org.apache.pdfbox.contentstream.operator.state.Save;
import org.apache.pdfbox.contentstream.operator.state.SetGraphicsStateParameters;
import org.apache.pdfbox.cos.COSBase;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDResources;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Replays a page's content stream and records every operator it executes.
 * {@code cm} entries carry the transformation matrix in effect after the operator; {@code Do} entries that
 * reference an image carry the XObject name. Form XObjects are descended into, so their operators appear
 * inline in the trace.
 */
public class OperatorTraceRecorder extends PDFStreamEngine {

    private final List<TraceOperator> operators = new ArrayList<>();
    private final Map<Integer, PDResources> paintResources = new HashMap<>();

    public OperatorTraceRecorder() {
        addOperator(new Save(this));
        addOperator(new Restore(this));
        addOperator(new Concatenate(this));
        addOperator(new SetGraphicsStateParameters(this));
        addOperator(new DrawObject(this));
    }

    /**
     * Records the operator trace of a page.
     *
     * @param page page to replay
     * @return trace in content stream order
     * @throws IOException when the content stream cannot be parsed
     */
    public RecordedTrace record(PDPage page) throws IOException {
        operators.clear();
        paintResources.clear();
        processPage(page);
        return new RecordedTrace(List.copyOf(operators), Map.copyOf(paintResources));
    }

    @Override
    protected void processOperator(Operator operator, List<COSBase> operands) throws IOException {
        String name = operator.getName();
        int index = operators.size();
        if (OperatorName.CONCAT.equals(name)) {
            super.processOperator(operator, operands);
            operators.add(TraceOperator.setTransform(index, name,
                    PdfBoxMatrices.toAffine(getGraphicsState().getCurrentTransformationMatrix())));
            return;
        }
        if (OperatorName.DRAW_OBJECT.equals(name) && isImageReference(operands)) {
            COSName objectName = (COSName) operands.get(0);
            operators.add(TraceOperator.paintImage(index, name, objectName.getName()));
            paintResources.put(index, getResources());
        } else {
            operators.add(TraceOperator.other(index, name));
        }
        super.processOperator(operator, operands);
    }

    private boolean isImageReference(List<COSBase> operands) {
        if (operands.isEmpty() || !(operands.get(0) instanceof COSName objectName)) {
            return false;
        }
        PDResources resources = getResources();
        return resources != null && resources.isImageXObject(objectName);
    }
}
