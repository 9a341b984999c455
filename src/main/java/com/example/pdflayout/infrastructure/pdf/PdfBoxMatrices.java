package com.example.pdflayout.infrastructure.pdf;

import org.apache.pdfbox.util.Matrix;

final class PdfBoxMatrices {

    private PdfBoxMatrices() {
    }

    /**
     * @param matrix PDFBox matrix
     * @return the six affine entries {@code [a b c d e f]}
     */
    static double[] toAffine(Matrix matrix) {
        return new double[]{
                matrix.getValue(0, 0),
                matrix.getValue(0, 1),
                matrix.getValue(1, 0),
                matrix.getValue(1, 1),
                matrix.getValue(2, 0),
                matrix.getValue(2, 1)
        };
    }
}
