package com.project.raster.segmentation.service;

import com.project.raster.segmentation.model.OpenCvNatives;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

/**
 * Median blur followed by a morphological opening and closing with a square kernel.
 * Either step is skipped when its kernel size is not above 1.
 */
public class OpenCvLabelFilter implements LabelFilter {

    private final int blurKernelSize;
    private final int morphKernelSize;

    public OpenCvLabelFilter(int blurKernelSize, int morphKernelSize) {
        this.blurKernelSize = blurKernelSize;
        this.morphKernelSize = morphKernelSize;
        if (blurKernelSize > 1 || morphKernelSize > 1) {
            OpenCvNatives.load();
        }
    }

    public static OpenCvLabelFilter of(ProcessingConfig config) {
        return new OpenCvLabelFilter(config.blurKernelSize(), config.morphKernelSize());
    }

    // Opening and closing each erode and dilate once, so the morphology radius counts four times.
    @Override
    public int reach() {
        int blurRadius = blurKernelSize > 1 ? (blurKernelSize - 1) / 2 : 0;
        int morphRadius = morphKernelSize > 1 ? (morphKernelSize - 1) / 2 : 0;
        return blurRadius + 4 * morphRadius;
    }

    @Override
    public byte[][] apply(byte[][] labels) {
        if (reach() == 0 || labels.length == 0) {
            return labels;
        }
        Mat mat = toMat(labels);
        try {
            if (blurKernelSize > 1) {
                Mat blurred = new Mat();
                Imgproc.medianBlur(mat, blurred, blurKernelSize);
                mat.release();
                mat = blurred;
            }
            if (morphKernelSize > 1) {
                Mat kernel = Imgproc.getStructuringElement(Imgproc.MORPH_RECT, new Size(morphKernelSize, morphKernelSize));
                Imgproc.morphologyEx(mat, mat, Imgproc.MORPH_OPEN, kernel, new Point(-1, -1), 1);
                Imgproc.morphologyEx(mat, mat, Imgproc.MORPH_CLOSE, kernel, new Point(-1, -1), 1);
                kernel.release();
            }
            return toLabels(mat, labels.length, labels[0].length);
        } finally {
            mat.release();
        }
    }

    private static Mat toMat(byte[][] labels) {
        int rows = labels.length;
        int cols = labels[0].length;
        byte[] data = new byte[rows * cols];
        for (int r = 0; r < rows; r++) {
            System.arraycopy(labels[r], 0, data, r * cols, cols);
        }
        Mat mat = new Mat(rows, cols, CvType.CV_8UC1);
        mat.put(0, 0, data);
        return mat;
    }

    private static byte[][] toLabels(Mat mat, int rows, int cols) {
        byte[] data = new byte[rows * cols];
        mat.get(0, 0, data);
        byte[][] labels = new byte[rows][cols];
        for (int r = 0; r < rows; r++) {
            System.arraycopy(data, r * cols, labels[r], 0, cols);
        }
        return labels;
    }
}
