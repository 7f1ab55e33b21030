package com.project.raster.segmentation.model;

import com.project.raster.segmentation.exceptions.ModelException;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.dnn.Dnn;
import org.opencv.dnn.Net;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Runs an ONNX network through the OpenCV DNN module, one forward pass per batch.
 */
public class OpenCvDnnBackend implements InferenceBackend {
    private static final Logger log = LoggerFactory.getLogger(OpenCvDnnBackend.class);

    private final Path modelPath;
    private final Net net;

    public OpenCvDnnBackend(Path modelPath) {
        OpenCvNatives.load();
        this.modelPath = modelPath;
        try {
            this.net = Dnn.readNetFromONNX(modelPath.toString());
        } catch (Exception e) {
            throw new ModelException("Failed to load ONNX model " + modelPath + ": " + e.getMessage(), e);
        }
        if (net.empty()) {
            throw new ModelException("ONNX model " + modelPath + " contains no layers");
        }
        log.info("Loaded ONNX model {}", modelPath);
    }

    @Override
    public synchronized float[][][][] run(float[][][][] input) {
        int batch = input.length;
        int channels = input[0].length;
        int height = input[0][0].length;
        int width = input[0][0][0].length;

        float[] flat = new float[batch * channels * height * width];
        int i = 0;
        for (float[][][] tile : input) {
            for (float[][] channel : tile) {
                for (float[] row : channel) {
                    System.arraycopy(row, 0, flat, i, width);
                    i += width;
                }
            }
        }

        Mat blob = new Mat(new int[]{batch, channels, height, width}, CvType.CV_32F);
        Mat output = null;
        try {
            blob.put(new int[]{0, 0, 0, 0}, flat);
            net.setInput(blob);
            output = net.forward();
            return unpack(output, batch);
        } catch (ModelException e) {
            throw e;
        } catch (Exception e) {
            throw new ModelException("Inference failed for " + modelPath + ": " + e.getMessage(), e);
        } finally {
            blob.release();
            if (output != null) {
                output.release();
            }
        }
    }

    private float[][][][] unpack(Mat output, int batch) {
        if (output.dims() != 4 || output.size(0) != batch) {
            throw new ModelException("Model " + modelPath + " returned an output of shape " + shape(output)
                    + ", expected [" + batch + ", K, S, S]");
        }
        int classes = output.size(1);
        int height = output.size(2);
        int width = output.size(3);

        float[] flat = new float[batch * classes * height * width];
        output.get(new int[]{0, 0, 0, 0}, flat);

        float[][][][] scores = new float[batch][classes][height][width];
        int i = 0;
        for (int b = 0; b < batch; b++) {
            for (int k = 0; k < classes; k++) {
                for (int r = 0; r < height; r++) {
                    System.arraycopy(flat, i, scores[b][k][r], 0, width);
                    i += width;
                }
            }
        }
        return scores;
    }

    private static String shape(Mat mat) {
        StringBuilder sb = new StringBuilder("[");
        for (int d = 0; d < mat.dims(); d++) {
            if (d > 0) {
                sb.append(", ");
            }
            sb.append(mat.size(d));
        }
        return sb.append(']').toString();
    }
}
