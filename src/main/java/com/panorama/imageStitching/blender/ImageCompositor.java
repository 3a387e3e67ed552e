package com.panorama.imageStitching.blender;

import com.panorama.imageStitching.exception.InsufficientCorrespondenceException;
import com.panorama.imageStitching.exception.PanoramaException;
import com.panorama.imageStitching.matchAndTransform.CanvasExtent;
import com.panorama.imageStitching.matchAndTransform.ShiftEstimate;
import lombok.extern.slf4j.Slf4j;
import org.bytedeco.javacpp.indexer.UByteIndexer;
import org.bytedeco.opencv.opencv_core.*;

import java.util.List;

/**
 * Pastes projected images left to right on one canvas and cross-fades each seam.
 * <p>
 * For image i &gt; 0 with horizontal shift s from image i-1, the junction sits at
 * {@code (width - s) / 2} in the image's own coordinates and the cross-fade spans
 * {@code [junction - halfSpan, junction + halfSpan)} where
 * {@code halfSpan = round((width - s) * 0.6) - junction}. Columns left of the span keep
 * what is already on the canvas, columns right of it are overwritten.
 */
@Slf4j
public class ImageCompositor {
    // Nhân 0.6 thay vì chia 2 để chừa chỗ cho nội suy tuyến tính
    static final double PIECE_LEFT_RATIO = 0.6;

    private ImageCompositor() {
    }

    /**
     * Canvas size before the vertical crop.
     */
    public static Size canvasSize(int width, int height, CanvasExtent extent) {
        return new Size(width + extent.horizontalSpan(), height + extent.verticalSpan());
    }

    /**
     * @param materials Projected images in left-to-right order, all the same size and type
     * @param shifts    Shift of image i+1 relative to image i, one per adjacent pair
     * @param extent    Extent accumulated from {@code shifts}
     * @return The cropped panorama
     */
    public static Mat compose(List<Mat> materials, List<ShiftEstimate> shifts, CanvasExtent extent) {
        int n = materials.size();
        if (shifts.size() != n - 1) {
            throw new PanoramaException("Expected " + (n - 1) + " shifts for " + n + " images, got " + shifts.size());
        }
        Mat first = materials.get(0);
        int width = first.cols();
        int height = first.rows();
        int channels = first.channels();

        Size total = canvasSize(width, height, extent);
        int totalWidth = total.width();
        int totalHeight = total.height();
        int drift = extent.verticalSpan();
        if (totalHeight - 2 * drift <= 0) {
            throw new InsufficientCorrespondenceException(n - 2,
                    "vertical drift " + drift + " leaves nothing of height " + height + " after cropping");
        }
        log.debug("Canvas {}x{} for {} images of {}x{}", totalWidth, totalHeight, n, width, height);

        Mat canvas = new Mat(totalHeight, totalWidth, first.type(), Scalar.all(0));
        UByteIndexer canvasIdx = canvas.createIndexer();

        // Vị trí vẽ ảnh hiện tại
        int currX = -extent.getLeft();
        int currY = -extent.getUpper();

        for (int i = 0; i < n; i++) {
            Mat material = materials.get(i);
            int pieceLeft = 0;

            if (i > 0) {
                int shiftX = shifts.get(i - 1).getDx();
                if (shiftX < 0 || shiftX >= width) {
                    throw new InsufficientCorrespondenceException(i - 1,
                            "horizontal shift " + shiftX + " leaves no overlap for width " + width);
                }
                int overlap = width - shiftX;
                pieceLeft = (int) Math.round(overlap * PIECE_LEFT_RATIO);
                int junction = overlap / 2;
                int halfSpan = pieceLeft - junction;
                // Vùng blend phải nằm trọn trong ảnh: overlap dưới 3 px thì không blend được
                if (halfSpan <= 0 || junction < halfSpan) {
                    throw new InsufficientCorrespondenceException(i - 1, "overlap of " + overlap + " px is too narrow to blend");
                }
                blendSeam(canvasIdx, material, currX, currY, junction - halfSpan, junction + halfSpan, channels);
            }

            // Dán phần còn lại của ảnh, ghi đè lên canvas
            Mat piece = material.apply(new Rect(pieceLeft, 0, width - pieceLeft, height));
            Mat target = canvas.apply(new Rect(currX + pieceLeft, currY, width - pieceLeft, height));
            piece.copyTo(target);

            if (i < n - 1) {
                currX += shifts.get(i).getDx();
                currY += shifts.get(i).getDy();
            }
        }
        canvasIdx.release();

        // Cắt bỏ viền đen trên và dưới do lệch dọc
        return canvas.apply(new Rect(0, drift, totalWidth, totalHeight - 2 * drift));
    }

    /**
     * Linear cross-fade between what the canvas holds and the new image over
     * columns {@code [start, end)} of the new image. Arithmetic runs in double and is
     * clamped back to 8-bit.
     */
    static void blendSeam(UByteIndexer canvasIdx, Mat material, int offsetX, int offsetY, int start, int end, int channels) {
        double span = end - start;
        UByteIndexer materialIdx = material.createIndexer();
        int height = material.rows();
        for (int r = 0; r < height; r++) {
            for (int c = start; c < end; c++) {
                double alpha = (c - start) / span;
                for (int ch = 0; ch < channels; ch++) {
                    int oldPx = canvasIdx.get(offsetY + r, offsetX + c, ch);
                    int newPx = materialIdx.get(r, c, ch);
                    long mixed = Math.round(oldPx * (1 - alpha) + newPx * alpha);
                    canvasIdx.put(offsetY + r, offsetX + c, ch, (int) Math.max(0, Math.min(255, mixed)));
                }
            }
        }
        materialIdx.release();
    }
}
