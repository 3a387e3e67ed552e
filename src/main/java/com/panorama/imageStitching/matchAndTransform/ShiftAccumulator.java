package com.panorama.imageStitching.matchAndTransform;

import java.util.List;

/**
 * Chains pairwise shifts into the extent of the whole panorama.
 */
public class ShiftAccumulator {

    private ShiftAccumulator() {
    }

    public static CanvasExtent accumulate(List<ShiftEstimate> shifts) {
        CanvasExtent extent = CanvasExtent.ORIGIN;
        int cumulativeX = 0;
        int cumulativeY = 0;
        for (ShiftEstimate shift : shifts) {
            // Tổng dịch chuyển (cho phép âm)
            cumulativeX += shift.getDx();
            cumulativeY += shift.getDy();
            extent = extent.include(cumulativeX, cumulativeY);
        }
        return extent;
    }
}
