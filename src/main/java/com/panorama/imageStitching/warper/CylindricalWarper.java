package com.panorama.imageStitching.warper;

import com.panorama.imageStitching.exception.PanoramaConfigurationException;
import org.bytedeco.javacpp.FloatPointer;
import org.bytedeco.opencv.opencv_core.*;

import static org.bytedeco.opencv.global.opencv_core.*;
import static org.bytedeco.opencv.global.opencv_imgproc.*;

public class CylindricalWarper {

    private CylindricalWarper() {
    }

    /**
     * Chiếu ảnh lên mặt trụ có tiêu cự suy ra từ nửa góc nhìn.
     * Ảnh kết quả cùng kích thước với ảnh gốc, phần nằm ngoài ảnh gốc để đen.
     *
     * @param image      Ảnh gốc (BGR hoặc xám)
     * @param halfFovRad Nửa góc nhìn của camera, tính bằng radian
     * @return Ảnh đã chiếu trụ
     */
    public static Mat warp(Mat image, double halfFovRad) {
        if (!(halfFovRad > 0) || halfFovRad >= Math.PI / 2) {
            throw new PanoramaConfigurationException("Half field of view must be in (0, pi/2) radians, got " + halfFovRad);
        }
        int width = image.cols();
        int height = image.rows();
        double f = focalLength(width, halfFovRad);

        Mat mapX = new Mat(height, width, CV_32F);
        Mat mapY = new Mat(height, width, CV_32F);

        float xc = width / 2.0f;
        float yc = height / 2.0f;

        float[] xData = new float[width * height];
        float[] yData = new float[width * height];

        // Map ngược: tọa độ đích trên mặt trụ -> tọa độ nguồn trên ảnh phẳng
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                double theta = (x - xc) / f;
                int index = y * width + x;
                xData[index] = (float) (f * Math.tan(theta) + xc);
                yData[index] = (float) ((y - yc) / Math.cos(theta) + yc);
            }
        }

        new FloatPointer(mapX.data()).put(xData);
        new FloatPointer(mapY.data()).put(yData);

        Mat result = new Mat();
        remap(image, result, mapX, mapY, INTER_LINEAR, BORDER_CONSTANT, new Scalar(0, 0, 0, 0));

        mapX.release();
        mapY.release();

        return result;
    }

    /**
     * f = width / (2 tan(half_fov))
     */
    public static double focalLength(int width, double halfFovRad) {
        return width / (2.0 * Math.tan(halfFovRad));
    }
}
