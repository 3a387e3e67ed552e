package com.panorama.API;

import com.panorama.config.PanoramaProperties;
import com.panorama.imageStitching.Direction;
import com.panorama.imageStitching.PanoramicImage;
import com.panorama.imageStitching.StitchingOptions;
import com.panorama.imageStitching.feature.DetectorType;
import lombok.extern.slf4j.Slf4j;
import org.bytedeco.opencv.opencv_core.Mat;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;

import static org.bytedeco.opencv.global.opencv_imgcodecs.imwrite;

@Slf4j
@Service
public class StitchingService {
    static final String[] VARIANT_NAMES = {"color", "color_equalized", "gray", "gray_equalized"};

    private final PanoramaProperties properties;
    private final ImageStorageService imageStorageService;
    private final ExecutorService executor;

    public StitchingService(PanoramaProperties properties,
                            ImageStorageService imageStorageService,
                            @Qualifier("stitchingExecutor") ExecutorService executor) {
        this.properties = properties;
        this.imageStorageService = imageStorageService;
        this.executor = executor;
    }

    /**
     * Stitches {@code inputs} and writes the results under {@code <output-dir>/<jobId>}.
     *
     * @return File names relative to the output directory
     */
    public StitchingResult stitchImages(String jobId, List<Path> inputs, StitchingRequest request) throws IOException {
        StitchingOptions options = toOptions(request);
        List<Mat> images = imageStorageService.readImages(inputs);
        log.info("Job {}: stitching {} images, half fov {} deg, {} order", jobId, images.size(),
                options.getHalfFovDegrees(), options.getDirection());

        PanoramicImage panorama = new PanoramicImage(images, options, executor);
        List<Mat> variants = panorama.getAll(request.isDraw());

        Path outputPath = Paths.get(properties.getOutputDir()).resolve(jobId);
        Files.createDirectories(outputPath);

        List<String> variantFiles = new ArrayList<>();
        for (int i = 0; i < variants.size(); i++) {
            variantFiles.add(jobId + "/" + write(outputPath, "panorama_" + VARIANT_NAMES[i] + ".png", variants.get(i)));
        }
        List<String> matchFiles = new ArrayList<>();
        List<Mat> matchImages = panorama.matchImages();
        for (int i = 0; i < matchImages.size(); i++) {
            matchFiles.add(jobId + "/" + write(outputPath, String.format("matches_%02d_%02d.png", i, i + 1), matchImages.get(i)));
        }
        log.info(">>> DONE: {}", variantFiles);
        return new StitchingResult(variantFiles, matchFiles);
    }

    StitchingOptions toOptions(StitchingRequest request) {
        double fov = request.getFov() != null ? request.getFov() : properties.getFov();
        double distRatio = request.getDistRatio() != null ? request.getDistRatio() : properties.getDistRatio();
        Direction direction = request.getDirection() != null
                ? Direction.fromName(request.getDirection()) : properties.getDirection();
        DetectorType detector = request.getDetector() != null
                ? DetectorType.fromName(request.getDetector()) : properties.getDetector();

        return StitchingOptions.builder()
                .halfFovDegrees(fov / 2)
                .distRatio(distRatio)
                .direction(direction)
                .extractor(detector.create(properties.getOrbMaxFeatures()))
                .ransacThreshold(properties.getRansacThreshold())
                .minInliers(properties.getMinInliers())
                .build();
    }

    private static String write(Path dir, String name, Mat image) throws IOException {
        Path target = dir.resolve(name);
        if (!imwrite(target.toString(), image)) {
            throw new IOException("Cannot write " + target);
        }
        return name;
    }
}
