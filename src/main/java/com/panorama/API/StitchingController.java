package com.panorama.API;

import com.panorama.imageStitching.exception.InsufficientCorrespondenceException;
import com.panorama.imageStitching.exception.PanoramaConfigurationException;
import com.panorama.imageStitching.exception.PanoramaException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Slf4j
@RestController
@RequestMapping("/api")
@CrossOrigin(origins = "*")
public class StitchingController {
    private static final String RESULT_URL_PREFIX = "/panorama/";

    private final StitchingService stitchingService;
    private final ImageStorageService imageStorageService;

    public StitchingController(StitchingService stitchingService, ImageStorageService imageStorageService) {
        this.stitchingService = stitchingService;
        this.imageStorageService = imageStorageService;
    }

    @PostMapping(value = "/panorama", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> stitchImages(
            @RequestParam(value = "images", required = false) List<MultipartFile> images,
            @RequestParam(value = "fov", required = false) Double fov,
            @RequestParam(value = "direction", required = false) String direction,
            @RequestParam(value = "detector", required = false) String detector,
            @RequestParam(value = "distRatio", required = false) Double distRatio,
            @RequestParam(value = "draw", defaultValue = "false") boolean draw) {
        if (images == null || images.size() < 2) {
            return error(HttpStatus.BAD_REQUEST, "At least 2 images are needed.");
        }
        for (MultipartFile image : images) {
            if (!imageStorageService.isValidImageFile(image)) {
                return error(HttpStatus.BAD_REQUEST, "Not an image: " + image.getOriginalFilename());
            }
        }

        StitchingRequest request = StitchingRequest.builder()
                .fov(fov)
                .direction(direction)
                .detector(detector)
                .distRatio(distRatio)
                .draw(draw)
                .build();
        String jobId = UUID.randomUUID().toString();
        try {
            StitchingResult result;
            try {
                List<Path> stored = imageStorageService.storeMultiple(jobId, images);
                result = stitchingService.stitchImages(jobId, stored, request);
            } finally {
                imageStorageService.deleteJob(jobId);
            }

            Map<String, Object> response = new HashMap<>();
            response.put("success", true);
            response.put("variants", toUrls(result.getVariants()));
            response.put("matchImages", toUrls(result.getMatchImages()));
            return ResponseEntity.ok().body(response);
        } catch (PanoramaConfigurationException e) {
            return error(HttpStatus.BAD_REQUEST, e.getMessage());
        } catch (InsufficientCorrespondenceException e) {
            return error(HttpStatus.UNPROCESSABLE_ENTITY, e.getMessage());
        } catch (PanoramaException | IOException e) {
            log.error("Stitching failed", e);
            return error(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
        }
    }

    private static List<String> toUrls(List<String> names) {
        List<String> urls = new ArrayList<>(names.size());
        for (String name : names) {
            urls.add(RESULT_URL_PREFIX + name);
        }
        return urls;
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, String message) {
        Map<String, String> body = new HashMap<>();
        body.put("error", message);
        return ResponseEntity.status(status).body(body);
    }
}
