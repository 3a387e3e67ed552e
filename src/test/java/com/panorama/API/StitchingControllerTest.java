package com.panorama.API;

import com.panorama.imageStitching.exception.InsufficientCorrespondenceException;
import com.panorama.imageStitching.exception.PanoramaConfigurationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(StitchingController.class)
class StitchingControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private StitchingService stitchingService;

    @MockBean
    private ImageStorageService imageStorageService;

    private final MockMultipartFile first = new MockMultipartFile("images", "a.png", "image/png", new byte[]{1});
    private final MockMultipartFile second = new MockMultipartFile("images", "b.png", "image/png", new byte[]{2});
    private final List<Path> stored = Arrays.asList(Paths.get("uploads/a.png"), Paths.get("uploads/b.png"));

    @BeforeEach
    void setUp() throws Exception {
        when(imageStorageService.isValidImageFile(any())).thenReturn(true);
        when(imageStorageService.storeMultiple(anyString(), anyList())).thenReturn(stored);
    }

    @Test
    void needsAtLeastTwoImages() throws Exception {
        mockMvc.perform(multipart("/api/panorama").file(first))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").exists());

        verify(stitchingService, never()).stitchImages(anyString(), anyList(), any());
    }

    @Test
    void rejectsNonImageUpload() throws Exception {
        MockMultipartFile text = new MockMultipartFile("images", "notes.txt", "text/plain", new byte[]{3});
        when(imageStorageService.isValidImageFile(argThat(f -> f != null && "notes.txt".equals(f.getOriginalFilename()))))
                .thenReturn(false);

        mockMvc.perform(multipart("/api/panorama").file(first).file(text))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Not an image: notes.txt"));
    }

    @Test
    void returnsUrlsOfWrittenPanoramas() throws Exception {
        when(stitchingService.stitchImages(anyString(), any(), any())).thenReturn(new StitchingResult(
                Arrays.asList("panorama_color.png", "panorama_color_equalized.png",
                        "panorama_gray.png", "panorama_gray_equalized.png"),
                Collections.singletonList("matches_00_01.png")));

        mockMvc.perform(multipart("/api/panorama").file(first).file(second)
                        .param("fov", "66")
                        .param("direction", "l")
                        .param("draw", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.variants[0]").value("/panorama/job/panorama_color.png"))
                .andExpect(jsonPath("$.variants.length()").value(4))
                .andExpect(jsonPath("$.matchImages[0]").value("/panorama/job/matches_00_01.png"));
    }

    @Test
    void eachRequestUsesOneJobAndCleansUpOnFailure() throws Exception {
        when(stitchingService.stitchImages(anyString(), any(), any()))
                .thenThrow(new InsufficientCorrespondenceException(0, "no inliers"));

        mockMvc.perform(multipart("/api/panorama").file(first).file(second))
                .andExpect(status().isUnprocessableEntity());

        ArgumentCaptor<String> jobId = ArgumentCaptor.forClass(String.class);
        verify(imageStorageService).storeMultiple(jobId.capture(), anyList());
        verify(stitchingService).stitchImages(eq(jobId.getValue()), eq(stored), any());
        verify(imageStorageService).deleteJob(jobId.getValue());
    }

    @Test
    void duplicateFileNamesAreBadRequest() throws Exception {
        when(imageStorageService.storeMultiple(anyString(), anyList()))
                .thenThrow(new PanoramaConfigurationException("Duplicate file name a.png"));

        mockMvc.perform(multipart("/api/panorama").file(first).file(first))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Duplicate file name a.png"));

        verify(stitchingService, never()).stitchImages(anyString(), anyList(), any());
        verify(imageStorageService).deleteJob(anyString());
    }

    @Test
    void configurationErrorIsBadRequest() throws Exception {
        when(stitchingService.stitchImages(anyString(), any(), any()))
                .thenThrow(new PanoramaConfigurationException("Unknown detector: surf"));

        mockMvc.perform(multipart("/api/panorama").file(first).file(second).param("detector", "surf"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Unknown detector: surf"));
    }

    @Test
    void missingCorrespondencesIsUnprocessable() throws Exception {
        when(stitchingService.stitchImages(anyString(), any(), any()))
                .thenThrow(new InsufficientCorrespondenceException(0, "no inliers"));

        mockMvc.perform(multipart("/api/panorama").file(first).file(second))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("Pair 0-1: no inliers"));
    }
}
