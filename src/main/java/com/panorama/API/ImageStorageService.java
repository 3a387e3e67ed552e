package com.panorama.API;

import com.panorama.config.PanoramaProperties;
import com.panorama.imageStitching.exception.PanoramaConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.bytedeco.opencv.opencv_core.Mat;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.*;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.bytedeco.opencv.global.opencv_imgcodecs.IMREAD_COLOR;
import static org.bytedeco.opencv.global.opencv_imgcodecs.imread;

@Slf4j
@Service
public class ImageStorageService {

	private final Path uploadsPath;

	public ImageStorageService(PanoramaProperties properties) {
		this.uploadsPath = Paths.get(properties.getUploadDir());
	}

	/**
	 * Thư mục upload riêng của một request
	 */
	public Path jobUploadsPath(String jobId) {
		return uploadsPath.resolve(jobId);
	}

	/**
	 * Lưu danh sách ảnh upload vào thư mục của job, trả về đường dẫn đã sắp xếp theo tên file
	 */
	public List<Path> storeMultiple(String jobId, List<MultipartFile> files) throws IOException {
		Path jobPath = jobUploadsPath(jobId);
		Files.createDirectories(jobPath);

		List<Path> savedPaths = new ArrayList<>();
		Set<String> names = new HashSet<>();
		int index = 0;
		for (MultipartFile file : files) {
			String filename = file.getOriginalFilename();
			if (filename == null || filename.isEmpty()) {
				filename = String.format("image_%03d.png", index);
			}
			// Bỏ phần thư mục trong tên file do client gửi lên
			String name = Paths.get(filename).getFileName().toString();
			// Thứ tự ghép lấy theo tên file nên tên trùng là không xác định
			if (!names.add(name)) {
				throw new PanoramaConfigurationException("Duplicate file name " + name);
			}
			Path targetPath = jobPath.resolve(name);
			try (InputStream in = file.getInputStream()) {
				Files.copy(in, targetPath, StandardCopyOption.REPLACE_EXISTING);
			}
			savedPaths.add(targetPath);
			index++;
		}

		savedPaths.sort(Comparator.comparing(p -> p.getFileName().toString()));
		log.info("Stored {} uploads in {}", savedPaths.size(), jobPath);
		return savedPaths;
	}

	/**
	 * Xóa ảnh upload của job sau khi ghép xong
	 */
	public void deleteJob(String jobId) throws IOException {
		Path jobPath = jobUploadsPath(jobId);
		if (!Files.exists(jobPath)) {
			return;
		}

		List<Path> uploads;
		try (Stream<Path> files = Files.list(jobPath)) {
			uploads = files.collect(Collectors.toList());
		}
		for (Path file : uploads) {
			Files.delete(file);
		}
		Files.delete(jobPath);
		log.debug("Deleted {} uploads of job {}", uploads.size(), jobId);
	}

	/**
	 * Đọc ảnh BGR theo đúng thứ tự đường dẫn
	 */
	public List<Mat> readImages(List<Path> paths) {
		List<Mat> images = new ArrayList<>(paths.size());
		for (Path path : paths) {
			Mat image = imread(path.toString(), IMREAD_COLOR);
			if (image.empty()) {
				throw new PanoramaConfigurationException("Cannot decode image " + path.getFileName());
			}
			images.add(image);
		}
		return images;
	}

	/**
	 * Kiểm tra xem file upload có phải ảnh không
	 */
	public boolean isValidImageFile(MultipartFile file) {
		if (file == null) return false;

		String contentType = file.getContentType();
		if (contentType == null || !contentType.startsWith("image/")) {
			return false;
		}

		String originalFilename = file.getOriginalFilename();
		return originalFilename != null &&
				originalFilename.matches("(?i).+\\.(jpg|jpeg|png|bmp|tif|tiff|webp)$");
	}

	public Path getUploadsPath() {
		return uploadsPath;
	}
}
