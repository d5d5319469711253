package com.matching.API;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

@Slf4j
@Service
public class ImageUploadService {

	// Thư mục gốc lưu ảnh upload, mỗi request có một thư mục con riêng
	private final Path uploadsPath;

	public ImageUploadService(@Value("${matching.upload-dir}") String uploadDir) {
		this.uploadsPath = Paths.get(uploadDir);
	}

	/**
	 * Lưu các file ảnh của một request vào thư mục con mới.
	 * Trả về danh sách đường dẫn theo đúng thứ tự upload.
	 */
	public List<Path> storeMultiple(List<MultipartFile> files) throws IOException {
		createDirectoryIfNotExists(uploadsPath);
		Path requestDir = Files.createTempDirectory(uploadsPath, "match-");

		List<Path> savedPaths = new ArrayList<>();
		int index = 0;
		for (MultipartFile file : files) {
			String filename = file.getOriginalFilename();
			if (filename == null || filename.isEmpty()) {
				filename = "image.jpg";
			}
			// Prefix keeps two uploads with the same name apart
			Path targetPath = requestDir.resolve(index++ + "_" + Paths.get(filename).getFileName());
			try (InputStream in = file.getInputStream()) {
				Files.copy(in, targetPath, StandardCopyOption.REPLACE_EXISTING);
			}
			savedPaths.add(targetPath);
		}
		log.debug("Stored {} uploaded images in {}", savedPaths.size(), requestDir);
		return savedPaths;
	}

	/**
	 * Xóa thư mục con của request sau khi xử lý xong.
	 */
	public void deleteStored(List<Path> stored) throws IOException {
		if (stored == null || stored.isEmpty()) return;
		Path requestDir = stored.get(0).getParent();
		if (requestDir == null || !Files.exists(requestDir)) return;

		try (Stream<Path> files = Files.list(requestDir)) {
			for (Path file : files.collect(Collectors.toList())) {
				Files.deleteIfExists(file);
			}
		}
		Files.deleteIfExists(requestDir);
	}

	/**
	 * Kiểm tra xem file upload có phải ảnh không
	 */
	public boolean isValidImageFile(MultipartFile file) {
		if (file == null || file.isEmpty()) return false;

		String contentType = file.getContentType();
		if (contentType == null || !contentType.startsWith("image/")) {
			return false;
		}

		String originalFilename = file.getOriginalFilename();
		return originalFilename != null &&
				originalFilename.matches("(?i).+\\.(jpg|jpeg|png|gif|bmp|webp|tif|tiff)$");
	}

	private void createDirectoryIfNotExists(Path path) throws IOException {
		if (!Files.exists(path)) {
			Files.createDirectories(path);
		}
	}

	public Path getUploadsPath() {
		return uploadsPath;
	}
}
