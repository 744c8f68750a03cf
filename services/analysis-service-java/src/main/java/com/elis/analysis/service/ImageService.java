package com.elis.analysis.service;

import com.elis.analysis.model.Image;
import com.elis.analysis.model.ImageSource;
import com.elis.analysis.model.User;
import com.elis.analysis.repository.ImageRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;

@Service
public class ImageService {

    private static final Logger log = LoggerFactory.getLogger(ImageService.class);
    private static final Set<String> EXTENSIONS = Set.of("png", "jpg", "jpeg", "gif", "webp", "tiff", "bmp");

    private final ImageRepository imageRepository;
    private final WorkspaceStorage storage;

    public ImageService(ImageRepository imageRepository, WorkspaceStorage storage) {
        this.imageRepository = imageRepository;
        this.storage = storage;
    }

    @Transactional
    public Image upload(MultipartFile file, User user) {
        if (file == null || file.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "File is empty");
        }
        String filename = file.getOriginalFilename();
        if (filename == null || !EXTENSIONS.contains(extension(filename))) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unsupported image type, expected one of " + EXTENSIONS);
        }

        var image = imageRepository.save(new Image(filename, "", file.getSize(), ImageSource.UPLOADED, user));
        Path directory = storage.imageDir(user.getId(), image.getId());
        try {
            Path stored = storage.store(file, directory);
            image.setFilePath(stored.toString());
            image.setFileSize(Files.size(stored));
        } catch (IOException e) {
            storage.deleteQuietly(directory);
            throw new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to store image", e);
        }
        log.info("Image {} uploaded by {}", image.getId(), user.getId());
        return image;
    }

    @Transactional(readOnly = true)
    public Image getImage(UUID imageId, UUID userId) {
        return imageRepository.findByIdAndUser_Id(imageId, userId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Image not found"));
    }

    @Transactional(readOnly = true)
    public List<Image> listImages(UUID userId) {
        return imageRepository.findByUser_IdOrderByUploadedAtDesc(userId);
    }

    private static String extension(String filename) {
        int dot = filename.lastIndexOf('.');
        return dot < 0 ? "" : filename.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
