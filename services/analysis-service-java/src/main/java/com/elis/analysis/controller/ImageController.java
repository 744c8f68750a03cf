package com.elis.analysis.controller;

import com.elis.analysis.dto.ImageResponse;
import com.elis.analysis.model.User;
import com.elis.analysis.service.ImageService;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/images")
public class ImageController {

    private final ImageService imageService;

    public ImageController(ImageService imageService) {
        this.imageService = imageService;
    }

    @PostMapping(consumes = "multipart/form-data")
    @ResponseStatus(HttpStatus.CREATED)
    public ImageResponse upload(@RequestParam("file") MultipartFile file,
                                @AuthenticationPrincipal User user) {
        return ImageResponse.from(imageService.upload(file, user));
    }

    @GetMapping
    public List<ImageResponse> listImages(@AuthenticationPrincipal User user) {
        return imageService.listImages(user.getId())
                .stream()
                .map(ImageResponse::from)
                .toList();
    }

    @GetMapping("/{id}")
    public ImageResponse getImage(@PathVariable UUID id,
                                  @AuthenticationPrincipal User user) {
        return ImageResponse.from(imageService.getImage(id, user.getId()));
    }
}
