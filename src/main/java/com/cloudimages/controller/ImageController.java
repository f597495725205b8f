package com.cloudimages.controller;

import com.cloudimages.dto.ImageResponse;
import com.cloudimages.dto.ImageStats;
import com.cloudimages.dto.ImageUpdateRequest;
import com.cloudimages.dto.UploadCommand;
import com.cloudimages.entity.ImageEntity;
import com.cloudimages.exception.ValidationException;
import com.cloudimages.service.ImageUploadService;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static com.cloudimages.controller.StorageProviderController.USER_HEADER;

/**
 * REST controller for image upload and management.
 *
 * Endpoints:
 * GET /api/images: list the caller's images, newest first
 * POST /api/images: multipart upload (file, providerId?, tags?, optimize?)
 * GET /api/images/stats: totals and bytes saved
 * GET /api/images/{id}: image details including the provider URL
 * PATCH /api/images/{id}: update tags and/or metadata
 * DELETE /api/images/{id}: delete remote blob and record
 * GET /api/images/{id}/content: stored bytes
 */
@RestController
@RequestMapping("/api/images")
public class ImageController {

    private final ImageUploadService imageService;

    public ImageController(ImageUploadService imageService) {
        this.imageService = imageService;
    }

    @GetMapping
    public ResponseEntity<List<ImageResponse>> list(@RequestHeader(USER_HEADER) String userId) {
        return ResponseEntity.ok(imageService.list(userId).stream()
                .map(ImageResponse::from)
                .collect(Collectors.toList()));
    }

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ImageResponse> upload(@RequestHeader(USER_HEADER) String userId,
            @RequestParam("file") MultipartFile file,
            @RequestParam(value = "providerId", required = false) Long providerId,
            @RequestParam(value = "tags", required = false) List<String> tags,
            @RequestParam(value = "optimize", defaultValue = "true") boolean optimize) {
        UploadCommand command = new UploadCommand(readBytes(file), file.getOriginalFilename(), file.getContentType());
        command.setProviderId(providerId);
        command.setTags(tags);
        command.setOptimize(optimize);

        ImageEntity image = imageService.upload(userId, command);
        return ResponseEntity.status(HttpStatus.CREATED).body(ImageResponse.from(image));
    }

    @GetMapping("/stats")
    public ResponseEntity<ImageStats> stats(@RequestHeader(USER_HEADER) String userId) {
        return ResponseEntity.ok(imageService.stats(userId));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ImageResponse> get(@RequestHeader(USER_HEADER) String userId, @PathVariable Long id) {
        ImageEntity image = imageService.get(id, userId);
        ImageResponse response = ImageResponse.from(image);
        response.setUrl(imageService.publicUrl(image));
        return ResponseEntity.ok(response);
    }

    @PatchMapping("/{id}")
    public ResponseEntity<ImageResponse> update(@RequestHeader(USER_HEADER) String userId,
            @PathVariable Long id,
            @RequestBody ImageUpdateRequest request) {
        return ResponseEntity.ok(ImageResponse.from(imageService.update(id, userId, request)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Map<String, Object>> delete(@RequestHeader(USER_HEADER) String userId,
            @PathVariable Long id) {
        imageService.delete(id, userId);
        return ResponseEntity.ok(Map.of("status", "deleted", "id", id));
    }

    @GetMapping("/{id}/content")
    public ResponseEntity<byte[]> content(@RequestHeader(USER_HEADER) String userId, @PathVariable Long id) {
        ImageEntity image = imageService.get(id, userId);
        byte[] data = imageService.download(image);
        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(image.getContentType()))
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.inline().filename(image.getOriginalFilename()).build().toString())
                .body(data);
    }

    private static byte[] readBytes(MultipartFile file) {
        try {
            return file.getBytes();
        } catch (IOException e) {
            throw new ValidationException("Uploaded file could not be read: " + e.getMessage());
        }
    }
}
