package com.matching.API;

import com.matching.registration.GroundControlPoint;
import com.matching.registration.MatchingOptions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api")
@CrossOrigin(origins = "*")
public class MatchingController {

    @Autowired
    private MatchingService matchingService;

    @Autowired
    private ImageUploadService imageUploadService;

    @PostMapping(value = "/match", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> matchImages(
            @RequestParam(value = "first", required = false) MultipartFile first,
            @RequestParam(value = "second", required = false) MultipartFile second,
            @RequestParam(value = "octaveStart", required = false) Integer octaveStart,
            @RequestParam(value = "octaveEnd", required = false) Integer octaveEnd,
            @RequestParam(value = "surfThreshold", required = false) Double surfThreshold,
            @RequestParam(value = "matchingThreshold", required = false) Double matchingThreshold) {

        if (first == null || second == null) {
            return badRequest("Please upload both images (parts 'first' and 'second').");
        }
        for (MultipartFile image : List.of(first, second)) {
            if (!imageUploadService.isValidImageFile(image)) {
                return badRequest("Invalid image file: " + image.getOriginalFilename());
            }
        }

        List<Path> stored = null;
        try {
            MatchingOptions options = matchingService.resolveOptions(octaveStart, octaveEnd, surfThreshold, matchingThreshold);
            stored = imageUploadService.storeMultiple(List.of(first, second));

            List<GroundControlPoint> points = matchingService.matchImages(stored.get(0), stored.get(1), options);

            Map<String, Object> response = new HashMap<>();
            response.put("success", true);
            response.put("count", points.size());
            response.put("points", points);
            log.info("Matched {} and {}: {} points", first.getOriginalFilename(), second.getOriginalFilename(), points.size());
            return ResponseEntity.ok().body(response);

        } catch (IllegalArgumentException e) {
            log.warn("Rejected match request: {}", e.getMessage());
            return badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Matching failed", e);
            Map<String, String> error = new HashMap<>();
            error.put("error", "Error: " + e.getMessage());
            return ResponseEntity.internalServerError().body(error);
        } finally {
            cleanUp(stored);
        }
    }

    /**
     * Request parameters that cannot be converted (e.g. octaveStart=abc) get the same JSON error body.
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Map<String, String>> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        log.warn("Rejected match request: bad value '{}' for parameter {}", e.getValue(), e.getName());
        return badRequest("Invalid value '" + e.getValue() + "' for parameter '" + e.getName() + "'");
    }

    private void cleanUp(List<Path> stored) {
        try {
            imageUploadService.deleteStored(stored);
        } catch (IOException e) {
            log.warn("Could not delete uploaded images {}", stored, e);
        }
    }

    private static ResponseEntity<Map<String, String>> badRequest(String message) {
        Map<String, String> error = new HashMap<>();
        error.put("error", message);
        return ResponseEntity.badRequest().body(error);
    }
}
