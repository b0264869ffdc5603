package com.eainde.xrf.controller;

import com.eainde.xrf.exception.GridReadException;
import com.eainde.xrf.job.JobProcessingResult;
import com.eainde.xrf.job.UploadedSheet;
import com.eainde.xrf.job.XrfJobService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/jobs")
@RequiredArgsConstructor
public class XrfJobController {

    private final XrfJobService jobService;

    /**
     * Parses the uploaded exports and returns the job summary. A file that cannot be parsed
     * answers 422 with the reasons.
     */
    @PostMapping(path = "/{jobNumber}/summary", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> summarize(@PathVariable String jobNumber,
                                       @RequestParam(value = "commonArea", required = false) MultipartFile commonArea,
                                       @RequestParam(value = "units", required = false) MultipartFile units) {
        JobProcessingResult result = jobService.process(jobNumber, toSheet(commonArea), toSheet(units));
        if (result.isSuccess()) {
            return ResponseEntity.ok(result.summary());
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("jobNumber", jobNumber);
        body.put("errors", result.errors());
        body.put("warnings", result.warnings());
        body.put("files", result.files());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(body);
    }

    private static UploadedSheet toSheet(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            return null;
        }
        String name = file.getOriginalFilename() != null ? file.getOriginalFilename() : file.getName();
        return new UploadedSheet(name, () -> {
            try {
                return file.getInputStream();
            } catch (IOException e) {
                throw new GridReadException("Failed to open upload " + name, e);
            }
        });
    }
}
