package com.strata.platform.api;

import com.strata.platform.api.dto.UploadResponse;
import com.strata.platform.application.ingest.IngestionPipeline;
import com.strata.platform.application.ingest.UploadRequest;
import com.strata.platform.error.PlatformException;
import com.strata.security.AuthorizationPolicy;
import com.strata.security.Principal;
import jakarta.servlet.http.HttpServletRequest;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.multipart.MultipartHttpServletRequest;

/**
 * Multipart dataset upload: an optional {@code target_client_id} field and one {@code file} part,
 * in any order.
 */
@RestController
@RequestMapping("/api")
public class UploadController {

    private final IngestionPipeline pipeline;

    public UploadController(IngestionPipeline pipeline) {
        this.pipeline = pipeline;
    }

    @PostMapping("/upload")
    public UploadResponse upload(Principal principal, HttpServletRequest request) throws IOException {
        // refuse before any part is read
        AuthorizationPolicy.enforce(AuthorizationPolicy.evaluateUploadEligibility(principal));
        if (!(request instanceof MultipartHttpServletRequest multipart)) {
            throw PlatformException.badRequest("Expected a multipart/form-data body");
        }

        UploadRequest.Builder builder = UploadRequest.builder();
        for (Map.Entry<String, String[]> field : multipart.getParameterMap().entrySet()) {
            String[] values = field.getValue();
            if (values.length > 0) {
                builder.field(field.getKey(), values[values.length - 1]);
            }
        }
        for (Map.Entry<String, List<MultipartFile>> part : multipart.getMultiFileMap().entrySet()) {
            for (MultipartFile file : part.getValue()) {
                builder.file(part.getKey(), file.getOriginalFilename(), file.getBytes());
            }
        }
        return UploadResponse.from(pipeline.ingest(principal, builder.build()));
    }
}
