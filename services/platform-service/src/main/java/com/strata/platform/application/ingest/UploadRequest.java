package com.strata.platform.application.ingest;

import java.util.Optional;

/**
 * Fields collected from a multipart upload, independent of the order the parts arrived in.
 *
 * @param targetTenantId raw {@code target_client_id} text, if sent and non-empty
 * @param fileName       declared name of the uploaded file
 * @param content        file bytes, null when no file part was sent
 */
public record UploadRequest(String targetTenantId, String fileName, byte[] content) {

    public static final String TARGET_FIELD = "target_client_id";
    public static final String FILE_FIELD = "file";
    static final String DEFAULT_FILE_NAME = "dataset";

    public Optional<String> target() {
        return Optional.ofNullable(targetTenantId).filter(s -> !s.isBlank());
    }

    public boolean hasFile() {
        return content != null;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Accumulates parts as they are read. Unknown fields are ignored; a repeated part replaces
     * the earlier one.
     */
    public static final class Builder {

        private String targetTenantId;
        private String fileName;
        private byte[] content;

        private Builder() {}

        public Builder field(String name, String value) {
            if (TARGET_FIELD.equals(name)) {
                targetTenantId = value;
            }
            return this;
        }

        public Builder file(String name, String originalFileName, byte[] bytes) {
            if (FILE_FIELD.equals(name)) {
                fileName = originalFileName == null || originalFileName.isBlank()
                        ? DEFAULT_FILE_NAME
                        : originalFileName;
                content = bytes;
            }
            return this;
        }

        public UploadRequest build() {
            return new UploadRequest(targetTenantId, fileName == null ? DEFAULT_FILE_NAME : fileName, content);
        }
    }
}
