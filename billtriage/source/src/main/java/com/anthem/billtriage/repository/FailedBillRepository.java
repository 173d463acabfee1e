package com.anthem.billtriage.repository;

import com.anthem.billtriage.config.BillTriageProperties;
import com.anthem.billtriage.model.AssignmentResult;
import com.anthem.billtriage.model.FailedBill;
import com.anthem.billtriage.parser.FailedBillParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Object;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Failed bills stored as JSON objects under the fails prefix of the triage bucket.
 */
@Repository
public class FailedBillRepository {

    private static final Logger log = LoggerFactory.getLogger(FailedBillRepository.class);

    static final String RATE_ASSIGNMENT_FIELD = "rate_assignment";

    private final S3Client s3Client;
    private final FailedBillParser parser;
    private final ObjectMapper objectMapper;
    private final BillTriageProperties properties;

    public FailedBillRepository(S3Client s3Client, FailedBillParser parser, ObjectMapper objectMapper,
                                BillTriageProperties properties) {
        this.s3Client = s3Client;
        this.parser = parser;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    /**
     * Every failed bill, in key order. Unreadable objects come back as READ_ERROR bills.
     */
    public List<FailedBill> findAll() {
        String prefix = failsPrefix();
        List<FailedBill> bills = new ArrayList<>();
        String continuationToken = null;
        do {
            ListObjectsV2Response page = s3Client.listObjectsV2(ListObjectsV2Request.builder()
                    .bucket(bucket())
                    .prefix(prefix)
                    .continuationToken(continuationToken)
                    .build());
            for (S3Object object : page.contents()) {
                String key = object.key();
                String filename = key.substring(prefix.length());
                if (!key.endsWith(".json") || filename.isEmpty() || filename.contains("/")) {
                    continue;
                }
                bills.add(load(filename, key));
            }
            continuationToken = Boolean.TRUE.equals(page.isTruncated()) ? page.nextContinuationToken() : null;
        } while (continuationToken != null);
        log.info("Loaded failed bills: bucket={}, prefix={}, count={}", bucket(), prefix, bills.size());
        return bills;
    }

    public Optional<FailedBill> findByFilename(String filename) {
        String key = failsKey(filename);
        if (!exists(key)) {
            return Optional.empty();
        }
        return Optional.of(load(filename, key));
    }

    /**
     * Move a resolved bill out of the failed set: the stored JSON gains a {@code rate_assignment}
     * block, is written under the resolved prefix and removed from the fails prefix.
     */
    public void markResolved(String filename, AssignmentResult result) {
        String sourceKey = failsKey(filename);
        String targetKey = properties.getAws().getS3().getResolvedPrefix() + filename;

        JsonNode stored;
        try {
            stored = objectMapper.readTree(getBytes(sourceKey).asByteArray());
        } catch (IOException e) {
            throw new IllegalStateException("Stored bill is not readable JSON: " + sourceKey, e);
        }
        ObjectNode document = stored != null && stored.isObject()
                ? (ObjectNode) stored
                : objectMapper.createObjectNode();
        document.set(RATE_ASSIGNMENT_FIELD, objectMapper.valueToTree(result));

        String body;
        try {
            body = objectMapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize resolved bill: " + filename, e);
        }

        s3Client.putObject(PutObjectRequest.builder()
                        .bucket(bucket())
                        .key(targetKey)
                        .contentType("application/json")
                        .build(),
                RequestBody.fromString(body));
        s3Client.deleteObject(DeleteObjectRequest.builder()
                .bucket(bucket())
                .key(sourceKey)
                .build());

        log.info("Moved resolved bill: filename={}, from={}, to={}", filename, sourceKey, targetKey);
    }

    private FailedBill load(String filename, String key) {
        try {
            return parser.parse(filename, getBytes(key).asByteArray());
        } catch (IOException | RuntimeException e) {
            log.warn("Unreadable failed bill, reporting READ_ERROR: key={}, error={}", key, e.getMessage());
            return parser.readError(filename);
        }
    }

    private boolean exists(String key) {
        try {
            s3Client.headObject(HeadObjectRequest.builder()
                    .bucket(bucket())
                    .key(key)
                    .build());
            return true;
        } catch (NoSuchKeyException e) {
            return false;
        } catch (S3Exception e) {
            if (e.statusCode() == 404) {
                return false;
            }
            throw e;
        }
    }

    private ResponseBytes<GetObjectResponse> getBytes(String key) {
        return s3Client.getObjectAsBytes(GetObjectRequest.builder()
                .bucket(bucket())
                .key(key)
                .build());
    }

    private String failsKey(String filename) {
        if (filename == null || filename.isBlank() || filename.contains("/") || filename.contains("..")) {
            throw new IllegalArgumentException("Invalid filename: " + filename);
        }
        return failsPrefix() + filename;
    }

    private String failsPrefix() {
        return properties.getAws().getS3().getFailsPrefix();
    }

    private String bucket() {
        return properties.getAws().getS3().getBucket();
    }
}
