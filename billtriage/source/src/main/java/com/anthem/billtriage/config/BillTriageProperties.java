package com.anthem.billtriage.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings under {@code billtriage.*}.
 */
@Data
@ConfigurationProperties(prefix = "billtriage")
public class BillTriageProperties {

    private Aws aws = new Aws();

    /** Table holding procedure code to category rows. */
    private String categoryTable = "dim_proc";

    @Data
    public static class Aws {
        private String region = "us-east-1";

        /** Endpoint override, e.g. LocalStack. Blank uses the AWS default. */
        private String endpoint;

        private S3 s3 = new S3();
    }

    @Data
    public static class S3 {
        private String bucket;
        private String failsPrefix = "data/hcfa_json/valid/mapped/staging/fails/";
        private String resolvedPrefix = "data/hcfa_json/readyforprocess/";
    }
}
