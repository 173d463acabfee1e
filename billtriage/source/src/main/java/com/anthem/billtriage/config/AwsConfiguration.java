package com.anthem.billtriage.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;

import java.net.URI;

/**
 * AWS client configuration.
 *
 * When {@code billtriage.aws.endpoint} is set (LocalStack), the client uses path-style
 * addressing and static test credentials.
 */
@Configuration
public class AwsConfiguration {

    private static final Logger log = LoggerFactory.getLogger(AwsConfiguration.class);

    @Bean
    public S3Client s3Client(BillTriageProperties properties) {
        BillTriageProperties.Aws aws = properties.getAws();
        S3ClientBuilder builder = S3Client.builder().region(Region.of(aws.getRegion()));

        if (aws.getEndpoint() != null && !aws.getEndpoint().isBlank()) {
            log.info("Using S3 endpoint override: endpoint={}, region={}", aws.getEndpoint(), aws.getRegion());
            builder.endpointOverride(URI.create(aws.getEndpoint()))
                    .credentialsProvider(StaticCredentialsProvider.create(AwsBasicCredentials.create("test", "test")))
                    .forcePathStyle(true); // Required for LocalStack
        } else {
            builder.credentialsProvider(DefaultCredentialsProvider.create());
        }
        return builder.build();
    }
}
