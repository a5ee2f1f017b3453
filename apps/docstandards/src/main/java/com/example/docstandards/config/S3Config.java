package com.example.docstandards.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.http.nio.netty.NettyNioAsyncHttpClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3AsyncClient;
import software.amazon.awssdk.services.s3.S3AsyncClientBuilder;

import java.net.URI;

/**
 * S3 client backing the document blob store. Only created when {@code app.blob.type=s3}.
 */
@Configuration
@ConditionalOnProperty(name = "app.blob.type", havingValue = "s3", matchIfMissing = true)
public class S3Config {

    @Bean
    public S3AsyncClient s3AsyncClient(AppProperties properties) {
        AppProperties.Blob blob = properties.getBlob();

        S3AsyncClientBuilder builder = S3AsyncClient.builder()
                .region(Region.of(blob.getRegion()))
                .credentialsProvider(credentials(blob))
                .httpClientBuilder(NettyNioAsyncHttpClient.builder()
                        .connectionTimeout(blob.getConnectTimeout())
                        .readTimeout(blob.getReadTimeout())
                        .writeTimeout(blob.getReadTimeout()));

        if (hasText(blob.getEndpoint())) {
            // MinIO and LocalStack only serve path-style URLs
            builder.endpointOverride(URI.create(blob.getEndpoint()))
                    .forcePathStyle(true);
        }

        return builder.build();
    }

    private static AwsCredentialsProvider credentials(AppProperties.Blob blob) {
        if (hasText(blob.getAccessKeyId()) && hasText(blob.getSecretAccessKey())) {
            return StaticCredentialsProvider.create(
                    AwsBasicCredentials.create(blob.getAccessKeyId(), blob.getSecretAccessKey()));
        }
        return DefaultCredentialsProvider.create();
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
