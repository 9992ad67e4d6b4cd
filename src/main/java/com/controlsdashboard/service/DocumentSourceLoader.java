package com.controlsdashboard.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;
import org.springframework.util.FileCopyUtils;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;

import java.io.IOException;
import java.io.InputStream;

/**
 * Reads raw document bytes from {@code s3://bucket/key}, {@code s3:///key} (default bucket),
 * {@code classpath:} or {@code file:} identifiers. Bare paths are treated as classpath resources.
 */
@Service
public class DocumentSourceLoader {

    private static final Logger logger = LoggerFactory.getLogger(DocumentSourceLoader.class);

    private final ResourceLoader resourceLoader;
    private final ObjectProvider<S3Client> s3ClientProvider;
    private final String defaultS3BucketName;

    public DocumentSourceLoader(ResourceLoader resourceLoader,
                                ObjectProvider<S3Client> s3ClientProvider,
                                @Value("${app.s3.bucket-name:}") String defaultS3BucketName) {
        this.resourceLoader = resourceLoader;
        this.s3ClientProvider = s3ClientProvider;
        this.defaultS3BucketName = defaultS3BucketName;
    }

    record S3ObjectDetails(String bucketName, String fileKey) {}

    public byte[] load(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            throw new DocumentSourceException(DocumentSourceException.Reason.INVALID_IDENTIFIER, "Document source must not be blank");
        }
        String trimmed = identifier.trim();
        if (trimmed.startsWith("s3://")) {
            return loadFromS3(parseS3Uri(trimmed));
        }
        return loadFromResource(normalizeResourceUri(trimmed));
    }

    static String normalizeResourceUri(String identifier) {
        if (identifier.startsWith("classpath:") || identifier.startsWith("file:")) {
            return identifier;
        }
        return "classpath:" + identifier;
    }

    S3ObjectDetails parseS3Uri(String s3Uri) {
        String pathPart = s3Uri.substring("s3://".length());
        if (pathPart.startsWith("/")) {
            String key = pathPart.substring(1);
            if (key.isEmpty()) {
                throw invalid("Invalid S3 URI: Key is empty for default bucket URI " + s3Uri);
            }
            if (defaultS3BucketName == null || defaultS3BucketName.isBlank()) {
                throw invalid("S3 URI " + s3Uri + " needs app.s3.bucket-name to be configured");
            }
            return new S3ObjectDetails(defaultS3BucketName, key);
        }
        int firstSlashIndex = pathPart.indexOf('/');
        if (firstSlashIndex <= 0 || firstSlashIndex == pathPart.length() - 1) {
            throw invalid("Invalid S3 URI format. Expected s3://bucket/key or s3:///key. Received: " + s3Uri);
        }
        return new S3ObjectDetails(pathPart.substring(0, firstSlashIndex), pathPart.substring(firstSlashIndex + 1));
    }

    private byte[] loadFromS3(S3ObjectDetails details) {
        logger.info("Downloading s3://{}/{}", details.bucketName(), details.fileKey());
        GetObjectRequest request = GetObjectRequest.builder()
                .bucket(details.bucketName())
                .key(details.fileKey())
                .build();
        try {
            return s3ClientProvider.getObject().getObjectAsBytes(request).asByteArray();
        } catch (NoSuchKeyException e) {
            throw new DocumentSourceException(DocumentSourceException.Reason.NOT_FOUND,
                    "S3 object not found: s3://" + details.bucketName() + "/" + details.fileKey(), e);
        } catch (SdkException e) {
            throw new DocumentSourceException(DocumentSourceException.Reason.READ_FAILED,
                    "Failed to download s3://" + details.bucketName() + "/" + details.fileKey() + ": " + e.getMessage(), e);
        }
    }

    private byte[] loadFromResource(String uri) {
        Resource resource = resourceLoader.getResource(uri);
        if (!resource.exists()) {
            throw new DocumentSourceException(DocumentSourceException.Reason.NOT_FOUND, "Resource not found: " + uri);
        }
        try (InputStream in = resource.getInputStream()) {
            byte[] bytes = FileCopyUtils.copyToByteArray(in);
            logger.info("Read {} bytes from {}", bytes.length, uri);
            return bytes;
        } catch (IOException e) {
            throw new DocumentSourceException(DocumentSourceException.Reason.READ_FAILED,
                    "Failed to read " + uri + ": " + e.getMessage(), e);
        }
    }

    private static DocumentSourceException invalid(String message) {
        return new DocumentSourceException(DocumentSourceException.Reason.INVALID_IDENTIFIER, message);
    }
}
