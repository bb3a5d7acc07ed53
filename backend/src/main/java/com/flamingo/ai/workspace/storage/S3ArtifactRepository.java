package com.flamingo.ai.workspace.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.workspace.exception.WorkspaceStorageException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.CopyObjectRequest;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Object;

/**
 * {@link ArtifactRepository} backed by an S3-compatible object store.
 *
 * <p>Every key is stored below {@code {prefix}/}. Chunk rewrites upload the new chunk set under a
 * staging prefix and copy the live set to a backup prefix before copying the new set into place.
 * When the swap fails the live set is restored from the backup. Staging and backup objects are
 * removed on every path.
 */
@Slf4j
public class S3ArtifactRepository extends AbstractArtifactRepository {

  private final S3Client s3Client;
  private final String bucket;
  private final String prefix;

  public S3ArtifactRepository(
      S3Client s3Client, String bucket, String prefix, ObjectMapper objectMapper) {
    super(objectMapper);
    if (bucket == null || bucket.isBlank()) {
      throw new IllegalStateException(
          "S3 bucket is required. Set workspace.storage.s3.bucket (WORKSPACE_S3_BUCKET).");
    }
    this.s3Client = s3Client;
    this.bucket = bucket;
    this.prefix = prefix == null ? "" : stripSlashes(prefix);
    log.info("S3 artifact repository initialized: bucket={}, prefix={}", bucket, this.prefix);
  }

  private String objectKey(String key) {
    return prefix.isEmpty() ? key : prefix + "/" + key;
  }

  private String relativeKey(String objectKey) {
    return prefix.isEmpty() ? objectKey : objectKey.substring(prefix.length() + 1);
  }

  @Override
  protected Optional<byte[]> readBytes(String key) {
    try {
      return Optional.of(
          s3Client
              .getObjectAsBytes(GetObjectRequest.builder().bucket(bucket).key(objectKey(key)).build())
              .asByteArray());
    } catch (NoSuchKeyException e) {
      return Optional.empty();
    } catch (SdkException e) {
      log.error("Failed to read s3://{}/{}: {}", bucket, objectKey(key), e.getMessage(), e);
      throw new WorkspaceStorageException(key, "Failed to read object", e);
    }
  }

  @Override
  protected void writeBytes(String key, byte[] data, String contentType) {
    try {
      s3Client.putObject(
          PutObjectRequest.builder()
              .bucket(bucket)
              .key(objectKey(key))
              .contentType(contentType)
              .build(),
          RequestBody.fromBytes(data));
    } catch (SdkException e) {
      log.error("Failed to write s3://{}/{}: {}", bucket, objectKey(key), e.getMessage(), e);
      throw new WorkspaceStorageException(key, "Failed to write object", e);
    }
  }

  @Override
  protected boolean exists(String key) {
    try {
      s3Client.headObject(HeadObjectRequest.builder().bucket(bucket).key(objectKey(key)).build());
      return true;
    } catch (NoSuchKeyException e) {
      return false;
    } catch (S3Exception e) {
      if (e.statusCode() == 404) {
        return false;
      }
      log.error("Failed to check s3://{}/{}: {}", bucket, objectKey(key), e.getMessage(), e);
      throw new WorkspaceStorageException(key, "Failed to check object", e);
    }
  }

  @Override
  protected List<String> listFiles(String dirKey) {
    String listPrefix = objectKey(dirKey) + "/";
    List<String> keys = new ArrayList<>();
    String continuationToken = null;
    try {
      do {
        ListObjectsV2Response response =
            s3Client.listObjectsV2(
                ListObjectsV2Request.builder()
                    .bucket(bucket)
                    .prefix(listPrefix)
                    .continuationToken(continuationToken)
                    .build());
        for (S3Object object : response.contents()) {
          keys.add(relativeKey(object.key()));
        }
        continuationToken =
            Boolean.TRUE.equals(response.isTruncated()) ? response.nextContinuationToken() : null;
      } while (continuationToken != null);
    } catch (SdkException e) {
      log.error("Failed to list s3://{}/{}: {}", bucket, listPrefix, e.getMessage(), e);
      throw new WorkspaceStorageException(dirKey, "Failed to list objects", e);
    }
    keys.sort(String::compareTo);
    return keys;
  }

  @Override
  protected void move(String fromKey, String toKey) {
    copy(fromKey, toKey);
    delete(fromKey);
  }

  @Override
  protected void replaceDirectory(String dirKey, Map<String, byte[]> files) {
    String suffix = UUID.randomUUID().toString().substring(0, 8);
    String stagingDir = dirKey + ".staging-" + suffix;
    String backupDir = dirKey + ".backup-" + suffix;
    List<String> staged = new ArrayList<>();
    List<String> backedUp = new ArrayList<>();
    try {
      for (Map.Entry<String, byte[]> file : files.entrySet()) {
        String stagedKey = stagingDir + "/" + file.getKey();
        writeBytes(stagedKey, file.getValue(), contentType(stagedKey));
        staged.add(file.getKey());
      }
      List<String> existing = listFiles(dirKey);
      for (String key : existing) {
        String name = key.substring(dirKey.length() + 1);
        copy(key, backupDir + "/" + name);
        backedUp.add(name);
      }
      try {
        Set<String> targets = new HashSet<>();
        for (String name : staged) {
          String target = dirKey + "/" + name;
          copy(stagingDir + "/" + name, target);
          targets.add(target);
        }
        for (String key : existing) {
          if (!targets.contains(key)) {
            delete(key);
          }
        }
      } catch (WorkspaceStorageException e) {
        restore(dirKey, backupDir, backedUp, e);
        throw e;
      }
    } finally {
      for (String name : staged) {
        deleteQuietly(stagingDir + "/" + name);
      }
      for (String name : backedUp) {
        deleteQuietly(backupDir + "/" + name);
      }
    }
  }

  /** Puts the backed-up objects back under {@code dirKey} and drops any object that is new. */
  private void restore(
      String dirKey, String backupDir, List<String> backedUp, WorkspaceStorageException failure) {
    try {
      Set<String> original = new HashSet<>();
      for (String name : backedUp) {
        original.add(dirKey + "/" + name);
      }
      for (String key : listFiles(dirKey)) {
        if (!original.contains(key)) {
          delete(key);
        }
      }
      for (String name : backedUp) {
        copy(backupDir + "/" + name, dirKey + "/" + name);
      }
      log.warn("Restored {} objects under {} after a failed rewrite", backedUp.size(), dirKey);
    } catch (WorkspaceStorageException e) {
      log.error("Failed to restore {} from {}: {}", dirKey, backupDir, e.getMessage());
      failure.addSuppressed(e);
    }
  }

  private void deleteQuietly(String key) {
    try {
      delete(key);
    } catch (WorkspaceStorageException e) {
      log.warn("Failed to remove temporary object {}: {}", key, e.getMessage());
    }
  }

  private void copy(String fromKey, String toKey) {
    try {
      s3Client.copyObject(
          CopyObjectRequest.builder()
              .sourceBucket(bucket)
              .sourceKey(objectKey(fromKey))
              .destinationBucket(bucket)
              .destinationKey(objectKey(toKey))
              .build());
    } catch (SdkException e) {
      log.error("Failed to copy {} to {}: {}", fromKey, toKey, e.getMessage(), e);
      throw new WorkspaceStorageException(fromKey, "Failed to copy object to " + toKey, e);
    }
  }

  private void delete(String key) {
    try {
      s3Client.deleteObject(
          DeleteObjectRequest.builder().bucket(bucket).key(objectKey(key)).build());
    } catch (SdkException e) {
      log.error("Failed to delete s3://{}/{}: {}", bucket, objectKey(key), e.getMessage(), e);
      throw new WorkspaceStorageException(key, "Failed to delete object", e);
    }
  }

  private static String stripSlashes(String value) {
    String result = value;
    while (result.startsWith("/")) {
      result = result.substring(1);
    }
    while (result.endsWith("/")) {
      result = result.substring(0, result.length() - 1);
    }
    return result;
  }
}
