package com.flamingo.ai.workspace.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.workspace.storage.ArtifactRepository;
import com.flamingo.ai.workspace.storage.LocalPathArtifactRepository;
import com.flamingo.ai.workspace.storage.S3ArtifactRepository;
import java.net.URI;
import java.nio.file.Path;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;

/** Selects the artifact repository backend from {@code workspace.storage.type}. */
@Configuration
public class StorageConfig {

  static final String LOCAL = "local";
  static final String S3 = "s3";

  @Bean(destroyMethod = "close")
  @ConditionalOnProperty(name = "workspace.storage.type", havingValue = S3)
  public S3Client s3Client(WorkspaceConfig workspaceConfig) {
    WorkspaceConfig.Storage.S3 s3 = workspaceConfig.getStorage().getS3();
    S3ClientBuilder builder =
        S3Client.builder().region(Region.of(s3.getRegion())).forcePathStyle(s3.isPathStyleAccess());
    if (s3.getEndpoint() != null && !s3.getEndpoint().isBlank()) {
      builder.endpointOverride(URI.create(s3.getEndpoint()));
    }
    if (s3.getAccessKey() != null && !s3.getAccessKey().isBlank()) {
      builder.credentialsProvider(
          StaticCredentialsProvider.create(
              AwsBasicCredentials.create(s3.getAccessKey(), s3.getSecretKey())));
    } else {
      builder.credentialsProvider(DefaultCredentialsProvider.create());
    }
    return builder.build();
  }

  @Bean
  public ArtifactRepository artifactRepository(
      WorkspaceConfig workspaceConfig,
      ObjectMapper objectMapper,
      ObjectProvider<S3Client> s3Client) {
    WorkspaceConfig.Storage storage = workspaceConfig.getStorage();
    return switch (storage.getType()) {
      case LOCAL -> new LocalPathArtifactRepository(
          Path.of(storage.getLocal().getBasePath(), workspaceConfig.getId()), objectMapper);
      case S3 -> new S3ArtifactRepository(
          s3Client.getObject(),
          storage.getS3().getBucket(),
          joinPrefix(storage.getS3().getPrefix(), workspaceConfig.getId()),
          objectMapper);
      default -> throw new IllegalStateException(
          "Unsupported storage type '" + storage.getType() + "', expected local or s3");
    };
  }

  private static String joinPrefix(String prefix, String workspaceId) {
    return prefix == null || prefix.isBlank() ? workspaceId : prefix + "/" + workspaceId;
  }
}
