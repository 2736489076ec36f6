package configscanner.store;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.jooq.lambda.Seq;

import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Object;

/** An {@link ObjectStore} backed by one S3 bucket. SDK failures are rethrown as {@link IOException}s. */
public class S3ObjectStore implements ObjectStore {

  private final S3Client s3;
  private final String bucket;

  /**
   * Uses {@code AWS_ACCESS_KEY}/{@code AWS_SECRET_ACCESS_KEY} if both are set, otherwise the
   * SDK's default credentials chain.
   */
  public static S3ObjectStore fromEnvironment(String bucket) throws IOException {
    String accessKey = System.getenv("AWS_ACCESS_KEY");
    String secretKey = System.getenv("AWS_SECRET_ACCESS_KEY");
    AwsCredentialsProvider credentials = StringUtils.isNoneEmpty(accessKey, secretKey)
      ? StaticCredentialsProvider.create(AwsBasicCredentials.create(accessKey, secretKey))
      : DefaultCredentialsProvider.create();
    try {
      return new S3ObjectStore(S3Client.builder().credentialsProvider(credentials).build(), bucket);
    } catch (SdkException e) {
      throw new IOException("Could not create an S3 client for " + bucket, e);
    }
  }

  public S3ObjectStore(S3Client s3, String bucket) {
    this.s3 = s3;
    this.bucket = bucket;
  }

  @Override
  public List<String> list(String prefix) throws IOException {
    ListObjectsV2Request.Builder request = ListObjectsV2Request.builder().bucket(bucket);
    if (!prefix.isEmpty()) {
      request.prefix(prefix);
    }
    try {
      return Seq.seq(s3.listObjectsV2Paginator(request.build()).contents()).map(S3Object::key).toList();
    } catch (SdkException e) {
      throw new IOException("Could not list s3://" + bucket + "/" + prefix, e);
    }
  }

  @Override
  public byte[] get(String key) throws IOException {
    try {
      return s3.getObjectAsBytes(GetObjectRequest.builder().bucket(bucket).key(key).build()).asByteArray();
    } catch (NoSuchKeyException e) {
      return null;
    } catch (SdkException e) {
      throw new IOException("Could not get s3://" + bucket + "/" + key, e);
    }
  }

  @Override
  public void put(String key, Path file) throws IOException {
    try {
      s3.putObject(PutObjectRequest.builder().bucket(bucket).key(key).build(), RequestBody.fromFile(file));
    } catch (SdkException e) {
      throw new IOException("Could not put s3://" + bucket + "/" + key, e);
    }
  }

  @Override
  public void delete(String key) throws IOException {
    try {
      s3.deleteObject(DeleteObjectRequest.builder().bucket(bucket).key(key).build());
    } catch (SdkException e) {
      throw new IOException("Could not delete s3://" + bucket + "/" + key, e);
    }
  }

  @Override
  public String toString() {
    return "s3://" + bucket;
  }

}
