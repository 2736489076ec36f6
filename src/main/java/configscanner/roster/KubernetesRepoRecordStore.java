package configscanner.roster;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.GenericKubernetesResourceList;
import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.dsl.MixedOperation;
import io.fabric8.kubernetes.client.dsl.NonNamespaceOperation;
import io.fabric8.kubernetes.client.dsl.Resource;
import io.fabric8.kubernetes.client.dsl.base.ResourceDefinitionContext;

/**
 * {@code Repo} custom resources ({@code ai-pipeline.org/v1alpha1}) in one namespace.
 *
 * The push time lives in {@code status.remotePosition.lastModified}.
 */
public class KubernetesRepoRecordStore implements RepoRecordStore {

  private static final Logger log = LoggerFactory.getLogger(KubernetesRepoRecordStore.class);
  public static final String API_VERSION = "ai-pipeline.org/v1alpha1";
  static final ResourceDefinitionContext REPO = new ResourceDefinitionContext.Builder()
    .withGroup("ai-pipeline.org")
    .withVersion("v1alpha1")
    .withKind("Repo")
    .withPlural("repos")
    .withNamespaced(true)
    .build();

  private final KubernetesClient client;
  private final String namespace;

  public KubernetesRepoRecordStore(KubernetesClient client, String namespace) {
    this.client = client;
    this.namespace = namespace;
  }

  private NonNamespaceOperation<GenericKubernetesResource, GenericKubernetesResourceList, Resource<GenericKubernetesResource>> repos() {
    MixedOperation<GenericKubernetesResource, GenericKubernetesResourceList, Resource<GenericKubernetesResource>> all = client
      .genericKubernetesResources(REPO);
    return all.inNamespace(namespace);
  }

  @Override
  public List<RepoRecord> list() throws IOException {
    try {
      List<RepoRecord> records = new ArrayList<>();
      for (GenericKubernetesResource r : repos().list().getItems()) {
        Map<String, String> annotations = r.getMetadata().getAnnotations();
        String source = annotations == null ? null : annotations.get(SOURCE_ANNOTATION);
        if (source == null || !source.startsWith(GITHUB_SOURCE_PREFIX)) {
          continue;
        }
        Map<String, Object> spec = child(r.getAdditionalProperties(), "spec");
        records.add(new RepoRecord(
          r.getMetadata().getName(),
          lastModified(r),
          (String) spec.get("httpsURL"),
          (String) spec.get("sshURL"),
          (String) spec.get("organization"),
          source));
      }
      return records;
    } catch (KubernetesClientException e) {
      throw new IOException("Could not list repos in " + namespace, e);
    }
  }

  @Override
  public void create(RepoRecord record, String workspace) throws IOException {
    Map<String, Object> spec = new LinkedHashMap<>();
    spec.put("workspace", workspace);
    spec.put("httpsURL", record.httpsUrl);
    spec.put("sshURL", record.sshUrl);
    spec.put("organization", record.organization);

    GenericKubernetesResource resource = new GenericKubernetesResource();
    resource.setApiVersion(API_VERSION);
    resource.setKind(REPO.getKind());
    resource.setMetadata(new ObjectMetaBuilder()
      .withName(record.name)
      .withNamespace(namespace)
      .withAnnotations(Collections.singletonMap(SOURCE_ANNOTATION, record.source))
      .build());
    resource.setAdditionalProperty("spec", spec);
    try {
      GenericKubernetesResource created = repos().resource(resource).create();
      log.debug("Created {}/{} at version {}", namespace, record.name, created.getMetadata().getResourceVersion());
      if (record.lastModified != null) {
        created.setAdditionalProperty("status", statusWith(record.lastModified));
        repos().resource(created).updateStatus();
      }
    } catch (KubernetesClientException e) {
      throw new IOException("Could not create repo " + namespace + "/" + record.name, e);
    }
  }

  @Override
  public void delete(String name) throws IOException {
    try {
      repos().withName(name).delete();
    } catch (KubernetesClientException e) {
      throw new IOException("Could not delete repo " + namespace + "/" + name, e);
    }
  }

  @Override
  public void updateLastModified(String name, long lastModified) throws IOException {
    try {
      repos().withName(name).editStatus(r -> {
        Map<String, Object> status = new LinkedHashMap<>(child(r.getAdditionalProperties(), "status"));
        Map<String, Object> remotePosition = new LinkedHashMap<>(child(status, "remotePosition"));
        remotePosition.put("lastModified", lastModified);
        status.put("remotePosition", remotePosition);
        r.setAdditionalProperty("status", status);
        return r;
      });
    } catch (KubernetesClientException e) {
      throw new IOException("Could not update repo " + namespace + "/" + name, e);
    }
  }

  private static Map<String, Object> statusWith(long lastModified) {
    Map<String, Object> remotePosition = new LinkedHashMap<>();
    remotePosition.put("lastModified", lastModified);
    Map<String, Object> status = new LinkedHashMap<>();
    status.put("remotePosition", remotePosition);
    return status;
  }

  private static Long lastModified(GenericKubernetesResource r) {
    Object value = child(child(r.getAdditionalProperties(), "status"), "remotePosition").get("lastModified");
    return value instanceof Number ? ((Number) value).longValue() : null;
  }

  @SuppressWarnings("unchecked")
  static Map<String, Object> child(Map<String, Object> parent, String key) {
    Object value = parent == null ? null : parent.get(key);
    return value instanceof Map ? (Map<String, Object>) value : Collections.emptyMap();
  }

}
