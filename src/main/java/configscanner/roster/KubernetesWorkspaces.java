package configscanner.roster;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.dsl.base.ResourceDefinitionContext;

/**
 * Finds roster targets from the cluster's {@code Workspace} resources: each names a GitHub
 * organization (and maybe a team) in {@code spec.auth}, and its namespace in {@code status.namespaceName}.
 */
public class KubernetesWorkspaces {

  private static final Logger log = LoggerFactory.getLogger(KubernetesWorkspaces.class);

  static final ResourceDefinitionContext WORKSPACE = new ResourceDefinitionContext.Builder()
    .withGroup("ai-pipeline.org")
    .withVersion("v1alpha1")
    .withKind("Workspace")
    .withPlural("workspaces")
    .withNamespaced(false)
    .build();

  private final KubernetesClient client;

  public KubernetesWorkspaces(KubernetesClient client) {
    this.client = client;
  }

  /** @return a target per workspace; workspaces that are not set up yet are skipped */
  public List<SyncTarget> allTargets() throws IOException {
    List<GenericKubernetesResource> workspaces;
    try {
      workspaces = client.genericKubernetesResources(WORKSPACE).list().getItems();
    } catch (KubernetesClientException e) {
      throw new IOException("Could not list workspaces", e);
    }
    List<SyncTarget> targets = new ArrayList<>();
    for (GenericKubernetesResource workspace : workspaces) {
      try {
        targets.add(toTarget(workspace));
      } catch (IOException e) {
        log.warn("Skipping: {}", e.getMessage());
      }
    }
    return targets;
  }

  public SyncTarget forWorkspace(String name) throws IOException {
    GenericKubernetesResource workspace;
    try {
      workspace = client.genericKubernetesResources(WORKSPACE).withName(name).get();
    } catch (KubernetesClientException e) {
      throw new IOException("Could not get workspace " + name, e);
    }
    if (workspace == null) {
      throw new IOException("No workspace " + name);
    }
    return toTarget(workspace);
  }

  static SyncTarget toTarget(GenericKubernetesResource workspace) throws IOException {
    String name = workspace.getMetadata().getName();
    Map<String, Object> auth = KubernetesRepoRecordStore.child(KubernetesRepoRecordStore.child(workspace.getAdditionalProperties(), "spec"), "auth");
    Object organization = auth.get("organization");
    Object namespace = KubernetesRepoRecordStore.child(workspace.getAdditionalProperties(), "status").get("namespaceName");
    if (organization == null || namespace == null) {
      throw new IOException("Workspace " + name + " has no organization or namespace yet");
    }
    Object team = auth.get("team");
    return new SyncTarget(organization.toString(), team == null ? null : team.toString(), namespace.toString(), name);
  }

}
