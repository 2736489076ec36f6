package configscanner.roster;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.fail;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.Test;

import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;

public class KubernetesWorkspacesTest {

  private static GenericKubernetesResource workspace(String organization, String team, String namespace) {
    Map<String, Object> auth = new LinkedHashMap<>();
    if (organization != null) {
      auth.put("organization", organization);
    }
    if (team != null) {
      auth.put("team", team);
    }
    Map<String, Object> spec = new LinkedHashMap<>();
    spec.put("auth", auth);
    GenericKubernetesResource resource = new GenericKubernetesResource();
    resource.setMetadata(new ObjectMetaBuilder().withName("ws").build());
    resource.setAdditionalProperty("spec", spec);
    if (namespace != null) {
      Map<String, Object> status = new LinkedHashMap<>();
      status.put("namespaceName", namespace);
      resource.setAdditionalProperty("status", status);
    }
    return resource;
  }

  @Test
  public void testToTarget() throws Exception {
    SyncTarget target = KubernetesWorkspaces.toTarget(workspace("org", "team", "ws-ns"));
    assertThat(target.organization, is("org"));
    assertThat(target.team, is("team"));
    assertThat(target.namespace, is("ws-ns"));
    assertThat(target.workspace, is("ws"));
  }

  @Test
  public void testToTargetWithoutTeam() throws Exception {
    SyncTarget target = KubernetesWorkspaces.toTarget(workspace("org", null, "ws-ns"));
    assertThat(target.team, is(nullValue()));
    assertThat(target.source(), is("github:org"));
  }

  @Test
  public void testWorkspaceNotReady() {
    try {
      KubernetesWorkspaces.toTarget(workspace("org", null, null));
      fail();
    } catch (IOException e) {
      assertThat(e.getMessage(), is("Workspace ws has no organization or namespace yet"));
    }
  }

  @Test
  public void testChildOfMissingIsEmpty() {
    assertThat(KubernetesRepoRecordStore.child(null, "spec").isEmpty(), is(true));
    assertThat(KubernetesRepoRecordStore.child(workspace("org", null, null).getAdditionalProperties(), "status").isEmpty(), is(true));
  }

}
