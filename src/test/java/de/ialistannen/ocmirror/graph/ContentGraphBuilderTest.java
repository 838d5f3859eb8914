package de.ialistannen.ocmirror.graph;

import static de.ialistannen.ocmirror.testing.TestImages.utf8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import de.ialistannen.ocmirror.image.BlobDigest;
import de.ialistannen.ocmirror.image.ImageReference;
import de.ialistannen.ocmirror.image.ManifestDocument;
import de.ialistannen.ocmirror.image.Platform;
import de.ialistannen.ocmirror.testing.InMemoryRegistry;
import de.ialistannen.ocmirror.testing.TestImages;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ContentGraphBuilderTest {

  private static final ImageReference ROOT = ImageReference.parse("quay.io/ocp/release:4.8");
  private static final ImageReference COMPONENT = ImageReference.parse("quay.io/ocp/component:latest");

  @Test
  void collectsManifestListChildrenAndSharedBlobs() throws Exception {
    InMemoryRegistry registry = new InMemoryRegistry();
    byte[] sharedLayer = utf8("shared");
    ImageReference amd64 = TestImages.pushImage(registry, ROOT.withTag(null), Map.of(), List.of(sharedLayer));
    ImageReference arm64 = TestImages.pushImage(
      registry,
      ROOT.withTag(null),
      Map.of("arch", "arm64"),
      List.of(utf8("arm"))
    );
    Map<Platform, BlobDigest> entries = new LinkedHashMap<>();
    entries.put(Platform.LINUX_AMD64, amd64.digest());
    entries.put(new Platform("linux", "arm64", null), arm64.digest());
    ManifestDocument list = TestImages.manifestList(entries);
    registry.putManifest(ROOT, list);
    ImageReference component = TestImages.pushImage(registry, COMPONENT, Map.of(), List.of(sharedLayer));

    ContentGraphBuilder builder = new ContentGraphBuilder(registry);
    ImageReference root = builder.addRoot(ROOT, list);
    builder.add(component.withTag(null), "component");
    ContentGraph graph = builder.build();

    assertThat(root).isEqualTo(ROOT.withTag(null).withDigest(list.digest()));
    assertThat(graph.root()).isEqualTo(root);
    assertThat(graph.rootDigest()).isEqualTo(list.digest());
    assertThat(graph.rootManifest()).isEqualTo(list);

    assertThat(graph.manifests()).containsOnlyKeys(
      root,
      ROOT.withTag(null).withDigest(amd64.digest()),
      ROOT.withTag(null).withDigest(arm64.digest()),
      COMPONENT.withTag(null).withDigest(component.digest())
    );
    assertThat(graph.manifests().get(root)).isEqualTo("4.8");
    assertThat(graph.manifests().get(ROOT.withTag(null).withDigest(amd64.digest()))).isEqualTo("4.8");
    assertThat(graph.manifests().get(COMPONENT.withTag(null).withDigest(component.digest()))).isEqualTo("component");

    assertThat(graph.blobs().get(BlobDigest.of(sharedLayer)))
      .containsExactly("quay.io/ocp/component", "quay.io/ocp/release");
    assertThat(graph.blobs().get(BlobDigest.of(utf8("arm")))).containsExactly("quay.io/ocp/release");
  }

  @Test
  void addingTheSameImageTwiceKeepsFirstLabel() throws Exception {
    InMemoryRegistry registry = new InMemoryRegistry();
    ImageReference root = TestImages.pushImage(registry, ROOT, Map.of(), List.of(utf8("root")));
    ImageReference component = TestImages.pushImage(registry, COMPONENT, Map.of(), List.of(utf8("c")));

    ContentGraphBuilder builder = new ContentGraphBuilder(registry);
    builder.addRoot(ROOT, registry.fetchManifest(root));
    builder.add(component.withTag(null), "first");
    builder.add(component.withTag(null), "second");

    assertThat(builder.build().manifests()).hasSize(2).containsValue("first").doesNotContainValue("second");
  }

  @Test
  void missingImageIsResolutionFailure() throws Exception {
    InMemoryRegistry registry = new InMemoryRegistry();
    ContentGraphBuilder builder = new ContentGraphBuilder(registry);

    assertThatThrownBy(() -> builder.add(COMPONENT, "component"))
      .isInstanceOf(ReferenceResolutionException.class)
      .hasMessageContaining("quay.io/ocp/component:latest");
  }

  @Test
  void buildNeedsRoot() {
    assertThatThrownBy(() -> new ContentGraphBuilder(new InMemoryRegistry()).build())
      .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void selectsPlatformImageAndReadsConfig() throws Exception {
    InMemoryRegistry registry = new InMemoryRegistry();
    ImageReference amd64 = TestImages.pushImage(registry, ROOT.withTag(null), Map.of("a", "b"), List.of());
    ManifestDocument list = TestImages.manifestList(Map.of(Platform.LINUX_AMD64, amd64.digest()));
    registry.putManifest(ROOT, list);

    PlatformImage image = PlatformImage.select(registry, ROOT, list, Platform.LINUX_AMD64);

    assertThat(image.reference()).isEqualTo(amd64);
    assertThat(image.config().label("a")).contains("b");
    assertThatThrownBy(() -> PlatformImage.select(registry, ROOT, list, Platform.parse("linux/ppc64le")))
      .isInstanceOf(ReferenceResolutionException.class);
  }
}
