package de.ialistannen.ocmirror.dump;

import static de.ialistannen.ocmirror.testing.TestImages.utf8;
import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableList;
import de.ialistannen.ocmirror.gpg.GpgTrust;
import de.ialistannen.ocmirror.graph.ContentGraph;
import de.ialistannen.ocmirror.graph.ContentGraphBuilder;
import de.ialistannen.ocmirror.image.BlobDigest;
import de.ialistannen.ocmirror.image.ImageReference;
import de.ialistannen.ocmirror.operator.OperatorMetadata;
import de.ialistannen.ocmirror.operator.OperatorRecord;
import de.ialistannen.ocmirror.release.ReleaseMetadata;
import de.ialistannen.ocmirror.signing.SignatureType;
import de.ialistannen.ocmirror.signing.SignatureVerification;
import de.ialistannen.ocmirror.testing.InMemoryRegistry;
import de.ialistannen.ocmirror.testing.TestImages;
import java.net.URI;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MetadataLoggerTest {

  private static final ImageReference ROOT = ImageReference.parse("quay.io/ocp/release:4.8.0");

  private ContentGraph graph;
  private ImageReference component;

  @BeforeEach
  void setUp() throws Exception {
    InMemoryRegistry registry = new InMemoryRegistry();
    component = TestImages.pushImage(registry, ImageReference.parse("quay.io/ocp/art-dev"), Map.of(), List.of());
    TestImages.pushImage(registry, ROOT, Map.of("io.openshift.release", "4.8.0"), List.of(utf8("payload")));

    ContentGraphBuilder builder = new ContentGraphBuilder(registry);
    builder.addRoot(ROOT, registry.fetchManifest(ROOT));
    builder.add(component, "cli");
    graph = builder.build();
  }

  @Test
  void rendersReleaseMetadata() {
    SignatureVerification signature = new SignatureVerification(
      "ABCDEF0123456789ABCDEF0123456789ABCDEF01",
      "ABCDEF0123456789",
      "long",
      "short",
      null,
      "signature valid",
      Instant.parse("2021-06-01T10:00:00Z"),
      GpgTrust.ULTIMATE,
      SignatureType.ATOMIC_SIGNER,
      "Red Hat, Inc. (release key 2) <security@redhat.com>",
      true,
      URI.create("https://mirror.openshift.com/signatures/sha256=abc/signature-1")
    );
    ReleaseMetadata metadata = new ReleaseMetadata(
      graph,
      "{\"kind\": \"ImageStream\"}",
      "{\"version\": \"4.8.0\"}",
      ImmutableList.of(URI.create("https://b.example"), URI.create("https://a.example")),
      ImmutableList.of("key"),
      ImmutableList.of(signature)
    );

    ObjectNode json = new MetadataLogger(false).toJson(metadata);

    assertThat(json.path("manifestDigest").asText()).isEqualTo(graph.rootDigest().toString());
    assertThat(json.path("rawImageReferences").asText()).isEqualTo("{\"kind\": \"ImageStream\"}");
    assertThat(json.path("rawReleaseMetadata").asText()).contains("4.8.0");
    assertThat(json.path("manifests").path(component.toString()).asText()).isEqualTo("cli");
    assertThat(json.path("blobs").size()).isEqualTo(graph.blobs().size());
    assertThat(texts(json.path("signatureStores"))).containsExactly("https://b.example", "https://a.example");
    assertThat(texts(json.path("signingKeys"))).containsExactly("key");

    JsonNode renderedSignature = json.path("signatures").get(0);
    assertThat(renderedSignature.path("type").asText()).isEqualTo("atomicsigner");
    assertThat(renderedSignature.path("valid").asBoolean()).isTrue();
    assertThat(renderedSignature.path("trust").asText()).isEqualTo("ULTIMATE");
    assertThat(renderedSignature.path("timestamp").asText()).isEqualTo("2021-06-01T10:00:00Z");
    assertThat(renderedSignature.path("statusAtomic").isNull()).isTrue();
  }

  @Test
  void sortingOrdersListsAndOperators() {
    OperatorMetadata metadata = new OperatorMetadata(
      "/database/index.db",
      utf8("sqlite"),
      ImmutableList.of(
        operator("ocs-operator", "stable-4.8"),
        operator("local-storage-operator", "4.8")
      ),
      graph,
      ImmutableList.of(URI.create("https://b.example"), URI.create("https://a.example")),
      ImmutableList.of(),
      ImmutableList.of()
    );

    ObjectNode unsorted = new MetadataLogger(false).toJson(metadata);
    ObjectNode sorted = new MetadataLogger(true).toJson(metadata);

    assertThat(unsorted.path("indexDatabase").asText()).isEqualTo("/database/index.db");
    assertThat(unsorted.path("indexDatabaseSize").asInt()).isEqualTo(6);
    assertThat(unsorted.path("indexDatabaseDigest").asText()).isEqualTo(BlobDigest.of(utf8("sqlite")).toString());
    assertThat(unsorted.path("operators").get(0).path("package").asText()).isEqualTo("ocs-operator");
    assertThat(sorted.path("operators").get(0).path("package").asText()).isEqualTo("local-storage-operator");
    assertThat(texts(sorted.path("signatureStores"))).containsExactly("https://a.example", "https://b.example");
    assertThat(texts(sorted.path("operators").get(1).path("relatedImages")))
      .containsExactly("quay.io/a/image:1", "quay.io/b/image:1");
  }

  @Test
  void renderingSortsKeysAtEveryLevel() {
    OperatorMetadata metadata = new OperatorMetadata(
      "/database/index.db",
      utf8("sqlite"),
      ImmutableList.of(operator("ocs-operator", "stable-4.8")),
      graph,
      ImmutableList.of(),
      ImmutableList.of(),
      ImmutableList.of()
    );

    MetadataLogger sortingLogger = new MetadataLogger(true);
    String sorted = sortingLogger.render(sortingLogger.toJson(metadata));
    MetadataLogger plainLogger = new MetadataLogger(false);
    String unsorted = plainLogger.render(plainLogger.toJson(metadata));

    assertThat(sorted.indexOf("\"blobs\"")).isLessThan(sorted.indexOf("\"indexDatabase\""));
    assertThat(sorted.indexOf("\"manifests\"")).isLessThan(sorted.indexOf("\"operators\""));
    assertThat(sorted.indexOf("\"bundle\"")).isLessThan(sorted.indexOf("\"channel\""));
    assertThat(sorted.indexOf("\"channel\"")).isLessThan(sorted.indexOf("\"package\""));

    assertThat(unsorted.indexOf("\"indexDatabase\"")).isLessThan(unsorted.indexOf("\"blobs\""));
    assertThat(unsorted.indexOf("\"package\"")).isLessThan(unsorted.indexOf("\"channel\""));
  }

  private OperatorRecord operator(String packageName, String channel) {
    return new OperatorRecord(
      packageName,
      channel,
      ImageReference.parse("quay.io/bundles/" + packageName + ":latest"),
      packageName + ".v1",
      ImmutableList.of(ImageReference.parse("quay.io/b/image:1"), ImageReference.parse("quay.io/a/image:1"))
    );
  }

  private static List<String> texts(JsonNode array) {
    List<String> result = new ArrayList<>();
    array.forEach(element -> result.add(element.asText()));
    return result;
  }
}
