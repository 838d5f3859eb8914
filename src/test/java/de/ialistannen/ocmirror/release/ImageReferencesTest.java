package de.ialistannen.ocmirror.release;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import de.ialistannen.ocmirror.image.ImageReference;
import java.io.UncheckedIOException;
import org.junit.jupiter.api.Test;

class ImageReferencesTest {

  private static final String DIGEST = "sha256:" + "a".repeat(64);
  private static final String DOCUMENT = """
    {
      "kind": "ImageStream",
      "apiVersion": "image.openshift.io/v1",
      "metadata": {"name": "4.4.6"},
      "spec": {
        "tags": [
          {"name": "cli", "annotations": {"io.openshift.build.source-location": "https://github.com/openshift/oc"},
           "from": {"kind": "DockerImage", "name": "quay.io/openshift-release-dev/ocp-v4.0-art-dev@%s"}},
          {"name": "empty", "from": {"kind": "DockerImage", "name": ""}},
          {"name": "no-from"}
        ]
      }
    }
    """.formatted(DIGEST);

  @Test
  void readsNameAndTagsWithImages() {
    ImageReferences references = ImageReferences.parse(DOCUMENT);

    assertThat(references.name()).isEqualTo("4.4.6");
    assertThat(references.tags()).containsExactly(new ImageReferences.Tag(
      "cli",
      ImageReference.parse("quay.io/openshift-release-dev/ocp-v4.0-art-dev@" + DIGEST)
    ));
  }

  @Test
  void rewriteKeepsEverythingButTheImages() {
    ImageReferences references = ImageReferences.parse(DOCUMENT);

    String rewritten = references.rewrite(reference -> reference.withEndpoint("mirror.local"));

    ImageReferences parsed = ImageReferences.parse(rewritten);
    assertThat(parsed.name()).isEqualTo("4.4.6");
    assertThat(parsed.tags()).singleElement()
      .satisfies(tag -> assertThat(tag.image().toString())
        .isEqualTo("mirror.local/openshift-release-dev/ocp-v4.0-art-dev@" + DIGEST));
    assertThat(rewritten).contains("io.openshift.build.source-location");
    assertThat(references.tags().get(0).image().endpoint()).isEqualTo("quay.io");
  }

  @Test
  void rewriteOfCompactDocumentOnlyChangesEndpoints() {
    String compact = "{\"kind\":\"ImageStream\",\"metadata\":{\"name\":\"4.4.6\"},\"spec\":{\"tags\":["
      + "{\"name\":\"cli\",\"from\":{\"kind\":\"DockerImage\",\"name\":\"quay.io/ocp/art-dev@" + DIGEST + "\"}},"
      + "{\"name\":\"empty\",\"from\":{\"kind\":\"DockerImage\",\"name\":\"\"}}]}}";

    String rewritten = ImageReferences.parse(compact).rewrite(reference -> reference.withEndpoint("mirror.local"));

    assertThat(rewritten).isEqualTo(compact.replace("quay.io/", "mirror.local/"));
  }

  @Test
  void rejectsNonObjects() {
    assertThatThrownBy(() -> ImageReferences.parse("[]")).isInstanceOf(UncheckedIOException.class);
    assertThatThrownBy(() -> ImageReferences.parse("{nope")).isInstanceOf(UncheckedIOException.class);
  }
}
