package de.ialistannen.ocmirror.image;

import static org.assertj.core.api.Assertions.assertThat;

import de.ialistannen.ocmirror.testing.TestImages;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ManifestDocumentTest {

  private static final BlobDigest CONFIG = BlobDigest.parse("sha256:" + "c".repeat(64));
  private static final BlobDigest LAYER_1 = BlobDigest.parse("sha256:" + "1".repeat(64));
  private static final BlobDigest LAYER_2 = BlobDigest.parse("sha256:" + "2".repeat(64));

  @Test
  void readsImageManifest() {
    ManifestDocument manifest = TestImages.imageManifest(CONFIG, List.of(LAYER_1, LAYER_2));

    assertThat(manifest.isList()).isFalse();
    assertThat(manifest.mediaType()).isEqualTo(MediaTypes.DOCKER_MANIFEST_V2);
    assertThat(manifest.config()).contains(CONFIG);
    assertThat(manifest.layers()).containsExactly(LAYER_1, LAYER_2);
    assertThat(manifest.blobs()).containsExactly(CONFIG, LAYER_1, LAYER_2);
    assertThat(manifest.digest()).isEqualTo(BlobDigest.of(manifest.raw()));
  }

  @Test
  void keepsRawBytesUntouched() {
    String raw = "{\n  \"schemaVersion\": 2,   \"layers\": []\n}";
    ManifestDocument manifest = ManifestDocument.parse(
      raw.getBytes(StandardCharsets.UTF_8),
      MediaTypes.OCI_IMAGE_MANIFEST_V1 + "; charset=utf-8"
    );

    assertThat(new String(manifest.raw(), StandardCharsets.UTF_8)).isEqualTo(raw);
    assertThat(manifest.mediaType()).isEqualTo(MediaTypes.OCI_IMAGE_MANIFEST_V1);
    assertThat(manifest.config()).isEmpty();
  }

  @Test
  void selectsPlatformFromList() {
    Map<Platform, BlobDigest> entries = new LinkedHashMap<>();
    entries.put(new Platform("linux", "arm64", null), LAYER_1);
    entries.put(Platform.LINUX_AMD64, LAYER_2);
    ManifestDocument list = TestImages.manifestList(entries);

    assertThat(list.isList()).isTrue();
    assertThat(list.entries()).hasSize(2);
    assertThat(list.entryFor(Platform.LINUX_AMD64)).get()
      .extracting(ManifestDocument.Entry::digest)
      .isEqualTo(LAYER_2);
    assertThat(list.entryFor(Platform.parse("linux/s390x"))).isEmpty();
  }
}
